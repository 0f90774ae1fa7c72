package io.toolgrade.core.tool;

import java.util.List;
import java.util.Optional;

/// Catalog of tools available to the model during a suite run.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry catalog = new DefaultToolRegistry();
/// catalog.register(ToolDefinition.simple("archive_email", "Archive the current email"));
///
/// Optional<ToolDefinition> tool = catalog.get("archive_email");
/// List<ToolDefinition> offered = catalog.all();
/// }
///
/// @implNote Implementations should be thread-safe; the runner reads the catalog from
/// worker threads.
///
/// @see ToolDefinition for tool descriptors
public interface ToolRegistry {

    /// Registers a tool definition, replacing any tool with the same name.
    ///
    /// @param tool the tool definition to register, not null
    /// @throws NullPointerException if tool is null
    void register(ToolDefinition tool);

    /// Retrieves a tool by name.
    ///
    /// @param name the tool identifier to look up, not null
    /// @return the tool definition if found, empty otherwise
    Optional<ToolDefinition> get(String name);

    /// Returns all registered tools ordered by name.
    ///
    /// @return unmodifiable list of all tools, never null (may be empty)
    List<ToolDefinition> all();

    default boolean contains(String name) {
        return get(name).isPresent();
    }

    default int size() {
        return all().size();
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    /// Returns a read-only view of `registry`.
    ///
    /// @param registry backing registry, not null
    /// @return view whose {@link #register} throws `UnsupportedOperationException`
    static ToolRegistry unmodifiable(ToolRegistry registry) {
        if (registry instanceof UnmodifiableToolRegistry) {
            return registry;
        }
        return new UnmodifiableToolRegistry(registry);
    }
}
