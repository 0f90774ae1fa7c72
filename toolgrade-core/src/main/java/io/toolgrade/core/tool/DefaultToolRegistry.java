package io.toolgrade.core.tool;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link ToolRegistry}.
///
/// @implNote Thread-safe. Backed by a {@link ConcurrentHashMap}; {@link #all()} sorts by
/// name so the tools offered to a model are stable across runs.
public final class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();

    public DefaultToolRegistry() {}

    /// Creates a registry with initial tools.
    ///
    /// @param initialTools tools to register, not null
    public DefaultToolRegistry(List<ToolDefinition> initialTools) {
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    @Override
    public void register(ToolDefinition tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        tools.put(tool.name(), tool);
    }

    @Override
    public Optional<ToolDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public List<ToolDefinition> all() {
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolDefinition::name))
                .toList();
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }

    @Override
    public int size() {
        return tools.size();
    }
}
