package io.toolgrade.core.tool;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Read-only view over another registry. Lookups see later changes to the backing
/// registry; {@link #register} always fails.
final class UnmodifiableToolRegistry implements ToolRegistry {

    private final ToolRegistry delegate;

    UnmodifiableToolRegistry(ToolRegistry delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void register(ToolDefinition tool) {
        throw new UnsupportedOperationException(
                "Tool catalog is read-only; cannot register '"
                        + (tool != null ? tool.name() : null)
                        + "'");
    }

    @Override
    public Optional<ToolDefinition> get(String name) {
        return delegate.get(name);
    }

    @Override
    public List<ToolDefinition> all() {
        return delegate.all();
    }

    @Override
    public boolean contains(String name) {
        return delegate.contains(name);
    }

    @Override
    public int size() {
        return delegate.size();
    }
}
