package io.toolgrade.core.toolcall;

import java.util.Map;
import java.util.Objects;

/// Tool invocation actually chosen by the system under test for one case run.
///
/// @param name tool name the model called, not null
/// @param args arguments the model supplied, not null (may be empty)
/// @see ExpectedToolCall for the ground-truth counterpart
public record ActualToolCall(String name, Map<String, Object> args) {

    public ActualToolCall {
        Objects.requireNonNull(name, "name must not be null");
        args = ExpectedToolCall.ToolCallArgs.copyOf(args);
    }

    public static ActualToolCall of(String name) {
        return new ActualToolCall(name, Map.of());
    }

    public static ActualToolCall of(String name, Map<String, Object> args) {
        return new ActualToolCall(name, args);
    }

    /// Returns the supplied value for an argument, or null when absent.
    public Object arg(String field) {
        return args.get(field);
    }
}
