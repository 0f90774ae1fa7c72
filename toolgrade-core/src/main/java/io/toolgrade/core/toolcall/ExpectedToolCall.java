package io.toolgrade.core.toolcall;

import io.toolgrade.core.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Ground-truth tool invocation authored for one evaluation case.
///
/// Argument values may be `null`; a null value is treated exactly like an absent key
/// when critics decide whether a field fired.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: `args` is an unmodifiable, insertion-ordered copy
///
/// @param name tool name the model is expected to call, not null
/// @param args expected arguments keyed by parameter name, not null (may be empty)
/// @see ActualToolCall for the observed counterpart
public record ExpectedToolCall(String name, Map<String, Object> args) {

    public ExpectedToolCall {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new ValidationException("Tool call name must not be blank");
        }
        args = ToolCallArgs.copyOf(args);
    }

    /// Creates an expected call without arguments.
    ///
    /// @param name tool name, not null
    /// @return new expected call, never null
    public static ExpectedToolCall of(String name) {
        return new ExpectedToolCall(name, Map.of());
    }

    /// Creates an expected call with arguments.
    ///
    /// @param name tool name, not null
    /// @param args expected arguments, not null
    /// @return new expected call, never null
    public static ExpectedToolCall of(String name, Map<String, Object> args) {
        return new ExpectedToolCall(name, args);
    }

    /// Returns the expected value for an argument, or null when absent.
    public Object arg(String field) {
        return args.get(field);
    }

    /// Shared defensive-copy helper for tool call argument maps.
    static final class ToolCallArgs {
        private ToolCallArgs() {}

        // Map.copyOf rejects null values, which decoded JSON arguments may legitimately hold
        static Map<String, Object> copyOf(Map<String, Object> args) {
            if (args == null || args.isEmpty()) {
                return Map.of();
            }
            return Collections.unmodifiableMap(new LinkedHashMap<>(args));
        }
    }
}
