package io.toolgrade.core.provider;

import io.toolgrade.core.toolcall.ActualToolCall;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Sealed hierarchy for provider responses.
///
/// - {@link ToolCalls}: the model answered, possibly with no tool calls at all
/// - {@link Error}: the invocation failed and nothing can be scored
///
/// {@snippet :
/// ToolCallResponse response = provider.requestToolCalls(request);
/// if (response instanceof ToolCallResponse.ToolCalls calls) {
///     evalCase.evaluate(calls.calls());
/// }
/// }
///
/// @see ToolCallProvider#requestToolCalls
public sealed interface ToolCallResponse
        permits ToolCallResponse.ToolCalls, ToolCallResponse.Error {

    /// Returns when this response was created.
    Instant timestamp();

    /// Tool calls chosen by the model, in the order it returned them.
    ///
    /// @param calls actual tool calls, not null (may be empty)
    /// @param timestamp when the response was created, not null
    record ToolCalls(List<ActualToolCall> calls, Instant timestamp) implements ToolCallResponse {

        public ToolCalls {
            calls = calls != null ? List.copyOf(calls) : List.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static ToolCalls of(List<ActualToolCall> calls) {
            return new ToolCalls(calls, Instant.now());
        }

        public static ToolCalls none() {
            return new ToolCalls(List.of(), Instant.now());
        }
    }

    /// Invocation failed.
    ///
    /// @param message error description, not null
    /// @param cause the underlying exception, may be null
    /// @param timestamp when the error occurred, not null
    record Error(String message, Throwable cause, Instant timestamp) implements ToolCallResponse {

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    cause,
                    Instant.now());
        }

        public static Error of(String message) {
            return new Error(message, null, Instant.now());
        }
    }
}
