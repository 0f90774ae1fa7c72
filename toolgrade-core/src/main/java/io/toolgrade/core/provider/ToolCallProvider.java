package io.toolgrade.core.provider;

/// Produces the actual tool calls that a model makes for a conversation.
///
/// Implementations wrap a concrete model API. Failures should be reported as
/// {@link ToolCallResponse.Error} rather than thrown; the runner still converts any
/// runtime exception into a failed case outcome.
///
/// @implNote Implementations must be thread-safe when the runner is configured with a
/// parallelism greater than one.
///
/// @see io.toolgrade.core.provider.stub.StubToolCallProvider for scripted responses
@FunctionalInterface
public interface ToolCallProvider {

    /// Invokes the model for one case.
    ///
    /// @param request model, conversation, offered tools and tool choice, not null
    /// @return tool calls or an error, never null
    ToolCallResponse requestToolCalls(ToolCallRequest request);
}
