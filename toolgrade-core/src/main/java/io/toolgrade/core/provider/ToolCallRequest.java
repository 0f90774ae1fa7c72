package io.toolgrade.core.provider;

import io.toolgrade.core.tool.ToolDefinition;
import java.util.List;
import java.util.Objects;

/// Input for one model invocation during a suite run.
///
/// @param model model identifier (e.g. "gpt-4o", "claude-sonnet-4"), not null
/// @param messages conversation to send, system turn first, not null
/// @param tools tools offered to the model, not null (may be empty)
/// @param toolChoice tool choice mode, not null
public record ToolCallRequest(
        String model,
        List<ConversationMessage> messages,
        List<ToolDefinition> tools,
        ToolChoice toolChoice) {

    public ToolCallRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
        tools = tools != null ? List.copyOf(tools) : List.of();
        toolChoice = toolChoice != null ? toolChoice : ToolChoice.AUTO;
    }

    /// Returns the content of the last user turn, or an empty string when there is none.
    public String lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == ConversationMessage.Role.USER) {
                return message.content();
            }
        }
        return "";
    }
}
