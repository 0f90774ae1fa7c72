package io.toolgrade.core.provider;

import java.util.Objects;

/// One turn of the conversation sent to the model under evaluation.
///
/// @param role speaker of the turn, not null
/// @param content turn text, not null
public record ConversationMessage(Role role, String content) {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ConversationMessage system(String content) {
        return new ConversationMessage(Role.SYSTEM, content);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content);
    }
}
