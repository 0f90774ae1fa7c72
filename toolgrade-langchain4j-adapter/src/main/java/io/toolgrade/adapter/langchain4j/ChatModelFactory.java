package io.toolgrade.adapter.langchain4j;

import dev.langchain4j.model.chat.ChatModel;

/// Resolves a model identifier to a LangChain4j chat model.
///
/// @see LangChain4jChatModelFactory for the credential-based implementation
@FunctionalInterface
public interface ChatModelFactory {

    /// @param modelName model identifier as passed to the suite runner, not null
    /// @return chat model able to answer tool-call requests, never null
    /// @throws IllegalArgumentException if the model is not supported
    /// @throws IllegalStateException if credentials for the model are missing
    ChatModel create(String modelName);
}
