package io.toolgrade.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.toolgrade.core.exception.ToolCallProviderException;
import io.toolgrade.core.provider.ConversationMessage;
import io.toolgrade.core.provider.ToolCallProvider;
import io.toolgrade.core.provider.ToolCallRequest;
import io.toolgrade.core.provider.ToolCallResponse;
import io.toolgrade.core.toolcall.ActualToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ToolCallProvider}.
///
/// Sends the case conversation and the suite's tool catalog to a {@link ChatModel} and
/// converts the returned {@link ToolExecutionRequest}s into {@link ActualToolCall}s.
/// Argument JSON is parsed with Jackson; a malformed payload turns the whole response into
/// a {@link ToolCallResponse.Error} rather than a partial call list.
///
/// @implNote Thread-safe. Chat models are created once per model name and cached.
///
/// @see LangChain4jChatModelFactory for model creation
public class LangChain4jToolCallProvider implements ToolCallProvider {

    private static final Logger logger =
            Logger.getLogger(LangChain4jToolCallProvider.class.getName());

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE =
            new TypeReference<>() {};

    private final ChatModelFactory modelFactory;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public LangChain4jToolCallProvider(ChatModelFactory modelFactory) {
        this(modelFactory, new ObjectMapper());
    }

    public LangChain4jToolCallProvider(ChatModelFactory modelFactory, ObjectMapper objectMapper) {
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ToolCallResponse requestToolCalls(ToolCallRequest request) {
        try {
            ChatModel model = models.computeIfAbsent(request.model(), modelFactory::create);

            ChatRequest chatRequest =
                    ChatRequest.builder()
                            .messages(toChatMessages(request.messages()))
                            .toolSpecifications(ToolSpecifications.from(request.tools()))
                            .toolChoice(toToolChoice(request.toolChoice()))
                            .build();

            ChatResponse response = model.chat(chatRequest);
            if (response == null || response.aiMessage() == null) {
                return ToolCallResponse.Error.of("No response from model");
            }

            List<ActualToolCall> calls = toActualToolCalls(response.aiMessage());
            logger.fine(
                    "Model '" + request.model() + "' returned " + calls.size() + " tool calls");
            return ToolCallResponse.ToolCalls.of(calls);

        } catch (Exception e) {
            logger.warning(
                    "Tool call request to '" + request.model() + "' failed: " + e.getMessage());
            return ToolCallResponse.Error.from(e);
        }
    }

    private List<ChatMessage> toChatMessages(List<ConversationMessage> messages) {
        List<ChatMessage> chatMessages = new ArrayList<>(messages.size());
        for (ConversationMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> {
                    if (!message.content().isBlank()) {
                        chatMessages.add(SystemMessage.from(message.content()));
                    }
                }
                case USER -> chatMessages.add(UserMessage.from(message.content()));
                case ASSISTANT -> chatMessages.add(AiMessage.from(message.content()));
            }
        }
        return chatMessages;
    }

    private static dev.langchain4j.model.chat.request.ToolChoice toToolChoice(
            io.toolgrade.core.provider.ToolChoice toolChoice) {
        return switch (toolChoice) {
            case AUTO -> dev.langchain4j.model.chat.request.ToolChoice.AUTO;
            case REQUIRED -> dev.langchain4j.model.chat.request.ToolChoice.REQUIRED;
        };
    }

    private List<ActualToolCall> toActualToolCalls(AiMessage aiMessage) {
        if (!aiMessage.hasToolExecutionRequests()) {
            return List.of();
        }
        List<ActualToolCall> calls = new ArrayList<>();
        for (ToolExecutionRequest toolRequest : aiMessage.toolExecutionRequests()) {
            calls.add(ActualToolCall.of(toolRequest.name(), parseArguments(toolRequest)));
        }
        return calls;
    }

    /// @throws ToolCallProviderException if the arguments are not a JSON object
    Map<String, Object> parseArguments(ToolExecutionRequest toolRequest) {
        String arguments = toolRequest.arguments();
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(arguments, ARGUMENTS_TYPE);
            if (parsed == null) {
                throw new ToolCallProviderException(
                        "Arguments of tool '" + toolRequest.name() + "' are not a JSON object");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new ToolCallProviderException(
                    "Malformed arguments for tool '"
                            + toolRequest.name()
                            + "': "
                            + e.getOriginalMessage(),
                    e);
        }
    }
}
