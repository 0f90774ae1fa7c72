package io.toolgrade.core.provider.stub;

import io.toolgrade.core.provider.ToolCallProvider;
import io.toolgrade.core.provider.ToolCallRequest;
import io.toolgrade.core.provider.ToolCallResponse;
import io.toolgrade.core.toolcall.ActualToolCall;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Scripted {@link ToolCallProvider} for tests and dry runs.
///
/// ### Response Resolution Order
/// 1. Response registered for `(model, user message)`
/// 2. Response registered for the user message, any model
/// 3. Default response
/// 4. No tool calls
///
/// The user message is the content of the last USER turn of the request.
///
/// @implNote Thread-safe. Each instance owns its own response table.
public class StubToolCallProvider implements ToolCallProvider {

    private static final Logger logger = Logger.getLogger(StubToolCallProvider.class.getName());

    private final Map<String, Map<String, ToolCallResponse>> byModel = new ConcurrentHashMap<>();
    private final Map<String, ToolCallResponse> byMessage = new ConcurrentHashMap<>();
    private volatile ToolCallResponse defaultResponse;

    /// Registers tool calls returned to any model for a user message.
    ///
    /// @param userMessage user message to match, not null
    /// @param calls calls to return, not null
    /// @return this provider
    public StubToolCallProvider respond(String userMessage, List<ActualToolCall> calls) {
        return respond(userMessage, ToolCallResponse.ToolCalls.of(calls));
    }

    /// Registers a response returned to any model for a user message.
    public StubToolCallProvider respond(String userMessage, ToolCallResponse response) {
        Objects.requireNonNull(userMessage, "userMessage must not be null");
        byMessage.put(userMessage, Objects.requireNonNull(response, "response must not be null"));
        logger.fine("Registered stub response for message=" + userMessage);
        return this;
    }

    /// Registers tool calls returned to one model for a user message.
    public StubToolCallProvider respond(
            String model, String userMessage, List<ActualToolCall> calls) {
        return respond(model, userMessage, ToolCallResponse.ToolCalls.of(calls));
    }

    /// Registers a response returned to one model for a user message.
    ///
    /// @param model model identifier, not null
    /// @param userMessage user message to match, not null
    /// @param response response to return, not null
    /// @return this provider
    public StubToolCallProvider respond(
            String model, String userMessage, ToolCallResponse response) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(userMessage, "userMessage must not be null");
        Objects.requireNonNull(response, "response must not be null");
        byModel.computeIfAbsent(model, key -> new ConcurrentHashMap<>()).put(userMessage, response);
        logger.fine("Registered stub response for model=" + model + ", message=" + userMessage);
        return this;
    }

    /// Sets the response used when nothing more specific is registered.
    ///
    /// @param response default response, may be null to fall back to no tool calls
    /// @return this provider
    public StubToolCallProvider respondByDefault(ToolCallResponse response) {
        this.defaultResponse = response;
        return this;
    }

    /// Clears all registered responses, including the default.
    public void clear() {
        byModel.clear();
        byMessage.clear();
        defaultResponse = null;
    }

    @Override
    public ToolCallResponse requestToolCalls(ToolCallRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String userMessage = request.lastUserMessage();

        Map<String, ToolCallResponse> modelResponses = byModel.get(request.model());
        if (modelResponses != null) {
            ToolCallResponse response = modelResponses.get(userMessage);
            if (response != null) {
                logger.info("[STUB] Using registered response for model: " + request.model());
                return response;
            }
        }

        ToolCallResponse response = byMessage.get(userMessage);
        if (response != null) {
            logger.info("[STUB] Using registered response for message: " + userMessage);
            return response;
        }

        ToolCallResponse fallback = defaultResponse;
        if (fallback != null) {
            logger.info("[STUB] Using default response for model: " + request.model());
            return fallback;
        }

        logger.info("[STUB] No response configured, returning no tool calls");
        return ToolCallResponse.ToolCalls.none();
    }
}
