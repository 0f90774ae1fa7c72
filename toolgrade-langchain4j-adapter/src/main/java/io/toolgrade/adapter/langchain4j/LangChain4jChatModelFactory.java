package io.toolgrade.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates {@link ChatModel} instances by model-name prefix.
///
/// Supports Anthropic (`claude*`), OpenAI (`gpt*`, `o1*`) and DeepSeek (`deepseek*`) models.
/// DeepSeek uses the OpenAI-compatible API with a custom base URL.
///
/// Temperature defaults to 0 so that repeated suite runs are as reproducible as the
/// provider allows.
///
/// @implNote Stateless apart from the immutable credential map. Each call creates a new
/// model instance.
public class LangChain4jChatModelFactory implements ChatModelFactory {

    private static final Logger logger =
            Logger.getLogger(LangChain4jChatModelFactory.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final int DEFAULT_MAX_TOKENS = 1024;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double DEFAULT_TEMPERATURE = 0.0;

    private final Map<String, String> credentials;
    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;

    /// Creates a factory with default sampling settings.
    ///
    /// @param credentials API keys, e.g. from
    ///     {@link io.toolgrade.core.ToolgradeFactory#loadCredentials}, not null
    public LangChain4jChatModelFactory(Map<String, String> credentials) {
        this(credentials, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_TIMEOUT);
    }

    public LangChain4jChatModelFactory(
            Map<String, String> credentials, double temperature, int maxTokens, Duration timeout) {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials"));
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /// Returns whether a model name has a known provider prefix.
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("deepseek");
    }

    @Override
    public ChatModel create(String modelName) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        logger.info("Creating LangChain4j chat model: " + modelName);

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(modelName);
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return createOpenAiModel(
                    modelName, requireApiKey("openai_api_key", "OPENAI_API_KEY"), null);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(
                    modelName,
                    requireApiKey("deepseek_api_key", "DEEPSEEK_API_KEY"),
                    DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createAnthropicModel(String modelName) {
        return AnthropicChatModel.builder()
                .apiKey(requireApiKey("anthropic_api_key", "ANTHROPIC_API_KEY"))
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(timeout)
                .build();
    }

    /// @param baseUrl custom API endpoint, may be null (uses OpenAI default)
    private ChatModel createOpenAiModel(String modelName, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .timeout(timeout);

        if (baseUrl != null) builder.baseUrl(baseUrl);

        return builder.build();
    }

    /// Looks up an API key, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    private String requireApiKey(String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
