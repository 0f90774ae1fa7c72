package io.toolgrade.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LangChain4jChatModelFactoryTest {

    private final LangChain4jChatModelFactory factory =
            new LangChain4jChatModelFactory(
                    Map.of(
                            "anthropic_api_key", "test-anthropic",
                            "OPENAI_API_KEY", "test-openai"));

    @Test
    void supportsModel_byPrefix() {
        assertThat(factory.supportsModel("claude-sonnet-4")).isTrue();
        assertThat(factory.supportsModel("gpt-4o-mini")).isTrue();
        assertThat(factory.supportsModel("o1-mini")).isTrue();
        assertThat(factory.supportsModel("deepseek-chat")).isTrue();
        assertThat(factory.supportsModel("llama-3")).isFalse();
        assertThat(factory.supportsModel(null)).isFalse();
    }

    @Test
    void create_claudeUsesAnthropic() {
        assertThat(factory.create("claude-sonnet-4")).isInstanceOf(AnthropicChatModel.class);
    }

    @Test
    void create_gptUsesOpenAi() {
        assertThat(factory.create("gpt-4o-mini")).isInstanceOf(OpenAiChatModel.class);
    }

    @Test
    void create_deepseekRequiresItsOwnKey() {
        assertThatThrownBy(() -> factory.create("deepseek-chat"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("deepseek_api_key");
    }

    @Test
    void create_unsupportedModelIsRejected() {
        assertThatThrownBy(() -> factory.create("llama-3"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported model: llama-3");
    }
}
