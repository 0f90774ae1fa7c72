package io.toolgrade.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolgrade.core.exception.ValidationException;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ToolgradeConfigTest {

    @Test
    void shouldUseDefaults() {
        ToolgradeConfig config = new ToolgradeConfig();

        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCaseTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.isValidateToolCalls()).isFalse();
    }

    @Test
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty("toolgrade.parallelism", "8");
        properties.setProperty("toolgrade.case-timeout-seconds", " 30 ");
        properties.setProperty("toolgrade.validate-tool-calls", "true");

        ToolgradeConfig config = ToolgradeConfig.fromProperties(properties);

        assertThat(config.getParallelism()).isEqualTo(8);
        assertThat(config.getCaseTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.isValidateToolCalls()).isTrue();
    }

    @Test
    void shouldKeepDefaultsForAbsentProperties() {
        ToolgradeConfig config = ToolgradeConfig.fromProperties(new Properties());

        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCaseTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldRejectMalformedNumbers() {
        Properties properties = new Properties();
        properties.setProperty("toolgrade.parallelism", "many");

        assertThatThrownBy(() -> ToolgradeConfig.fromProperties(properties))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("toolgrade.parallelism");
    }
}
