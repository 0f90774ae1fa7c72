package io.toolgrade.core;

import io.toolgrade.core.exception.ValidationException;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for suite runs.
///
/// ### Default Values
/// - `parallelism`: `1` (cases run sequentially on the calling thread)
/// - `caseTimeout`: 5 minutes (only applied when `parallelism > 1`)
/// - `validateToolCalls`: `false` (suites decide individually)
///
/// ### Property Keys
/// - `toolgrade.parallelism`
/// - `toolgrade.case-timeout-seconds`
/// - `toolgrade.validate-tool-calls`
///
/// @implNote **Not thread-safe**. Mutable configuration intended to be set up before being
/// passed to {@link ToolgradeFactory}. Do not modify after runner creation.
///
/// @see ToolgradeFactory#createRunner(io.toolgrade.core.provider.ToolCallProvider, ToolgradeConfig)
public class ToolgradeConfig {

    public static final String PARALLELISM_PROPERTY = "toolgrade.parallelism";
    public static final String CASE_TIMEOUT_PROPERTY = "toolgrade.case-timeout-seconds";
    public static final String VALIDATE_TOOL_CALLS_PROPERTY = "toolgrade.validate-tool-calls";

    private int parallelism = 1;
    private Duration caseTimeout = Duration.ofMinutes(5);
    private boolean validateToolCalls = false;

    public ToolgradeConfig() {}

    /// Returns the number of cases run concurrently.
    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    /// Returns how long the runner waits for one case when running in parallel.
    public Duration getCaseTimeout() {
        return caseTimeout;
    }

    public void setCaseTimeout(Duration caseTimeout) {
        this.caseTimeout = caseTimeout;
    }

    /// Returns whether every suite is validated against its catalog regardless of its own
    /// setting.
    public boolean isValidateToolCalls() {
        return validateToolCalls;
    }

    public void setValidateToolCalls(boolean validateToolCalls) {
        this.validateToolCalls = validateToolCalls;
    }

    /// Reads configuration from properties, keeping defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws ValidationException if a present value cannot be parsed
    public static ToolgradeConfig fromProperties(Properties properties) {
        ToolgradeConfig config = new ToolgradeConfig();
        String parallelism = properties.getProperty(PARALLELISM_PROPERTY);
        if (parallelism != null && !parallelism.isBlank()) {
            config.parallelism = parseInt(PARALLELISM_PROPERTY, parallelism);
        }
        String timeout = properties.getProperty(CASE_TIMEOUT_PROPERTY);
        if (timeout != null && !timeout.isBlank()) {
            config.caseTimeout = Duration.ofSeconds(parseInt(CASE_TIMEOUT_PROPERTY, timeout));
        }
        String validate = properties.getProperty(VALIDATE_TOOL_CALLS_PROPERTY);
        if (validate != null && !validate.isBlank()) {
            config.validateToolCalls = Boolean.parseBoolean(validate.trim());
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid value for " + key + ": '" + value + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ToolgradeConfig}.
    public static class Builder {
        private final ToolgradeConfig config = new ToolgradeConfig();

        public Builder parallelism(int parallelism) {
            config.parallelism = parallelism;
            return this;
        }

        public Builder caseTimeout(Duration caseTimeout) {
            config.caseTimeout = caseTimeout;
            return this;
        }

        public Builder validateToolCalls(boolean validateToolCalls) {
            config.validateToolCalls = validateToolCalls;
            return this;
        }

        public ToolgradeConfig build() {
            return config;
        }
    }
}
