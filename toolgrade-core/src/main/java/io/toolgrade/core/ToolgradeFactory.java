package io.toolgrade.core;

import io.toolgrade.core.provider.ToolCallProvider;
import io.toolgrade.core.suite.EvalSuiteRunner;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/// Creates suite runners and loads provider credentials.
///
/// ### Usage
/// {@snippet :
/// Properties properties = loadProperties();
/// ToolgradeConfig config = ToolgradeConfig.fromProperties(properties);
/// Map<String, String> credentials = ToolgradeFactory.loadCredentials(properties);
///
/// try (EvalSuiteRunner runner = ToolgradeFactory.createRunner(provider, config)) {
///     SuiteReport report = runner.run(suite, "gpt-4o");
/// }
/// }
public final class ToolgradeFactory {

    /// Prefix for credentials declared in properties files.
    public static final String CREDENTIALS_PREFIX = "toolgrade.credentials.";

    private ToolgradeFactory() {}

    /// Creates a runner with default configuration.
    ///
    /// @param provider source of actual tool calls, not null
    /// @return new runner, never null; the caller must close it
    public static EvalSuiteRunner createRunner(ToolCallProvider provider) {
        return createRunner(provider, new ToolgradeConfig());
    }

    /// Creates a runner.
    ///
    /// @apiNote **Side effects**: creates a thread pool when `parallelism > 1`
    ///
    /// @param provider source of actual tool calls, not null
    /// @param config run configuration, not null
    /// @return new runner, never null; the caller must close it
    public static EvalSuiteRunner createRunner(ToolCallProvider provider, ToolgradeConfig config) {
        return new EvalSuiteRunner(provider, config);
    }

    /// Discovers API credentials from environment variables.
    ///
    /// Picks up variables ending in `_API_KEY`, `_KEY`, `_SECRET` or `_TOKEN`.
    ///
    /// @return discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return credentialsFrom(System.getenv());
    }

    static Map<String, String> credentialsFrom(Map<String, String> environment) {
        Map<String, String> credentials = new HashMap<>();
        environment.forEach(
                (key, value) -> {
                    if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                        credentials.put(key, value);
                    }
                });
        return credentials;
    }

    /// Loads credentials from properties.
    ///
    /// Accepts prefixed keys (`toolgrade.credentials.OPENAI_API_KEY`, prefix stripped) and
    /// bare keys matching the API key patterns.
    ///
    /// @param properties source properties, not null
    /// @return credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(CREDENTIALS_PREFIX)) {
                        credentials.put(keyStr.substring(CREDENTIALS_PREFIX.length()), valueStr);
                    } else if (isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    /// Loads credentials from the environment, overridden by properties.
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase();
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }
}
