package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.toolgrade.core.critic.similarity.SimilarityMetricRegistry;
import io.toolgrade.core.suite.EvalSuite;

/// Converts suite definitions to and from JSON.
///
/// ### Format
/// {@snippet lang=json :
/// {
///   "name": "email-assistant",
///   "systemMessage": "You manage email.",
///   "toolChoice": "AUTO",
///   "validateToolCalls": false,
///   "tools": [ { "name": "send_email", "description": "...", "parameters": [] } ],
///   "cases": [ {
///     "name": "send",
///     "userMessage": "Send the report to a@example.com",
///     "additionalMessages": [],
///     "expectedToolCalls": [ { "name": "send_email", "args": { "to": "a@example.com" } } ],
///     "critics": [ { "type": "binary", "field": "to", "weight": 1.0 } ],
///     "rubric": { "failThreshold": 0.8, "warnThreshold": 0.9 }
///   } ]
/// }
/// }
///
/// Missing rubric fields and a missing weight policy take the builders' defaults.
public final class SuiteSerializer {

    private SuiteSerializer() {}

    /// Serializes a suite to indented JSON.
    ///
    /// @param suite suite to serialize, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(EvalSuite suite) {
        try {
            return createMapper().writeValueAsString(suite);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize suite: " + e.getMessage(), e);
        }
    }

    /// Deserializes a suite using the built-in similarity metrics.
    ///
    /// @param json JSON text, not null
    /// @return validated suite, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the suite is invalid
    public static EvalSuite fromJson(String json) {
        return fromJson(json, SimilarityMetricRegistry.defaults());
    }

    /// Deserializes a suite whose similarity critics use `metrics`.
    ///
    /// @param json JSON text, not null
    /// @param metrics similarity metric registry, not null
    /// @return validated suite, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the suite is invalid
    public static EvalSuite fromJson(String json, SimilarityMetricRegistry metrics) {
        try {
            return createMapper(metrics).readValue(json, EvalSuite.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize suite: " + e.getOriginalMessage(), e);
        }
    }

    /// Creates an `ObjectMapper` configured for toolgrade types.
    ///
    /// @return new mapper, never null
    public static ObjectMapper createMapper() {
        return createMapper(SimilarityMetricRegistry.defaults());
    }

    /// Creates an `ObjectMapper` configured for toolgrade types with custom metrics.
    public static ObjectMapper createMapper(SimilarityMetricRegistry metrics) {
        return new ObjectMapper()
                .registerModule(new ToolgradeJacksonModule(metrics))
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
