package io.toolgrade.core.evaluation;

import io.toolgrade.core.critic.CriticResult;
import java.util.Objects;

/// One entry of the per-field evaluation trace.
///
/// Produced for the implicit tool selection check, for every critic whose field was set
/// on both sides of a pairing, and for each expected or actual call left without a
/// partner.
///
/// @param field argument name, `tool_selection`, `missing_tool_call` or `extra_tool_call`
/// @param expected expected value or tool name, may be null
/// @param actual observed value or tool name, may be null
/// @param matched whether the critic considered the values a match
/// @param score awarded score
/// @param weight maximum score this entry contributed to the total weight
public record FieldResult(
        String field, Object expected, Object actual, boolean matched, double score, double weight) {

    public static final String MISSING_TOOL_CALL = "missing_tool_call";
    public static final String EXTRA_TOOL_CALL = "extra_tool_call";

    public FieldResult {
        Objects.requireNonNull(field, "field must not be null");
    }

    static FieldResult of(String field, Object expected, Object actual, CriticResult result, double weight) {
        return new FieldResult(field, expected, actual, result.matched(), result.score(), weight);
    }

    static FieldResult missing(String expectedToolName) {
        return new FieldResult(MISSING_TOOL_CALL, expectedToolName, null, false, 0.0, 1.0);
    }

    static FieldResult extra(String actualToolName) {
        return new FieldResult(EXTRA_TOOL_CALL, null, actualToolName, false, 0.0, 1.0);
    }
}
