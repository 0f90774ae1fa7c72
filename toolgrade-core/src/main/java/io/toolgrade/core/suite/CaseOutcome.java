package io.toolgrade.core.suite;

import io.toolgrade.core.evaluation.EvaluationResult;
import io.toolgrade.core.toolcall.ActualToolCall;
import io.toolgrade.core.toolcall.ExpectedToolCall;
import java.util.List;
import java.util.Objects;

/// Result of running one case against one model.
///
/// @param caseName case name, not null
/// @param userMessage user turn sent to the model, not null
/// @param expectedToolCalls calls the case expected, not null
/// @param actualToolCalls calls the model made, empty when the provider failed, not null
/// @param evaluation scored result, not null
public record CaseOutcome(
        String caseName,
        String userMessage,
        List<ExpectedToolCall> expectedToolCalls,
        List<ActualToolCall> actualToolCalls,
        EvaluationResult evaluation) {

    public CaseOutcome {
        Objects.requireNonNull(caseName, "caseName must not be null");
        Objects.requireNonNull(userMessage, "userMessage must not be null");
        expectedToolCalls = List.copyOf(expectedToolCalls);
        actualToolCalls = List.copyOf(actualToolCalls);
        Objects.requireNonNull(evaluation, "evaluation must not be null");
    }
}
