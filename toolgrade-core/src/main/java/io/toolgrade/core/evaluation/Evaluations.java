package io.toolgrade.core.evaluation;

import io.toolgrade.core.toolcall.ActualToolCall;
import java.util.List;
import java.util.Objects;

/// Static entry point for scoring a case.
public final class Evaluations {

    private Evaluations() {}

    /// Scores actual tool calls against a case.
    ///
    /// @param evalCase case holding expectations, critics and rubric, not null
    /// @param actualToolCalls calls chosen by the system under test, not null
    /// @return evaluation result, never null
    /// @see EvalCase#evaluate(List)
    public static EvaluationResult evaluate(EvalCase evalCase, List<ActualToolCall> actualToolCalls) {
        return Objects.requireNonNull(evalCase, "evalCase must not be null").evaluate(actualToolCalls);
    }
}
