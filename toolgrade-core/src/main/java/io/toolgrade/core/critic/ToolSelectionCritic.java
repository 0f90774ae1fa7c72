package io.toolgrade.core.critic;

import io.toolgrade.core.exception.ValidationException;

/// Implicit critic comparing tool names of an expected and an actual call.
///
/// Not authored by test writers: the evaluation engine applies it once per candidate
/// pairing, weighted by {@link io.toolgrade.core.rubric.EvalRubric#getToolSelectionWeight()}.
///
/// @param weight score awarded when the names are equal, positive
public record ToolSelectionCritic(double weight) implements Critic {

    public static final String FIELD = "tool_selection";

    public ToolSelectionCritic {
        if (Double.isNaN(weight) || weight <= 0.0) {
            throw new ValidationException("Tool selection weight must be positive, got " + weight);
        }
    }

    @Override
    public String field() {
        return FIELD;
    }

    @Override
    public CriticResult evaluate(Object expected, Object actual) {
        boolean matched = expected != null && expected.equals(actual);
        return matched ? new CriticResult(true, weight) : CriticResult.miss();
    }
}
