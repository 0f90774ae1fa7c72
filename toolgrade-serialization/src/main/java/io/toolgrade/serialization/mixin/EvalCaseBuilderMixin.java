package io.toolgrade.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.toolgrade.core.assignment.AssignmentSolver;
import io.toolgrade.core.toolcall.ExpectedToolCall;

/// Binds JSON properties to {@link io.toolgrade.core.evaluation.EvalCase.Builder} methods.
///
/// The assignment solver is runtime wiring, and the single-call adder would shadow the
/// `expectedToolCalls` list property; both are hidden from JSON.
@JsonPOJOBuilder(withPrefix = "")
public abstract class EvalCaseBuilderMixin {

    @JsonIgnore
    public abstract EvalCaseBuilderMixin assignmentSolver(AssignmentSolver solver);

    @JsonIgnore
    public abstract EvalCaseBuilderMixin expectedToolCall(ExpectedToolCall expectedToolCall);
}
