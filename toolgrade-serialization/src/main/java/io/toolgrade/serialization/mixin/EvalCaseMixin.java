package io.toolgrade.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.toolgrade.core.evaluation.EvalCase;

@JsonDeserialize(builder = EvalCase.Builder.class)
@JsonPropertyOrder({
    "name",
    "userMessage",
    "additionalMessages",
    "expectedToolCalls",
    "critics",
    "rubric",
    "criticWeightPolicy"
})
public abstract class EvalCaseMixin {}
