package io.toolgrade.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.toolgrade.core.rubric.EvalRubric;

@JsonDeserialize(builder = EvalRubric.Builder.class)
public abstract class EvalRubricMixin {}
