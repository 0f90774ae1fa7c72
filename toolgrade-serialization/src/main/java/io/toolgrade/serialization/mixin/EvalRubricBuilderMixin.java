package io.toolgrade.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

@JsonPOJOBuilder(withPrefix = "")
public abstract class EvalRubricBuilderMixin {}
