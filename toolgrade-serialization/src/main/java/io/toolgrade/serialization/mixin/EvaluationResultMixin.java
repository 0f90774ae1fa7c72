package io.toolgrade.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Optional;

@JsonPropertyOrder({
    "score",
    "classification",
    "totalScore",
    "totalWeight",
    "failureReason",
    "fieldResults"
})
public abstract class EvaluationResultMixin {

    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<String> getFailureReason();
}
