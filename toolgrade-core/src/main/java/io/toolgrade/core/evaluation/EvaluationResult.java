package io.toolgrade.core.evaluation;

import io.toolgrade.core.rubric.Classification;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Immutable outcome of evaluating one case against one set of actual tool calls.
///
/// Carries the normalized score, its classification and the ordered per-field trace.
/// Short-circuited failures (tool set or quantity pre-checks, catalog validation,
/// collaborator errors) have an empty trace and a failure reason.
public final class EvaluationResult {

    private final double score;
    private final Classification classification;
    private final List<FieldResult> fieldResults;
    private final double totalScore;
    private final double totalWeight;
    private final String failureReason;

    private EvaluationResult(Builder builder) {
        this.score = builder.score;
        this.classification =
                Objects.requireNonNull(builder.classification, "classification required");
        this.fieldResults = List.copyOf(builder.fieldResults);
        this.totalScore = builder.totalScore;
        this.totalWeight = builder.totalWeight;
        this.failureReason = builder.failureReason;
    }

    /// Creates an immediate failure with score 0 and no trace.
    ///
    /// @param reason diagnostic message, not null
    /// @return failed result, never null
    public static EvaluationResult failure(String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return builder().score(0.0).classification(Classification.FAIL).failureReason(reason).build();
    }

    // Getters
    public double getScore() {
        return score;
    }

    public Classification getClassification() {
        return classification;
    }

    public List<FieldResult> getFieldResults() {
        return fieldResults;
    }

    /// Returns the sum of awarded scores before normalization.
    public double getTotalScore() {
        return totalScore;
    }

    /// Returns the sum of possible weights before normalization.
    public double getTotalWeight() {
        return totalWeight;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public boolean passed() {
        return classification == Classification.PASS;
    }

    public boolean warned() {
        return classification == Classification.WARN;
    }

    public boolean failed() {
        return classification == Classification.FAIL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double score;
        private Classification classification;
        private List<FieldResult> fieldResults = List.of();
        private double totalScore;
        private double totalWeight;
        private String failureReason;

        private Builder() {}

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder classification(Classification classification) {
            this.classification = classification;
            return this;
        }

        public Builder fieldResults(List<FieldResult> fieldResults) {
            this.fieldResults = List.copyOf(fieldResults);
            return this;
        }

        public Builder totalScore(double totalScore) {
            this.totalScore = totalScore;
            return this;
        }

        public Builder totalWeight(double totalWeight) {
            this.totalWeight = totalWeight;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public EvaluationResult build() {
            return new EvaluationResult(this);
        }
    }

    @Override
    public String toString() {
        return "EvaluationResult{score="
                + score
                + ", classification="
                + classification
                + (failureReason != null ? ", failureReason='" + failureReason + "'" : "")
                + "}";
    }
}
