package io.toolgrade.core.rubric;

import io.toolgrade.core.exception.ValidationException;
import java.util.Objects;

/// Immutable thresholds and policy flags that turn a normalized score into a
/// {@link Classification}.
///
/// Tiers ascend: `score < failThreshold` fails, `failThreshold <= score < warnThreshold`
/// warns, `score >= warnThreshold` passes.
///
/// ### Validation Rules
/// - `0 <= failThreshold <= warnThreshold <= 1`
/// - `toolSelectionWeight > 0`
///
/// ### Policy Flags
/// - `failOnToolSelection`: fail immediately when the set of called tool names differs
///   from the expected set
/// - `failOnToolCallQuantity`: fail immediately when the number of calls differs
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see io.toolgrade.core.evaluation.EvalCase#evaluate for where the rubric is applied
public final class EvalRubric {

    public static final double DEFAULT_FAIL_THRESHOLD = 0.8;
    public static final double DEFAULT_WARN_THRESHOLD = 0.9;

    private final double failThreshold;
    private final double warnThreshold;
    private final double toolSelectionWeight;
    private final boolean failOnToolSelection;
    private final boolean failOnToolCallQuantity;

    private EvalRubric(Builder builder) {
        this.failThreshold = builder.failThreshold;
        this.warnThreshold = builder.warnThreshold;
        this.toolSelectionWeight = builder.toolSelectionWeight;
        this.failOnToolSelection = builder.failOnToolSelection;
        this.failOnToolCallQuantity = builder.failOnToolCallQuantity;

        validate();
    }

    private void validate() {
        if (!inUnitInterval(failThreshold)) {
            throw new ValidationException(
                    "Fail threshold must be between 0 and 1, got " + failThreshold);
        }
        if (!inUnitInterval(warnThreshold)) {
            throw new ValidationException(
                    "Warn threshold must be between 0 and 1, got " + warnThreshold);
        }
        if (failThreshold > warnThreshold) {
            throw new ValidationException(
                    "Fail threshold ("
                            + failThreshold
                            + ") must not exceed warn threshold ("
                            + warnThreshold
                            + ")");
        }
        if (Double.isNaN(toolSelectionWeight) || toolSelectionWeight <= 0.0) {
            throw new ValidationException(
                    "Tool selection weight must be positive, got " + toolSelectionWeight);
        }
    }

    private static boolean inUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    /// Classifies a normalized score.
    ///
    /// A non-decreasing step function of `score` for a fixed rubric.
    ///
    /// @param score normalized score, expected in `[0, 1]`
    /// @return tier for the score, never null
    public Classification classify(double score) {
        if (score < failThreshold) {
            return Classification.FAIL;
        }
        if (score < warnThreshold) {
            return Classification.WARN;
        }
        return Classification.PASS;
    }

    /// Returns the score below which a case fails.
    public double getFailThreshold() {
        return failThreshold;
    }

    /// Returns the score at or above which a case passes.
    public double getWarnThreshold() {
        return warnThreshold;
    }

    /// Returns the weight of the implicit tool-name critic.
    ///
    /// @return positive weight (default 1.0)
    public double getToolSelectionWeight() {
        return toolSelectionWeight;
    }

    /// Checks whether a differing set of tool names fails the case outright.
    public boolean isFailOnToolSelection() {
        return failOnToolSelection;
    }

    /// Checks whether a differing number of tool calls fails the case outright.
    public boolean isFailOnToolCallQuantity() {
        return failOnToolCallQuantity;
    }

    /// Creates a rubric with the given thresholds and default policy flags.
    ///
    /// @param failThreshold score below which a case fails
    /// @param warnThreshold score at or above which a case passes
    /// @return new rubric, never null
    /// @throws ValidationException if the thresholds are invalid
    public static EvalRubric of(double failThreshold, double warnThreshold) {
        return builder().failThreshold(failThreshold).warnThreshold(warnThreshold).build();
    }

    /// Creates a builder pre-populated with this rubric's values.
    public Builder toBuilder() {
        return builder()
                .failThreshold(failThreshold)
                .warnThreshold(warnThreshold)
                .toolSelectionWeight(toolSelectionWeight)
                .failOnToolSelection(failOnToolSelection)
                .failOnToolCallQuantity(failOnToolCallQuantity);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link EvalRubric}. Both pre-checks are enabled by default.
    public static final class Builder {
        private double failThreshold = DEFAULT_FAIL_THRESHOLD;
        private double warnThreshold = DEFAULT_WARN_THRESHOLD;
        private double toolSelectionWeight = 1.0;
        private boolean failOnToolSelection = true;
        private boolean failOnToolCallQuantity = true;

        private Builder() {}

        public Builder failThreshold(double failThreshold) {
            this.failThreshold = failThreshold;
            return this;
        }

        public Builder warnThreshold(double warnThreshold) {
            this.warnThreshold = warnThreshold;
            return this;
        }

        public Builder toolSelectionWeight(double toolSelectionWeight) {
            this.toolSelectionWeight = toolSelectionWeight;
            return this;
        }

        public Builder failOnToolSelection(boolean failOnToolSelection) {
            this.failOnToolSelection = failOnToolSelection;
            return this;
        }

        public Builder failOnToolCallQuantity(boolean failOnToolCallQuantity) {
            this.failOnToolCallQuantity = failOnToolCallQuantity;
            return this;
        }

        /// Builds the immutable rubric.
        ///
        /// @return new rubric, never null
        /// @throws ValidationException if thresholds or weight are invalid
        public EvalRubric build() {
            return new EvalRubric(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvalRubric that)) return false;
        return Double.compare(failThreshold, that.failThreshold) == 0
                && Double.compare(warnThreshold, that.warnThreshold) == 0
                && Double.compare(toolSelectionWeight, that.toolSelectionWeight) == 0
                && failOnToolSelection == that.failOnToolSelection
                && failOnToolCallQuantity == that.failOnToolCallQuantity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                failThreshold,
                warnThreshold,
                toolSelectionWeight,
                failOnToolSelection,
                failOnToolCallQuantity);
    }

    @Override
    public String toString() {
        return "EvalRubric{fail="
                + failThreshold
                + ", warn="
                + warnThreshold
                + ", toolSelectionWeight="
                + toolSelectionWeight
                + "}";
    }
}
