package io.toolgrade.core.critic;

import io.toolgrade.core.exception.CriticConfigurationException;
import java.util.Objects;

/// Fuzzy numeric critic rewarding values that are close relative to a value range.
///
/// ### Scoring
/// 1. Both values are normalized linearly against `valueRange` (no clamping).
/// 2. `similarity = 1 - |norm(expected) - norm(actual)|`, bounded to `[0, 1]`.
/// 3. `score = weight * similarity`; `matched = similarity >= matchThreshold`.
///
/// Numeric strings such as `"42.5"` are accepted since model arguments often arrive as
/// text. A non-finite value (`NaN`, `Infinity`) on either side scores similarity 0.
///
/// @param field argument name, not null or blank
/// @param weight maximum score in `(0, 1]`
/// @param valueRange normalization range; must satisfy `min < max` when evaluated
/// @param matchThreshold similarity needed to count as a match, in `[0, 1]`
public record NumericCritic(String field, double weight, ValueRange valueRange, double matchThreshold)
        implements Critic {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.8;

    public NumericCritic {
        CriticWeights.requireField(field);
        CriticWeights.requireWeight(field, weight);
        Objects.requireNonNull(valueRange, "valueRange must not be null");
        CriticWeights.requireThreshold(field, "matchThreshold", matchThreshold);
    }

    public static NumericCritic of(String field, double weight, double min, double max) {
        return new NumericCritic(field, weight, ValueRange.of(min, max), DEFAULT_MATCH_THRESHOLD);
    }

    public static NumericCritic of(
            String field, double weight, double min, double max, double matchThreshold) {
        return new NumericCritic(field, weight, ValueRange.of(min, max), matchThreshold);
    }

    /// @throws CriticConfigurationException if the range is degenerate or a value is not
    ///     numeric
    @Override
    public CriticResult evaluate(Object expected, Object actual) {
        if (valueRange.isDegenerate()) {
            throw new CriticConfigurationException(
                    field,
                    "value range requires min < max, got ["
                            + valueRange.min()
                            + ", "
                            + valueRange.max()
                            + "]");
        }
        double similarity = similarity(toDouble(expected), toDouble(actual));
        return new CriticResult(similarity >= matchThreshold, weight * similarity);
    }

    /// Similarity of two numbers under this critic's range, bounded to `[0, 1]`.
    public double similarity(double expected, double actual) {
        if (!Double.isFinite(expected) || !Double.isFinite(actual)) {
            return 0.0;
        }
        double distance = Math.abs(valueRange.normalize(expected) - valueRange.normalize(actual));
        return CriticWeights.bound(1.0 - distance);
    }

    private double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new CriticConfigurationException(
                        field, "value is not numeric: '" + text + "'", e);
            }
        }
        throw new CriticConfigurationException(
                field, "value is not numeric: " + value.getClass().getSimpleName());
    }
}
