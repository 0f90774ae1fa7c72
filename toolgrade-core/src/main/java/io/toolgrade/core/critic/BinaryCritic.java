package io.toolgrade.core.critic;

import java.math.BigDecimal;
import java.util.Objects;

/// Exact-equality critic: full weight on a match, zero otherwise.
///
/// Values are compared structurally with {@link Objects#equals}, except that two numbers
/// compare by numeric value so that an integer `1` decoded from JSON equals an expected
/// `1.0`.
///
/// @param field argument name, not null or blank
/// @param weight maximum score in `(0, 1]`
public record BinaryCritic(String field, double weight) implements Critic {

    public BinaryCritic {
        CriticWeights.requireField(field);
        CriticWeights.requireWeight(field, weight);
    }

    /// Creates a binary critic.
    ///
    /// @param field argument name, not null
    /// @param weight maximum score in `(0, 1]`
    /// @return new critic, never null
    public static BinaryCritic of(String field, double weight) {
        return new BinaryCritic(field, weight);
    }

    @Override
    public CriticResult evaluate(Object expected, Object actual) {
        boolean matched = valuesEqual(expected, actual);
        return new CriticResult(matched, matched ? weight : 0.0);
    }

    private static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            BigDecimal left = toDecimal(e);
            BigDecimal right = toDecimal(a);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
        }
        return Objects.equals(expected, actual);
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if ((number instanceof Double || number instanceof Float)
                && !Double.isFinite(number.doubleValue())) {
            return null;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
