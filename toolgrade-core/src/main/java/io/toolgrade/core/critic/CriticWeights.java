package io.toolgrade.core.critic;

import io.toolgrade.core.exception.ValidationException;
import java.util.Objects;

final class CriticWeights {

    private CriticWeights() {}

    static String requireField(String field) {
        Objects.requireNonNull(field, "field must not be null");
        if (field.isBlank()) {
            throw new ValidationException("Critic field must not be blank");
        }
        return field;
    }

    /// User critics carry a weight in `(0, 1]`.
    static double requireWeight(String field, double weight) {
        if (Double.isNaN(weight) || weight <= 0.0 || weight > 1.0) {
            throw new ValidationException(
                    "Critic '" + field + "' weight must be in (0, 1], got " + weight);
        }
        return weight;
    }

    static double requireThreshold(String field, String name, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ValidationException(
                    "Critic '" + field + "' " + name + " must be in [0, 1], got " + threshold);
        }
        return threshold;
    }

    /// Keeps floating-point drift from pushing a score outside `[0, weight]`. NaN maps to 0.
    static double bound(double similarity) {
        if (Double.isNaN(similarity)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
