package io.toolgrade.core.rubric;

import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.exception.ValidationException;
import java.util.List;

/// Structural check on the user critics of a case, applied once at case construction.
///
/// The standard policy requires the critic weights to sum to at most `1.0` and each
/// weight to be at least `0.1`. A case without critics always satisfies the policy.
///
/// @param enabled whether the check runs at all
/// @param maxTotalWeight upper bound for the sum of critic weights
/// @param minCriticWeight lower bound for each critic weight
public record CriticWeightPolicy(boolean enabled, double maxTotalWeight, double minCriticWeight) {

    private static final double TOLERANCE = 1e-9;

    private static final CriticWeightPolicy STANDARD = new CriticWeightPolicy(true, 1.0, 0.1);
    private static final CriticWeightPolicy DISABLED = new CriticWeightPolicy(false, 0.0, 0.0);

    public static CriticWeightPolicy standard() {
        return STANDARD;
    }

    public static CriticWeightPolicy disabled() {
        return DISABLED;
    }

    /// Validates critic weights against this policy.
    ///
    /// @param critics user critics of a case, not null
    /// @throws ValidationException if the policy is enabled and violated
    public void validate(List<? extends Critic> critics) {
        if (!enabled) {
            return;
        }
        double total = 0.0;
        for (Critic critic : critics) {
            if (critic.weight() + TOLERANCE < minCriticWeight) {
                throw new ValidationException(
                        "Critic '"
                                + critic.field()
                                + "' weight "
                                + critic.weight()
                                + " is below the minimum of "
                                + minCriticWeight);
            }
            total += critic.weight();
        }
        if (total > maxTotalWeight + TOLERANCE) {
            throw new ValidationException(
                    "Sum of critic weights " + total + " exceeds the maximum of " + maxTotalWeight);
        }
    }
}
