package io.toolgrade.core.critic;

/// Outcome of a single critic evaluation.
///
/// @param matched whether the value pair meets the critic's match threshold
/// @param score awarded score in `[0, weight]`
public record CriticResult(boolean matched, double score) {

    static CriticResult miss() {
        return new CriticResult(false, 0.0);
    }
}
