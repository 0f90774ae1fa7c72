package io.toolgrade.core.critic.similarity;

/// Strategy computing a similarity between two texts.
///
/// ### Contracts
/// - **Postcondition**: result is in `[0, 1]`
/// - **Invariant**: deterministic for equal inputs
///
/// @see SimilarityMetricRegistry for name-based lookup
@FunctionalInterface
public interface SimilarityMetric {

    /// Scores two texts.
    ///
    /// @param expected ground-truth text, not null
    /// @param actual observed text, not null
    /// @return similarity in `[0, 1]`
    double similarity(String expected, String actual);
}
