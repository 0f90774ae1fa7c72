package io.toolgrade.core.critic;

/// Scores one expected argument value against one actual argument value.
///
/// Critics form a closed family: {@link BinaryCritic}, {@link NumericCritic},
/// {@link SimilarityCritic} and the implicit {@link ToolSelectionCritic} that the
/// evaluation engine applies to every candidate pairing.
///
/// ### Contracts
/// - **Postcondition**: `0 <= evaluate(...).score() <= weight()`
/// - **Invariant**: `evaluate` is pure and deterministic for equal inputs
///
/// @implNote Implementations are immutable records and therefore thread-safe.
///
/// @see CriticResult for the evaluation outcome
/// @see io.toolgrade.core.evaluation.EvalCase for how critic scores are aggregated
public sealed interface Critic
        permits BinaryCritic, NumericCritic, SimilarityCritic, ToolSelectionCritic {

    /// Returns the argument name this critic inspects.
    ///
    /// @return argument field, never null
    String field();

    /// Returns the maximum score this critic can award.
    ///
    /// @return weight in `(0, 1]` for user critics, positive for tool selection
    double weight();

    /// Compares an expected value to an actual value.
    ///
    /// Callers only invoke this when both sides define the field with a non-null value.
    ///
    /// @param expected ground-truth value, not null
    /// @param actual observed value, not null
    /// @return match flag and score bounded by `weight()`, never null
    /// @throws io.toolgrade.core.exception.CriticConfigurationException if the critic
    ///     cannot execute with its configuration
    CriticResult evaluate(Object expected, Object actual);
}
