package io.toolgrade.core.evaluation;

import io.toolgrade.core.assignment.CostMatrix;
import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.critic.CriticResult;
import io.toolgrade.core.critic.ToolSelectionCritic;
import io.toolgrade.core.toolcall.ActualToolCall;
import io.toolgrade.core.toolcall.ExpectedToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Builds the `max(n, m)`-square score matrix for `n` expected and `m` actual calls.
///
/// For every real pairing the entry is the tool selection score plus the score of each
/// critic whose field is set (non-null) on both calls. Critics whose field is missing on
/// either side contribute neither score nor weight to that pairing.
///
/// @implNote Stateless beyond its immutable critics; a fresh table is built per call.
public final class CostMatrixBuilder {

    private final ToolSelectionCritic toolSelection;
    private final List<Critic> critics;

    /// @param toolSelection implicit tool name critic, not null
    /// @param critics user critics in case order, not null
    public CostMatrixBuilder(ToolSelectionCritic toolSelection, List<? extends Critic> critics) {
        this.toolSelection = Objects.requireNonNull(toolSelection, "toolSelection must not be null");
        this.critics = List.copyOf(critics);
    }

    /// Builds the square cost matrix only.
    ///
    /// @param expected expected calls, not null
    /// @param actual actual calls, not null
    /// @return `max(n, m)`-square matrix with zero phantom rows or columns, never null
    public CostMatrix costMatrix(List<ExpectedToolCall> expected, List<ActualToolCall> actual) {
        return build(expected, actual).matrix();
    }

    /// Scores every expected/actual pairing.
    ///
    /// @param expected expected calls, not null
    /// @param actual actual calls, not null
    /// @return table holding the square cost matrix and per-pair traces, never null
    /// @throws io.toolgrade.core.exception.CriticConfigurationException if a critic cannot
    ///     execute with its configuration
    PairingTable build(List<ExpectedToolCall> expected, List<ActualToolCall> actual) {
        PairScore[][] pairs = new PairScore[expected.size()][actual.size()];
        for (int i = 0; i < expected.size(); i++) {
            for (int j = 0; j < actual.size(); j++) {
                pairs[i][j] = score(expected.get(i), actual.get(j));
            }
        }
        return new PairingTable(expected.size(), actual.size(), pairs);
    }

    PairScore score(ExpectedToolCall expected, ActualToolCall actual) {
        List<FieldResult> trace = new ArrayList<>(critics.size() + 1);

        CriticResult selection = toolSelection.evaluate(expected.name(), actual.name());
        trace.add(
                FieldResult.of(
                        ToolSelectionCritic.FIELD,
                        expected.name(),
                        actual.name(),
                        selection,
                        toolSelection.weight()));
        double score = selection.score();
        double weight = toolSelection.weight();

        for (Critic critic : critics) {
            Object expectedValue = expected.arg(critic.field());
            Object actualValue = actual.arg(critic.field());
            if (expectedValue == null || actualValue == null) {
                continue;
            }
            CriticResult result = critic.evaluate(expectedValue, actualValue);
            trace.add(
                    FieldResult.of(
                            critic.field(), expectedValue, actualValue, result, critic.weight()));
            score += result.score();
            weight += critic.weight();
        }

        return new PairScore(score, weight, trace);
    }
}
