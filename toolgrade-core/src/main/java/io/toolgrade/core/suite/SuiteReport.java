package io.toolgrade.core.suite;

import io.toolgrade.core.rubric.Classification;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcomes of one suite run against one model, in case order.
///
/// @param suiteName suite name, not null
/// @param model model identifier, not null
/// @param startedAt when the run started, not null
/// @param elapsed wall-clock duration of the run, not null
/// @param outcomes per-case outcomes in suite order, not null
public record SuiteReport(
        String suiteName,
        String model,
        Instant startedAt,
        Duration elapsed,
        List<CaseOutcome> outcomes) {

    public SuiteReport {
        Objects.requireNonNull(suiteName, "suiteName must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /// Returns the outcome of the named case.
    public Optional<CaseOutcome> outcome(String caseName) {
        return outcomes.stream().filter(o -> o.caseName().equals(caseName)).findFirst();
    }

    public long passedCount() {
        return count(Classification.PASS);
    }

    public long warnedCount() {
        return count(Classification.WARN);
    }

    public long failedCount() {
        return count(Classification.FAIL);
    }

    /// Returns the mean normalized score, or 0 for an empty report.
    public double meanScore() {
        return outcomes.stream().mapToDouble(o -> o.evaluation().getScore()).average().orElse(0.0);
    }

    public boolean allPassed() {
        return passedCount() == outcomes.size();
    }

    private long count(Classification classification) {
        return outcomes.stream()
                .filter(o -> o.evaluation().getClassification() == classification)
                .count();
    }
}
