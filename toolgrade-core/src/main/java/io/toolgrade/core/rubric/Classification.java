package io.toolgrade.core.rubric;

/// Tier assigned to a normalized evaluation score, in ascending order of quality.
public enum Classification {
    FAIL,
    WARN,
    PASS
}
