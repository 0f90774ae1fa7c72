package io.toolgrade.core.critic;

/// Closed numeric range used by {@link NumericCritic} to normalize values.
///
/// Construction accepts any pair of finite bounds; a degenerate range (`min >= max`) is
/// reported by the critic when it is used, not here.
public record ValueRange(double min, double max) {

    public static ValueRange of(double min, double max) {
        return new ValueRange(min, max);
    }

    /// Returns true when the range cannot normalize values.
    public boolean isDegenerate() {
        return !(Double.isFinite(min) && Double.isFinite(max)) || min >= max;
    }

    /// Maps a value linearly so that `min -> 0` and `max -> 1`. Values outside the range
    /// extrapolate past those bounds.
    public double normalize(double value) {
        return (value - min) / (max - min);
    }
}
