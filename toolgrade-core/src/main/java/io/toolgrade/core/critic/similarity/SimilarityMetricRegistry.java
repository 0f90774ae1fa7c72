package io.toolgrade.core.critic.similarity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable name-to-metric lookup used by {@link io.toolgrade.core.critic.SimilarityCritic}.
///
/// Registries are plain values handed to critics at construction; there is no global
/// registration. {@link #defaults()} provides `cosine` and `jaccard`; add custom metrics
/// with {@link #with(String, SimilarityMetric)} or the {@link Builder}.
///
/// ### Usage
/// {@snippet :
/// SimilarityMetricRegistry metrics = SimilarityMetricRegistry.defaults()
///     .with("exact", (a, b) -> a.equalsIgnoreCase(b) ? 1.0 : 0.0);
/// SimilarityCritic critic = new SimilarityCritic("subject", 0.5, "exact", 0.9, metrics);
/// }
///
/// @implNote Immutable and thread-safe.
public final class SimilarityMetricRegistry {

    private static final SimilarityMetricRegistry DEFAULTS =
            builder()
                    .register(CosineSimilarityMetric.NAME, new CosineSimilarityMetric())
                    .register(JaccardSimilarityMetric.NAME, new JaccardSimilarityMetric())
                    .build();

    private final Map<String, SimilarityMetric> metrics;

    private SimilarityMetricRegistry(Map<String, SimilarityMetric> metrics) {
        this.metrics = Map.copyOf(metrics);
    }

    /// Returns the registry holding the built-in metrics.
    ///
    /// @return shared immutable registry, never null
    public static SimilarityMetricRegistry defaults() {
        return DEFAULTS;
    }

    /// Looks up a metric by name.
    ///
    /// @param name metric name, not null
    /// @return the metric, or empty if unregistered
    public Optional<SimilarityMetric> find(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(metrics.get(name));
    }

    /// Returns the registered metric names.
    public Set<String> names() {
        return metrics.keySet();
    }

    /// Returns a copy of this registry with one additional (or replaced) metric.
    ///
    /// @param name metric name, not null
    /// @param metric strategy, not null
    /// @return new registry, never null
    public SimilarityMetricRegistry with(String name, SimilarityMetric metric) {
        Builder builder = builder();
        metrics.forEach(builder::register);
        return builder.register(name, metric).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, SimilarityMetric> metrics = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String name, SimilarityMetric metric) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(metric, "metric must not be null");
            metrics.put(name, metric);
            return this;
        }

        public SimilarityMetricRegistry build() {
            return new SimilarityMetricRegistry(metrics);
        }
    }
}
