package io.toolgrade.core.critic;

import io.toolgrade.core.critic.similarity.SimilarityMetric;
import io.toolgrade.core.critic.similarity.SimilarityMetricRegistry;
import io.toolgrade.core.exception.CriticConfigurationException;
import java.util.Objects;

/// Text similarity critic backed by a pluggable {@link SimilarityMetric}.
///
/// Both values are converted with `String.valueOf` and scored by the metric registered
/// under `metric` in the supplied registry. The default `cosine` metric compares the two
/// strings as a two-document TF-IDF corpus, which makes the score a relative signal
/// rather than an absolute one.
///
/// ### Scoring
/// `score = weight * similarity`; `matched = similarity >= similarityThreshold`.
///
/// @param field argument name, not null or blank
/// @param weight maximum score in `(0, 1]`
/// @param metric registered metric name, not null
/// @param similarityThreshold similarity needed to count as a match, in `[0, 1]`
/// @param metrics registry the metric name is resolved against, not null
public record SimilarityCritic(
        String field,
        double weight,
        String metric,
        double similarityThreshold,
        SimilarityMetricRegistry metrics)
        implements Critic {

    public static final String DEFAULT_METRIC = "cosine";
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    public SimilarityCritic {
        CriticWeights.requireField(field);
        CriticWeights.requireWeight(field, weight);
        Objects.requireNonNull(metric, "metric must not be null");
        CriticWeights.requireThreshold(field, "similarityThreshold", similarityThreshold);
        Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /// Creates a cosine similarity critic with the default threshold.
    public static SimilarityCritic of(String field, double weight) {
        return new SimilarityCritic(
                field,
                weight,
                DEFAULT_METRIC,
                DEFAULT_SIMILARITY_THRESHOLD,
                SimilarityMetricRegistry.defaults());
    }

    public static SimilarityCritic of(
            String field, double weight, String metric, double similarityThreshold) {
        return new SimilarityCritic(
                field, weight, metric, similarityThreshold, SimilarityMetricRegistry.defaults());
    }

    /// @throws CriticConfigurationException if `metric` is not registered
    @Override
    public CriticResult evaluate(Object expected, Object actual) {
        SimilarityMetric strategy =
                metrics.find(metric)
                        .orElseThrow(
                                () ->
                                        new CriticConfigurationException(
                                                field,
                                                "unsupported similarity metric: "
                                                        + metric
                                                        + " (registered: "
                                                        + metrics.names()
                                                        + ")"));

        double similarity =
                CriticWeights.bound(
                        strategy.similarity(String.valueOf(expected), String.valueOf(actual)));
        return new CriticResult(similarity >= similarityThreshold, weight * similarity);
    }
}
