package io.toolgrade.core.critic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.toolgrade.core.critic.similarity.SimilarityMetricRegistry;
import io.toolgrade.core.exception.CriticConfigurationException;
import org.junit.jupiter.api.Test;

class SimilarityCriticTest {

    @Test
    void shouldScoreIdenticalTextAtFullWeight() {
        SimilarityCritic critic = SimilarityCritic.of("body", 0.5);

        CriticResult result = critic.evaluate("Quarterly sales report", "quarterly sales report");

        assertThat(result.matched()).isTrue();
        assertThat(result.score()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldNotMatchIdenticalTextWithoutTokens() {
        SimilarityCritic critic = SimilarityCritic.of("code", 1.0);

        CriticResult result = critic.evaluate("a", "a");

        assertThat(result.matched()).isFalse();
        assertThat(result.score()).isZero();
    }

    @Test
    void shouldScoreUnrelatedTextAtZero() {
        SimilarityCritic critic = SimilarityCritic.of("body", 0.5);

        CriticResult result = critic.evaluate("quarterly report", "annual budget");

        assertThat(result.matched()).isFalse();
        assertThat(result.score()).isZero();
    }

    @Test
    void shouldNotMatchPartialOverlapBelowThreshold() {
        SimilarityCritic critic = SimilarityCritic.of("body", 1.0);

        CriticResult result = critic.evaluate("quarterly sales report", "quarterly report");

        assertThat(result.score()).isCloseTo(0.709, within(0.01));
        assertThat(result.matched()).isFalse();
    }

    @Test
    void shouldUseNamedMetric() {
        SimilarityCritic critic = SimilarityCritic.of("body", 1.0, "jaccard", 0.5);

        CriticResult result = critic.evaluate("quarterly sales report", "quarterly report");

        assertThat(result.score()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(result.matched()).isTrue();
    }

    @Test
    void shouldStringifyNonTextValues() {
        SimilarityCritic critic = SimilarityCritic.of("code", 1.0);

        assertThat(critic.evaluate(42, "42").matched()).isTrue();
    }

    @Test
    void shouldUseCustomRegistry() {
        SimilarityMetricRegistry metrics =
                SimilarityMetricRegistry.defaults().with("always", (left, right) -> 1.0);
        SimilarityCritic critic = new SimilarityCritic("body", 0.3, "always", 0.9, metrics);

        assertThat(critic.evaluate("x", "y").score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void shouldClampOutOfRangeMetricResults() {
        SimilarityMetricRegistry metrics =
                SimilarityMetricRegistry.builder().register("wild", (left, right) -> 7.5).build();
        SimilarityCritic critic = new SimilarityCritic("body", 0.3, "wild", 0.9, metrics);

        assertThat(critic.evaluate("x", "y").score()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void shouldFailOnUnknownMetric() {
        SimilarityCritic critic = SimilarityCritic.of("body", 0.5, "levenshtein", 0.8);

        assertThatThrownBy(() -> critic.evaluate("a", "b"))
                .isInstanceOf(CriticConfigurationException.class)
                .hasMessageContaining("unsupported similarity metric: levenshtein");
    }
}
