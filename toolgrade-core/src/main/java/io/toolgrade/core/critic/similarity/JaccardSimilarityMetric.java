package io.toolgrade.core.critic.similarity;

import java.util.HashSet;
import java.util.Set;

/// Token-set overlap: size of the intersection over size of the union.
///
/// Uses the same tokenizer as {@link CosineSimilarityMetric}. A text without tokens scores
/// `0.0` against anything, itself included.
public final class JaccardSimilarityMetric implements SimilarityMetric {

    public static final String NAME = "jaccard";

    @Override
    public double similarity(String expected, String actual) {
        Set<String> left = new HashSet<>(TextTokenizer.tokenize(expected));
        Set<String> right = new HashSet<>(TextTokenizer.tokenize(actual));
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }
}
