package io.toolgrade.core.critic.similarity;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Cosine similarity of TF-IDF vectors built from the two input texts alone.
///
/// The corpus is exactly the two documents being compared, so the idf only distinguishes
/// shared terms from terms unique to one side. This makes the value a relative signal:
/// it says how much vocabulary the texts share, not how close they are in meaning.
///
/// ### Weighting
/// - term frequency: raw counts
/// - inverse document frequency: `ln((1 + n) / (1 + df)) + 1` with `n = 2`
/// - vectors compared by cosine (equivalent to the dot product of L2-normalized vectors)
///
/// If either text yields no tokens the vectors are empty and the result is `0.0`, even
/// for identical texts such as `"a"` and `"a"`.
///
/// @implNote Stateless and thread-safe.
public final class CosineSimilarityMetric implements SimilarityMetric {

    public static final String NAME = "cosine";

    private static final int DOCUMENTS = 2;

    @Override
    public double similarity(String expected, String actual) {
        Map<String, Integer> left = termCounts(TextTokenizer.tokenize(expected));
        Map<String, Integer> right = termCounts(TextTokenizer.tokenize(actual));
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<String> vocabulary = new HashSet<>(left.keySet());
        vocabulary.addAll(right.keySet());

        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (String term : vocabulary) {
            int df = (left.containsKey(term) ? 1 : 0) + (right.containsKey(term) ? 1 : 0);
            double idf = Math.log((1.0 + DOCUMENTS) / (1.0 + df)) + 1.0;
            double l = left.getOrDefault(term, 0) * idf;
            double r = right.getOrDefault(term, 0) * idf;
            dot += l * r;
            leftNorm += l * l;
            rightNorm += r * r;
        }

        double similarity = dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    private static Map<String, Integer> termCounts(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }
}
