package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.toolgrade.core.critic.BinaryCritic;
import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.critic.NumericCritic;
import io.toolgrade.core.critic.SimilarityCritic;
import io.toolgrade.core.critic.ToolSelectionCritic;
import io.toolgrade.core.critic.ValueRange;
import io.toolgrade.core.critic.similarity.SimilarityMetricRegistry;
import java.io.IOException;
import java.io.Serial;
import java.util.Objects;

/// Reads critics written by {@link CriticSerializer}.
///
/// Optional thresholds and the similarity metric fall back to the critics' defaults.
/// Similarity critics are bound to the registry this deserializer was created with.
class CriticDeserializer extends StdDeserializer<Critic> {

    @Serial private static final long serialVersionUID = -3050846419532675187L;

    private final transient SimilarityMetricRegistry metrics;

    CriticDeserializer(SimilarityMetricRegistry metrics) {
        super(Critic.class);
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public Critic deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw JsonMappingException.from(p, "Critic is missing its 'type' field");
        }
        String type = typeNode.asText();

        return switch (type) {
            case CriticSerializer.BINARY ->
                    new BinaryCritic(requiredText(p, root, "field"), requiredDouble(p, root, "weight"));
            case CriticSerializer.NUMERIC ->
                    new NumericCritic(
                            requiredText(p, root, "field"),
                            requiredDouble(p, root, "weight"),
                            ValueRange.of(requiredDouble(p, root, "min"), requiredDouble(p, root, "max")),
                            root.path("matchThreshold")
                                    .asDouble(NumericCritic.DEFAULT_MATCH_THRESHOLD));
            case CriticSerializer.SIMILARITY ->
                    new SimilarityCritic(
                            requiredText(p, root, "field"),
                            requiredDouble(p, root, "weight"),
                            root.path("metric").asText(SimilarityCritic.DEFAULT_METRIC),
                            root.path("similarityThreshold")
                                    .asDouble(SimilarityCritic.DEFAULT_SIMILARITY_THRESHOLD),
                            metrics);
            case CriticSerializer.TOOL_SELECTION ->
                    new ToolSelectionCritic(requiredDouble(p, root, "weight"));
            default -> throw JsonMappingException.from(p, "Unknown critic type: " + type);
        };
    }

    private static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw JsonMappingException.from(p, "Critic is missing '" + field + "'");
        }
        return node.asText();
    }

    private static double requiredDouble(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw JsonMappingException.from(p, "Critic '" + field + "' must be a number");
        }
        return node.doubleValue();
    }
}
