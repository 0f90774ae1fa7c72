package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.toolgrade.core.critic.BinaryCritic;
import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.critic.NumericCritic;
import io.toolgrade.core.critic.SimilarityCritic;
import io.toolgrade.core.critic.ToolSelectionCritic;
import java.io.IOException;
import java.io.Serial;

/// Writes critics as flat objects discriminated by a `type` field.
///
/// The similarity metric registry of a {@link SimilarityCritic} is not written; only the
/// metric name is.
class CriticSerializer extends StdSerializer<Critic> {

    @Serial private static final long serialVersionUID = 4417395283604715520L;

    static final String BINARY = "binary";
    static final String NUMERIC = "numeric";
    static final String SIMILARITY = "similarity";
    static final String TOOL_SELECTION = "tool_selection";

    CriticSerializer() {
        super(Critic.class);
    }

    @Override
    public void serialize(Critic critic, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (critic instanceof BinaryCritic) {
            gen.writeStringField("type", BINARY);
            gen.writeStringField("field", critic.field());
            gen.writeNumberField("weight", critic.weight());
        } else if (critic instanceof NumericCritic numeric) {
            gen.writeStringField("type", NUMERIC);
            gen.writeStringField("field", numeric.field());
            gen.writeNumberField("weight", numeric.weight());
            gen.writeNumberField("min", numeric.valueRange().min());
            gen.writeNumberField("max", numeric.valueRange().max());
            gen.writeNumberField("matchThreshold", numeric.matchThreshold());
        } else if (critic instanceof SimilarityCritic similarity) {
            gen.writeStringField("type", SIMILARITY);
            gen.writeStringField("field", similarity.field());
            gen.writeNumberField("weight", similarity.weight());
            gen.writeStringField("metric", similarity.metric());
            gen.writeNumberField("similarityThreshold", similarity.similarityThreshold());
        } else if (critic instanceof ToolSelectionCritic) {
            gen.writeStringField("type", TOOL_SELECTION);
            gen.writeNumberField("weight", critic.weight());
        } else {
            throw new IOException("Unsupported critic: " + critic.getClass().getName());
        }

        gen.writeEndObject();
    }
}
