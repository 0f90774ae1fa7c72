package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.provider.ToolChoice;
import io.toolgrade.core.suite.EvalSuite;
import io.toolgrade.core.tool.ToolDefinition;
import java.io.IOException;
import java.io.Serial;

/// Rebuilds a suite through {@link EvalSuite.Builder} so that duplicate case names and
/// other structural errors are rejected exactly as for hand-built suites.
class EvalSuiteDeserializer extends StdDeserializer<EvalSuite> {

    @Serial private static final long serialVersionUID = -5150298367221473925L;

    EvalSuiteDeserializer() {
        super(EvalSuite.class);
    }

    @Override
    public EvalSuite deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        EvalSuite.Builder builder =
                EvalSuite.builder()
                        .name(root.path("name").asText(null))
                        .systemMessage(root.path("systemMessage").asText(""))
                        .validateToolCalls(root.path("validateToolCalls").asBoolean(false));

        if (root.hasNonNull("toolChoice")) {
            builder.toolChoice(ToolChoice.valueOf(root.get("toolChoice").asText()));
        }
        for (JsonNode tool : root.path("tools")) {
            builder.tool(mapper.treeToValue(tool, ToolDefinition.class));
        }
        for (JsonNode evalCase : root.path("cases")) {
            builder.addCase(mapper.treeToValue(evalCase, EvalCase.class));
        }
        return builder.build();
    }
}
