package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.suite.EvalSuite;
import io.toolgrade.core.tool.ToolDefinition;
import java.io.IOException;
import java.io.Serial;

class EvalSuiteSerializer extends StdSerializer<EvalSuite> {

    @Serial private static final long serialVersionUID = 2290715832614120433L;

    EvalSuiteSerializer() {
        super(EvalSuite.class);
    }

    @Override
    public void serialize(EvalSuite suite, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", suite.getName());
        gen.writeStringField("systemMessage", suite.getSystemMessage());
        gen.writeStringField("toolChoice", suite.getToolChoice().name());
        gen.writeBooleanField("validateToolCalls", suite.isValidateToolCalls());

        gen.writeArrayFieldStart("tools");
        for (ToolDefinition tool : suite.getToolCatalog().all()) {
            provider.defaultSerializeValue(tool, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("cases");
        for (EvalCase evalCase : suite.getCases()) {
            provider.defaultSerializeValue(evalCase, gen);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
