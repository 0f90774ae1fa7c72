package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.toolgrade.core.suite.CaseOutcome;
import io.toolgrade.core.suite.SuiteReport;
import java.io.IOException;
import java.io.Serial;

/// Writes a report with a `summary` block ahead of the per-case outcomes.
class SuiteReportSerializer extends StdSerializer<SuiteReport> {

    @Serial private static final long serialVersionUID = 7380043912271680035L;

    SuiteReportSerializer() {
        super(SuiteReport.class);
    }

    @Override
    public void serialize(SuiteReport report, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("suite", report.suiteName());
        gen.writeStringField("model", report.model());
        gen.writeFieldName("startedAt");
        provider.defaultSerializeValue(report.startedAt(), gen);
        gen.writeFieldName("elapsed");
        provider.defaultSerializeValue(report.elapsed(), gen);

        gen.writeObjectFieldStart("summary");
        gen.writeNumberField("cases", report.outcomes().size());
        gen.writeNumberField("passed", report.passedCount());
        gen.writeNumberField("warned", report.warnedCount());
        gen.writeNumberField("failed", report.failedCount());
        gen.writeNumberField("meanScore", report.meanScore());
        gen.writeEndObject();

        gen.writeArrayFieldStart("outcomes");
        for (CaseOutcome outcome : report.outcomes()) {
            provider.defaultSerializeValue(outcome, gen);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
