package io.toolgrade.adapter.langchain4j;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.toolgrade.core.tool.ToolDefinition;
import io.toolgrade.core.tool.ToolDefinition.ParameterDef;
import java.util.List;
import java.util.Locale;

/// Maps catalog tool definitions to LangChain4j tool specifications.
///
/// Parameter types use JSON Schema names (`string`, `integer`, `number`, `boolean`, `array`,
/// `object`); unknown types are offered as strings.
final class ToolSpecifications {

    private ToolSpecifications() {}

    static List<ToolSpecification> from(List<ToolDefinition> tools) {
        return tools.stream().map(ToolSpecifications::from).toList();
    }

    static ToolSpecification from(ToolDefinition tool) {
        JsonObjectSchema.Builder parameters = JsonObjectSchema.builder();
        for (ParameterDef parameter : tool.parameters()) {
            parameters.addProperty(parameter.name(), schemaFor(parameter));
        }
        parameters.required(tool.requiredParameterNames());

        return ToolSpecification.builder()
                .name(tool.name())
                .description(tool.description())
                .parameters(parameters.build())
                .build();
    }

    private static JsonSchemaElement schemaFor(ParameterDef parameter) {
        String description = parameter.description();
        String type = parameter.type() != null ? parameter.type().toLowerCase(Locale.ROOT) : "";
        return switch (type) {
            case "integer" -> JsonIntegerSchema.builder().description(description).build();
            case "number" -> JsonNumberSchema.builder().description(description).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description).build();
            case "array" ->
                    JsonArraySchema.builder()
                            .description(description)
                            .items(JsonStringSchema.builder().build())
                            .build();
            case "object" -> JsonObjectSchema.builder().description(description).build();
            default -> JsonStringSchema.builder().description(description).build();
        };
    }
}
