package io.toolgrade.core.tool;

import io.toolgrade.core.exception.ValidationException;
import java.util.List;
import java.util.Objects;

/// Describes a tool offered to the model under evaluation.
///
/// Tool definitions form a suite's catalog. They are sent to the provider so the model
/// knows which functions exist, and used afterwards to validate the calls it made.
///
/// ### Usage
/// {@snippet :
/// ToolDefinition sendEmail = ToolDefinition.of(
///     "send_email",
///     "Send an email to a recipient",
///     List.of(
///         ParameterDef.required("recipient", "string", "Email address"),
///         ParameterDef.optional("priority", "integer", "1 (low) to 5 (high)", 3)
///     )
/// );
/// }
///
/// @param name unique tool identifier, not null
/// @param description human-readable description for the model, not null
/// @param parameters input parameters accepted by the tool, not null (may be empty)
/// @see ToolRegistry for tool registration
/// @see ToolCallValidator for validating calls against definitions
public record ToolDefinition(String name, String description, List<ParameterDef> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new ValidationException("Tool name must not be blank");
        }
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    /// Creates a tool definition.
    ///
    /// @param name unique tool identifier, not null
    /// @param description human-readable description, not null
    /// @param parameters input parameters, not null
    /// @return new tool definition, never null
    public static ToolDefinition of(
            String name, String description, List<ParameterDef> parameters) {
        return new ToolDefinition(name, description, parameters);
    }

    /// Creates a tool definition with no parameters.
    public static ToolDefinition simple(String name, String description) {
        return new ToolDefinition(name, description, List.of());
    }

    /// Returns the names of required parameters in declaration order.
    ///
    /// @return required parameter names, never null
    public List<String> requiredParameterNames() {
        return parameters.stream().filter(ParameterDef::required).map(ParameterDef::name).toList();
    }

    /// Describes one tool parameter.
    ///
    /// @param name parameter identifier, not null
    /// @param type JSON schema type (string, integer, number, boolean, object, array), not null
    /// @param description human-readable description, not null
    /// @param required whether the model must supply the parameter
    /// @param defaultValue value assumed when not supplied, may be null
    public record ParameterDef(
            String name, String type, String description, boolean required, Object defaultValue) {

        public ParameterDef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }

        public static ParameterDef required(String name, String type, String description) {
            return new ParameterDef(name, type, description, true, null);
        }

        public static ParameterDef optional(
                String name, String type, String description, Object defaultValue) {
            return new ParameterDef(name, type, description, false, defaultValue);
        }
    }
}
