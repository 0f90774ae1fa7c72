package io.toolgrade.core.tool;

import io.toolgrade.core.toolcall.ActualToolCall;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Checks actual tool calls against a catalog before they are scored.
///
/// A call is rejected when its tool is unknown to the catalog or when it omits a
/// required parameter. A parameter explicitly set to `null` counts as omitted.
public final class ToolCallValidator {

    private final ToolRegistry catalog;

    /// @param catalog tools offered to the model, not null
    public ToolCallValidator(ToolRegistry catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /// Validates calls in order and reports the first violation.
    ///
    /// @param calls actual calls to validate, not null
    /// @return failure message for the first invalid call, or empty when all are valid
    public Optional<String> validate(List<ActualToolCall> calls) {
        Objects.requireNonNull(calls, "calls must not be null");
        for (ActualToolCall call : calls) {
            Optional<String> violation = validate(call);
            if (violation.isPresent()) {
                return violation;
            }
        }
        return Optional.empty();
    }

    /// Validates a single call.
    ///
    /// @param call actual call, not null
    /// @return failure message, or empty when the call is valid
    public Optional<String> validate(ActualToolCall call) {
        Objects.requireNonNull(call, "call must not be null");
        Optional<ToolDefinition> definition = catalog.get(call.name());
        if (definition.isEmpty()) {
            return Optional.of("Tool '" + call.name() + "' not found in catalog");
        }
        List<String> missing =
                definition.get().requiredParameterNames().stream()
                        .filter(parameter -> call.arg(parameter) == null)
                        .toList();
        if (!missing.isEmpty()) {
            return Optional.of("Input validation failed: missing required parameters " + missing);
        }
        return Optional.empty();
    }
}
