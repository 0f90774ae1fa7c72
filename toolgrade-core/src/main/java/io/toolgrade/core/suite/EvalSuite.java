package io.toolgrade.core.suite;

import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.provider.ToolChoice;
import io.toolgrade.core.tool.DefaultToolRegistry;
import io.toolgrade.core.tool.ToolDefinition;
import io.toolgrade.core.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/// Ordered collection of evaluation cases sharing a system message and tool catalog.
///
/// ### Usage
/// {@snippet :
/// EvalSuite suite = EvalSuite.builder()
///     .name("email-assistant")
///     .systemMessage("You are an email assistant.")
///     .tool(sendEmailTool)
///     .addCase(EvalCase.builder()
///         .name("send")
///         .userMessage("Send a report to john@example.com")
///         .expectedToolCall(ExpectedToolCall.of("send_email", Map.of("recipient", "john@example.com")))
///         .build())
///     .extendCase("send-urgent", "Actually make it urgent")
///     .build();
/// }
///
/// @implNote Immutable after construction. The catalog is copied into a private registry
/// and exposed only as a read-only view.
///
/// @see EvalSuiteRunner for running a suite against models
public final class EvalSuite {

    private final String name;
    private final String systemMessage;
    private final List<EvalCase> cases;
    private final ToolRegistry toolCatalog;
    private final ToolChoice toolChoice;
    private final boolean validateToolCalls;

    private EvalSuite(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Suite name required");
        if (name.isBlank()) {
            throw new ValidationException("Suite name must not be blank");
        }
        this.systemMessage = Objects.requireNonNull(builder.systemMessage, "System message required");
        this.cases = List.copyOf(builder.cases);
        this.toolCatalog = ToolRegistry.unmodifiable(new DefaultToolRegistry(builder.tools));
        this.toolChoice = Objects.requireNonNull(builder.toolChoice, "Tool choice required");
        this.validateToolCalls = builder.validateToolCalls;
    }

    public String getName() {
        return name;
    }

    public String getSystemMessage() {
        return systemMessage;
    }

    public List<EvalCase> getCases() {
        return cases;
    }

    /// Returns the case with the given name.
    public Optional<EvalCase> getCase(String caseName) {
        return cases.stream().filter(c -> c.getName().equals(caseName)).findFirst();
    }

    /// Returns the suite's tool catalog.
    ///
    /// @return read-only registry; `register` throws `UnsupportedOperationException`
    public ToolRegistry getToolCatalog() {
        return toolCatalog;
    }

    public ToolChoice getToolChoice() {
        return toolChoice;
    }

    /// Returns whether actual calls are checked against the catalog before scoring.
    public boolean isValidateToolCalls() {
        return validateToolCalls;
    }

    public int size() {
        return cases.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link EvalSuite}.
    ///
    /// Case names must be unique within a suite. Defaults: empty system message,
    /// empty catalog, {@link ToolChoice#AUTO}, no catalog validation.
    public static final class Builder {
        private String name;
        private String systemMessage = "";
        private final List<EvalCase> cases = new ArrayList<>();
        private final Set<String> caseNames = new HashSet<>();
        private final List<ToolDefinition> tools = new ArrayList<>();
        private ToolChoice toolChoice = ToolChoice.AUTO;
        private boolean validateToolCalls;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder systemMessage(String systemMessage) {
            this.systemMessage = systemMessage;
            return this;
        }

        public Builder tool(ToolDefinition tool) {
            tools.add(Objects.requireNonNull(tool, "tool must not be null"));
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            tools.forEach(this::tool);
            return this;
        }

        public Builder toolChoice(ToolChoice toolChoice) {
            this.toolChoice = toolChoice;
            return this;
        }

        public Builder validateToolCalls(boolean validateToolCalls) {
            this.validateToolCalls = validateToolCalls;
            return this;
        }

        /// Appends a case.
        ///
        /// @param evalCase case to append, not null
        /// @return this builder
        /// @throws ValidationException if a case with the same name was already added
        public Builder addCase(EvalCase evalCase) {
            Objects.requireNonNull(evalCase, "evalCase must not be null");
            if (!caseNames.add(evalCase.getName())) {
                throw new ValidationException("Duplicate case name: " + evalCase.getName());
            }
            cases.add(evalCase);
            return this;
        }

        /// Appends a follow-up of the last added case with the same expectations.
        ///
        /// @see #extendCase(String, String, UnaryOperator)
        public Builder extendCase(String caseName, String userMessage) {
            return extendCase(caseName, userMessage, UnaryOperator.identity());
        }

        /// Appends a follow-up of the last added case.
        ///
        /// The new case's history is the previous case's history followed by the previous
        /// user message. Expected calls, critics and rubric are inherited unless
        /// `overrides` replaces them.
        ///
        /// @param caseName name of the new case, not null
        /// @param userMessage next user turn, not null
        /// @param overrides adjustments applied to the inherited builder, not null
        /// @return this builder
        /// @throws ValidationException if no case has been added yet or the name is taken
        public Builder extendCase(
                String caseName, String userMessage, UnaryOperator<EvalCase.Builder> overrides) {
            Objects.requireNonNull(overrides, "overrides must not be null");
            if (cases.isEmpty()) {
                throw new ValidationException(
                        "Cannot extend case '" + caseName + "': no case has been added yet");
            }
            EvalCase previous = cases.get(cases.size() - 1);
            return addCase(overrides.apply(previous.extend(caseName, userMessage)).build());
        }

        public EvalSuite build() {
            return new EvalSuite(this);
        }
    }

    @Override
    public String toString() {
        return "EvalSuite{name='" + name + "', cases=" + cases.size() + "}";
    }
}
