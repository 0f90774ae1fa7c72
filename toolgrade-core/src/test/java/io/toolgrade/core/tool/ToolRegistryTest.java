package io.toolgrade.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.tool.ToolDefinition.ParameterDef;
import io.toolgrade.core.toolcall.ActualToolCall;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    private static final ToolDefinition SEND_EMAIL =
            ToolDefinition.of(
                    "send_email",
                    "Send an email",
                    List.of(
                            ParameterDef.required("to", "string", "Recipient address"),
                            ParameterDef.required("subject", "string", "Subject line"),
                            ParameterDef.optional("priority", "integer", "1 to 5", 3)));

    private DefaultToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultToolRegistry();
    }

    @Nested
    class Registration {

        @Test
        void shouldRegisterAndRetrieveTool() {
            registry.register(SEND_EMAIL);

            assertThat(registry.contains("send_email")).isTrue();
            assertThat(registry.get("send_email")).hasValue(SEND_EMAIL);
            assertThat(registry.isEmpty()).isFalse();
        }

        @Test
        void shouldReplaceToolWithSameName() {
            registry.register(ToolDefinition.simple("archive_email", "Original"));
            registry.register(ToolDefinition.simple("archive_email", "Replacement"));

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.get("archive_email"))
                    .hasValueSatisfying(t -> assertThat(t.description()).isEqualTo("Replacement"));
        }

        @Test
        void shouldExposeReadOnlyViewThatTracksBackingRegistry() {
            ToolRegistry view = ToolRegistry.unmodifiable(registry);
            registry.register(SEND_EMAIL);

            assertThat(view.get("send_email")).hasValue(SEND_EMAIL);
            assertThat(view.all()).containsExactly(SEND_EMAIL);
            assertThatThrownBy(() -> view.register(ToolDefinition.simple("archive_email", "Archive")))
                    .isInstanceOf(UnsupportedOperationException.class)
                    .hasMessageContaining("archive_email");
            assertThat(registry.contains("archive_email")).isFalse();
            assertThat(ToolRegistry.unmodifiable(view)).isSameAs(view);
        }

        @Test
        void shouldListToolsByName() {
            registry.register(ToolDefinition.simple("send_email", "Send"));
            registry.register(ToolDefinition.simple("archive_email", "Archive"));
            registry.register(ToolDefinition.simple("flag_email", "Flag"));

            assertThat(registry.all())
                    .extracting(ToolDefinition::name)
                    .containsExactly("archive_email", "flag_email", "send_email");
        }

        @Test
        void shouldRejectBlankToolName() {
            assertThatThrownBy(() -> ToolDefinition.simple(" ", "Nothing"))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class Validation {

        private ToolCallValidator validator;

        @BeforeEach
        void setUp() {
            registry.register(SEND_EMAIL);
            validator = new ToolCallValidator(registry);
        }

        @Test
        void shouldAcceptCallWithRequiredParameters() {
            ActualToolCall call =
                    ActualToolCall.of("send_email", Map.of("to", "a@example.com", "subject", "Hi"));

            assertThat(validator.validate(List.of(call))).isEmpty();
        }

        @Test
        void shouldRejectUnknownTool() {
            assertThat(validator.validate(List.of(ActualToolCall.of("delete_email"))))
                    .hasValue("Tool 'delete_email' not found in catalog");
        }

        @Test
        void shouldListMissingRequiredParameters() {
            assertThat(validator.validate(ActualToolCall.of("send_email", Map.of("priority", 1))))
                    .hasValue("Input validation failed: missing required parameters [to, subject]");
        }

        @Test
        void shouldTreatNullParameterAsMissing() {
            Map<String, Object> args = new HashMap<>();
            args.put("to", "a@example.com");
            args.put("subject", null);

            assertThat(validator.validate(ActualToolCall.of("send_email", args)))
                    .hasValue("Input validation failed: missing required parameters [subject]");
        }

        @Test
        void shouldReportFirstInvalidCall() {
            assertThat(
                            validator.validate(
                                    List.of(
                                            ActualToolCall.of(
                                                    "send_email",
                                                    Map.of("to", "a@example.com", "subject", "Hi")),
                                            ActualToolCall.of("archive_email"),
                                            ActualToolCall.of("send_email"))))
                    .hasValue("Tool 'archive_email' not found in catalog");
        }
    }
}
