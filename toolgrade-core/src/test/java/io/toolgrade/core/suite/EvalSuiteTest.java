package io.toolgrade.core.suite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolgrade.core.critic.BinaryCritic;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.provider.ConversationMessage;
import io.toolgrade.core.provider.ToolChoice;
import io.toolgrade.core.rubric.EvalRubric;
import io.toolgrade.core.tool.ToolDefinition;
import io.toolgrade.core.toolcall.ExpectedToolCall;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvalSuiteTest {

    private static EvalCase sendCase() {
        return EvalCase.builder()
                .name("send")
                .userMessage("Send the report to a@example.com")
                .expectedToolCall(ExpectedToolCall.of("send_email", Map.of("to", "a@example.com")))
                .critics(List.of(BinaryCritic.of("to", 1.0)))
                .rubric(EvalRubric.of(0.5, 0.8))
                .build();
    }

    @Test
    void shouldKeepCasesInInsertionOrder() {
        EvalSuite suite =
                EvalSuite.builder()
                        .name("email")
                        .systemMessage("You manage email.")
                        .addCase(sendCase())
                        .addCase(
                                EvalCase.builder()
                                        .name("archive")
                                        .userMessage("Archive this thread")
                                        .expectedToolCall(ExpectedToolCall.of("archive_email"))
                                        .build())
                        .build();

        assertThat(suite.getCases())
                .extracting(EvalCase::getName)
                .containsExactly("send", "archive");
        assertThat(suite.getCase("archive")).isPresent();
        assertThat(suite.getToolChoice()).isEqualTo(ToolChoice.AUTO);
        assertThat(suite.isValidateToolCalls()).isFalse();
    }

    @Test
    void shouldExtendLastCaseWithHistory() {
        EvalSuite suite =
                EvalSuite.builder()
                        .name("email")
                        .addCase(sendCase())
                        .extendCase("send-urgent", "Mark it urgent")
                        .extendCase("send-cc", "Also cc b@example.com")
                        .build();

        EvalCase urgent = suite.getCase("send-urgent").orElseThrow();
        EvalCase cc = suite.getCase("send-cc").orElseThrow();

        assertThat(urgent.getAdditionalMessages())
                .containsExactly(ConversationMessage.user("Send the report to a@example.com"));
        assertThat(cc.getAdditionalMessages())
                .containsExactly(
                        ConversationMessage.user("Send the report to a@example.com"),
                        ConversationMessage.user("Mark it urgent"));
        assertThat(cc.getExpectedToolCalls()).isEqualTo(sendCase().getExpectedToolCalls());
        assertThat(cc.getRubric()).isEqualTo(EvalRubric.of(0.5, 0.8));
    }

    @Test
    void shouldApplyOverridesWhenExtending() {
        EvalSuite suite =
                EvalSuite.builder()
                        .name("email")
                        .addCase(sendCase())
                        .extendCase(
                                "then-archive",
                                "Now archive the thread",
                                b ->
                                        b.expectedToolCalls(
                                                        List.of(ExpectedToolCall.of("archive_email")))
                                                .critics(List.of()))
                        .build();

        EvalCase archive = suite.getCase("then-archive").orElseThrow();
        assertThat(archive.getExpectedToolCalls())
                .extracting(ExpectedToolCall::name)
                .containsExactly("archive_email");
        assertThat(archive.getCritics()).isEmpty();
    }

    @Test
    void shouldRejectExtendingEmptySuite() {
        assertThatThrownBy(() -> EvalSuite.builder().name("email").extendCase("x", "Hello"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no case has been added");
    }

    @Test
    void shouldRejectDuplicateCaseNames() {
        EvalSuite.Builder builder = EvalSuite.builder().name("email").addCase(sendCase());

        assertThatThrownBy(() -> builder.addCase(sendCase()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate case name: send");
    }

    @Test
    void shouldExposeCatalogSortedByName() {
        EvalSuite suite =
                EvalSuite.builder()
                        .name("email")
                        .tool(ToolDefinition.simple("send_email", "Send"))
                        .tool(ToolDefinition.simple("archive_email", "Archive"))
                        .toolChoice(ToolChoice.REQUIRED)
                        .validateToolCalls(true)
                        .build();

        assertThat(suite.getToolCatalog().all())
                .extracting(ToolDefinition::name)
                .containsExactly("archive_email", "send_email");
        assertThat(suite.isValidateToolCalls()).isTrue();
    }

    @Test
    void shouldRejectRegistrationIntoBuiltSuiteCatalog() {
        EvalSuite suite =
                EvalSuite.builder()
                        .name("email")
                        .tool(ToolDefinition.simple("send_email", "Send"))
                        .build();

        assertThatThrownBy(
                        () ->
                                suite.getToolCatalog()
                                        .register(ToolDefinition.simple("delete_email", "Delete")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(suite.getToolCatalog().contains("delete_email")).isFalse();
        assertThat(suite.getToolCatalog().size()).isEqualTo(1);
    }
}
