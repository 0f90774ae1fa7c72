package io.toolgrade.core.suite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.toolgrade.core.ToolgradeConfig;
import io.toolgrade.core.critic.BinaryCritic;
import io.toolgrade.core.critic.NumericCritic;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.exception.CriticConfigurationException;
import io.toolgrade.core.exception.ToolCallProviderException;
import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.provider.ConversationMessage;
import io.toolgrade.core.provider.ToolCallProvider;
import io.toolgrade.core.provider.ToolCallRequest;
import io.toolgrade.core.provider.ToolCallResponse;
import io.toolgrade.core.provider.ToolChoice;
import io.toolgrade.core.provider.stub.StubToolCallProvider;
import io.toolgrade.core.rubric.Classification;
import io.toolgrade.core.rubric.EvalRubric;
import io.toolgrade.core.tool.ToolDefinition;
import io.toolgrade.core.tool.ToolDefinition.ParameterDef;
import io.toolgrade.core.toolcall.ActualToolCall;
import io.toolgrade.core.toolcall.ExpectedToolCall;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EvalSuiteRunnerTest {

    private static final String SEND = "Send the report to a@example.com";
    private static final String ARCHIVE = "Archive this thread";

    private static EvalSuite emailSuite() {
        return EvalSuite.builder()
                .name("email")
                .systemMessage("You manage email.")
                .tool(
                        ToolDefinition.of(
                                "send_email",
                                "Send an email",
                                List.of(ParameterDef.required("to", "string", "Recipient"))))
                .tool(ToolDefinition.simple("archive_email", "Archive the thread"))
                .toolChoice(ToolChoice.REQUIRED)
                .addCase(
                        EvalCase.builder()
                                .name("send")
                                .userMessage(SEND)
                                .expectedToolCall(
                                        ExpectedToolCall.of(
                                                "send_email", Map.of("to", "a@example.com")))
                                .critics(List.of(BinaryCritic.of("to", 1.0)))
                                .rubric(EvalRubric.of(0.5, 0.8))
                                .build())
                .addCase(
                        EvalCase.builder()
                                .name("archive")
                                .userMessage(ARCHIVE)
                                .expectedToolCall(ExpectedToolCall.of("archive_email"))
                                .build())
                .build();
    }

    private static StubToolCallProvider scriptedProvider() {
        return new StubToolCallProvider()
                .respond(
                        SEND,
                        List.of(ActualToolCall.of("send_email", Map.of("to", "a@example.com"))))
                .respond(ARCHIVE, List.of(ActualToolCall.of("archive_email")));
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isFor(ToolCallRequest request, String userMessage) {
        return request != null && request.lastUserMessage().equals(userMessage);
    }

    @Nested
    class Sequential {

        @Test
        void shouldScoreEveryCaseInOrder() {
            try (EvalSuiteRunner runner =
                    new EvalSuiteRunner(scriptedProvider(), new ToolgradeConfig())) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                assertThat(report.suiteName()).isEqualTo("email");
                assertThat(report.model()).isEqualTo("gpt-4o");
                assertThat(report.outcomes())
                        .extracting(CaseOutcome::caseName)
                        .containsExactly("send", "archive");
                assertThat(report.allPassed()).isTrue();
                assertThat(report.meanScore()).isEqualTo(1.0);
            }
        }

        @Test
        void shouldSendConversationCatalogAndToolChoice() {
            ToolCallProvider provider = mock(ToolCallProvider.class);
            when(provider.requestToolCalls(any())).thenReturn(ToolCallResponse.ToolCalls.none());

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
                runner.run(emailSuite(), "claude-sonnet-4");
            }

            List<ConversationMessage> expectedMessages =
                    List.of(
                            ConversationMessage.system("You manage email."),
                            ConversationMessage.user(SEND));
            verify(provider)
                    .requestToolCalls(
                            argThat(
                                    (ToolCallRequest request) ->
                                            request.model().equals("claude-sonnet-4")
                                                    && request.messages().equals(expectedMessages)
                                                    && request.tools().size() == 2
                                                    && request.toolChoice() == ToolChoice.REQUIRED));
        }

        @Test
        void shouldFailCaseOnProviderErrorAndContinue() {
            ToolCallProvider provider = mock(ToolCallProvider.class);
            when(provider.requestToolCalls(argThat(r -> isFor(r, SEND))))
                    .thenReturn(ToolCallResponse.Error.of("rate limited"));
            when(provider.requestToolCalls(argThat(r -> isFor(r, ARCHIVE))))
                    .thenReturn(
                            ToolCallResponse.ToolCalls.of(
                                    List.of(ActualToolCall.of("archive_email"))));

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                CaseOutcome send = report.outcome("send").orElseThrow();
                assertThat(send.evaluation().failed()).isTrue();
                assertThat(send.evaluation().getFailureReason())
                        .hasValue("Provider error: rate limited");
                assertThat(send.actualToolCalls()).isEmpty();
                assertThat(report.outcome("archive").orElseThrow().evaluation().passed()).isTrue();
                assertThat(report.failedCount()).isEqualTo(1);
                assertThat(report.passedCount()).isEqualTo(1);
            }
        }

        @Test
        void shouldFailCaseWhenProviderThrows() {
            ToolCallProvider provider = mock(ToolCallProvider.class);
            when(provider.requestToolCalls(any()))
                    .thenThrow(new ToolCallProviderException("connection refused"));

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                assertThat(report.failedCount()).isEqualTo(2);
                assertThat(report.outcomes().get(0).evaluation().getFailureReason())
                        .hasValue("Provider failure: connection refused");
            }
            verify(provider, times(2)).requestToolCalls(any());
        }

        @Test
        void shouldPropagateCriticConfigurationErrors() {
            EvalSuite suite =
                    EvalSuite.builder()
                            .name("broken")
                            .addCase(
                                    EvalCase.builder()
                                            .name("flag")
                                            .userMessage("Flag it")
                                            .expectedToolCall(
                                                    ExpectedToolCall.of(
                                                            "flag_email", Map.of("priority", 3)))
                                            .critics(List.of(NumericCritic.of("priority", 0.5, 1, 1)))
                                            .build())
                            .build();
            StubToolCallProvider provider =
                    new StubToolCallProvider()
                            .respond(
                                    "Flag it",
                                    List.of(ActualToolCall.of("flag_email", Map.of("priority", 3))));

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
                assertThatThrownBy(() -> runner.run(suite, "gpt-4o"))
                        .isInstanceOf(CriticConfigurationException.class);
            }
        }
    }

    @Nested
    class CatalogValidation {

        @Test
        void shouldFailUnknownToolWhenValidationEnabled() {
            EvalSuite suite =
                    EvalSuite.builder()
                            .name("email")
                            .tool(ToolDefinition.simple("archive_email", "Archive"))
                            .validateToolCalls(true)
                            .addCase(
                                    EvalCase.builder()
                                            .name("archive")
                                            .userMessage(ARCHIVE)
                                            .expectedToolCall(ExpectedToolCall.of("archive_email"))
                                            .rubric(
                                                    EvalRubric.builder()
                                                            .failOnToolSelection(false)
                                                            .failOnToolCallQuantity(false)
                                                            .build())
                                            .build())
                            .build();
            StubToolCallProvider provider =
                    new StubToolCallProvider()
                            .respond(
                                    ARCHIVE,
                                    List.of(
                                            ActualToolCall.of("archive_email"),
                                            ActualToolCall.of("delete_email")));

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
                CaseOutcome outcome = runner.run(suite, "gpt-4o").outcomes().get(0);

                assertThat(outcome.evaluation().getFailureReason())
                        .hasValue("Tool 'delete_email' not found in catalog");
                assertThat(outcome.actualToolCalls()).hasSize(2);
            }
        }

        @Test
        void shouldFailMissingRequiredParameterWhenForcedByConfig() {
            StubToolCallProvider provider =
                    scriptedProvider().respond(SEND, List.of(ActualToolCall.of("send_email")));
            ToolgradeConfig config = ToolgradeConfig.builder().validateToolCalls(true).build();

            try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, config)) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                assertThat(report.outcome("send").orElseThrow().evaluation().getFailureReason())
                        .hasValue("Input validation failed: missing required parameters [to]");
                assertThat(report.outcome("archive").orElseThrow().evaluation().passed()).isTrue();
            }
        }
    }

    @Nested
    class Parallel {

        @Test
        void shouldPreserveCaseOrder() {
            EvalSuite.Builder builder = EvalSuite.builder().name("bulk");
            StubToolCallProvider provider = new StubToolCallProvider();
            for (int i = 0; i < 20; i++) {
                String message = "Archive thread " + i;
                builder.addCase(
                        EvalCase.builder()
                                .name("case-" + i)
                                .userMessage(message)
                                .expectedToolCall(ExpectedToolCall.of("archive_email"))
                                .build());
                provider.respond(message, List.of(ActualToolCall.of("archive_email")));
            }

            try (EvalSuiteRunner runner =
                    new EvalSuiteRunner(provider, ToolgradeConfig.builder().parallelism(4).build())) {
                SuiteReport report = runner.run(builder.build(), "gpt-4o");

                assertThat(report.outcomes()).hasSize(20);
                for (int i = 0; i < 20; i++) {
                    assertThat(report.outcomes().get(i).caseName()).isEqualTo("case-" + i);
                }
                assertThat(report.allPassed()).isTrue();
            }
        }

        @Test
        void shouldFailCaseThatExceedsTimeout() {
            ToolCallProvider slowOnSend =
                    request -> {
                        if (request.lastUserMessage().equals(SEND)) {
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return ToolCallResponse.ToolCalls.none();
                        }
                        return ToolCallResponse.ToolCalls.of(
                                List.of(ActualToolCall.of("archive_email")));
                    };
            ToolgradeConfig config =
                    ToolgradeConfig.builder()
                            .parallelism(2)
                            .caseTimeout(Duration.ofMillis(200))
                            .build();

            try (EvalSuiteRunner runner = new EvalSuiteRunner(slowOnSend, config)) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                assertThat(report.outcome("send").orElseThrow().evaluation().getFailureReason())
                        .hasValue("Case timed out after 200ms");
                assertThat(report.outcome("archive").orElseThrow().evaluation().getClassification())
                        .isEqualTo(Classification.PASS);
            }
        }

        @Test
        void shouldMeasureTimeoutFromCaseStart() {
            ToolCallProvider staggered =
                    request -> {
                        boolean send = request.lastUserMessage().equals(SEND);
                        pause(send ? 250 : 450);
                        return ToolCallResponse.ToolCalls.of(
                                List.of(
                                        send
                                                ? ActualToolCall.of(
                                                        "send_email", Map.of("to", "a@example.com"))
                                                : ActualToolCall.of("archive_email")));
                    };
            ToolgradeConfig config =
                    ToolgradeConfig.builder()
                            .parallelism(2)
                            .caseTimeout(Duration.ofMillis(300))
                            .build();

            try (EvalSuiteRunner runner = new EvalSuiteRunner(staggered, config)) {
                SuiteReport report = runner.run(emailSuite(), "gpt-4o");

                assertThat(report.outcome("send").orElseThrow().evaluation().passed()).isTrue();
                assertThat(report.outcome("archive").orElseThrow().evaluation().getFailureReason())
                        .hasValue("Case timed out after 300ms");
            }
        }
    }

    @Test
    void shouldProduceOneReportPerModel() {
        StubToolCallProvider provider =
                scriptedProvider()
                        .respond(
                                "weak-model",
                                SEND,
                                List.of(ActualToolCall.of("send_email", Map.of("to", "b@example.com"))));

        try (EvalSuiteRunner runner = new EvalSuiteRunner(provider, new ToolgradeConfig())) {
            List<SuiteReport> reports =
                    runner.run(emailSuite(), List.of("strong-model", "weak-model"));

            assertThat(reports)
                    .extracting(SuiteReport::model)
                    .containsExactly("strong-model", "weak-model");
            assertThat(reports.get(0).allPassed()).isTrue();
            assertThat(reports.get(1).outcome("send").orElseThrow().evaluation().warned()).isTrue();
        }
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        ToolCallProvider provider = mock(ToolCallProvider.class);

        assertThatThrownBy(
                        () ->
                                new EvalSuiteRunner(
                                        provider, ToolgradeConfig.builder().parallelism(0).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(
                        () ->
                                new EvalSuiteRunner(
                                        provider,
                                        ToolgradeConfig.builder().caseTimeout(Duration.ZERO).build()))
                .isInstanceOf(ValidationException.class);
    }
}
