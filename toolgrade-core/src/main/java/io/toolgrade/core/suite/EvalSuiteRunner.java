package io.toolgrade.core.suite;

import io.toolgrade.core.ToolgradeConfig;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.evaluation.EvaluationResult;
import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.provider.ToolCallProvider;
import io.toolgrade.core.provider.ToolCallRequest;
import io.toolgrade.core.provider.ToolCallResponse;
import io.toolgrade.core.tool.ToolCallValidator;
import io.toolgrade.core.toolcall.ActualToolCall;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Runs evaluation suites against models through a {@link ToolCallProvider}.
///
/// For each case the runner assembles the conversation, asks the provider for tool calls,
/// optionally validates them against the suite's catalog, and scores them with
/// {@link EvalCase#evaluate(List)}.
///
/// ### Failure Handling
/// - Provider error responses and runtime exceptions become FAIL outcomes; the run continues
/// - Parallel cases exceeding the configured timeout become FAIL outcomes. The timeout is
///   measured from the moment a worker starts the case, so time spent queued behind other
///   cases does not count against it
/// - Critic configuration errors abort the run
///
/// ### Concurrency
/// With `parallelism == 1` cases run on the calling thread. Otherwise the runner owns a
/// fixed pool of that many threads plus one watchdog thread that cancels overdue cases,
/// all released by {@link #close()}. Report order always follows case order.
///
/// @see ToolgradeConfig for parallelism and timeout settings
public final class EvalSuiteRunner implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(EvalSuiteRunner.class.getName());

    private final ToolCallProvider provider;
    private final ToolgradeConfig config;
    private final ExecutorService executorService;
    private final ScheduledThreadPoolExecutor watchdog;

    /// Creates a runner.
    ///
    /// @param provider source of actual tool calls, not null
    /// @param config run configuration, not null
    /// @throws ValidationException if parallelism is below 1 or the timeout is not positive
    public EvalSuiteRunner(ToolCallProvider provider, ToolgradeConfig config) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.getParallelism() < 1) {
            throw new ValidationException(
                    "Parallelism must be at least 1, got " + config.getParallelism());
        }
        Duration timeout = config.getCaseTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("Case timeout must be positive, got " + timeout);
        }
        if (config.getParallelism() > 1) {
            this.executorService = Executors.newFixedThreadPool(config.getParallelism());
            this.watchdog = new ScheduledThreadPoolExecutor(1);
            this.watchdog.setRemoveOnCancelPolicy(true);
        } else {
            this.executorService = null;
            this.watchdog = null;
        }
    }

    /// Runs a suite against several models, one report per model in the given order.
    ///
    /// @param suite suite to run, not null
    /// @param models model identifiers, not null
    /// @return reports in model order, never null
    public List<SuiteReport> run(EvalSuite suite, List<String> models) {
        Objects.requireNonNull(models, "models must not be null");
        List<SuiteReport> reports = new ArrayList<>(models.size());
        for (String model : models) {
            reports.add(run(suite, model));
        }
        return List.copyOf(reports);
    }

    /// Runs a suite against one model.
    ///
    /// @param suite suite to run, not null
    /// @param model model identifier, not null
    /// @return report with one outcome per case in suite order, never null
    /// @throws io.toolgrade.core.exception.CriticConfigurationException if a critic cannot
    ///     execute
    public SuiteReport run(EvalSuite suite, String model) {
        Objects.requireNonNull(suite, "suite must not be null");
        Objects.requireNonNull(model, "model must not be null");

        logger.info(
                "Running suite '"
                        + suite.getName()
                        + "' against model "
                        + model
                        + " ("
                        + suite.size()
                        + " cases)");

        Instant startedAt = Instant.now();
        List<CaseOutcome> outcomes =
                executorService == null
                        ? runSequentially(suite, model)
                        : runInParallel(suite, model);

        SuiteReport report =
                new SuiteReport(
                        suite.getName(),
                        model,
                        startedAt,
                        Duration.between(startedAt, Instant.now()),
                        outcomes);
        logger.info(
                "Suite '"
                        + suite.getName()
                        + "' on "
                        + model
                        + ": "
                        + report.passedCount()
                        + " passed, "
                        + report.warnedCount()
                        + " warned, "
                        + report.failedCount()
                        + " failed");
        return report;
    }

    private List<CaseOutcome> runSequentially(EvalSuite suite, String model) {
        List<CaseOutcome> outcomes = new ArrayList<>(suite.size());
        for (EvalCase evalCase : suite.getCases()) {
            outcomes.add(runCase(suite, evalCase, model));
        }
        return outcomes;
    }

    private List<CaseOutcome> runInParallel(EvalSuite suite, String model) {
        long timeoutMillis = config.getCaseTimeout().toMillis();
        List<FutureTask<CaseOutcome>> tasks = new ArrayList<>(suite.size());
        for (EvalCase evalCase : suite.getCases()) {
            FutureTask<CaseOutcome> task = new FutureTask<>(() -> runCase(suite, evalCase, model));
            tasks.add(task);
            executorService.execute(() -> runWithDeadline(task, timeoutMillis));
        }

        List<CaseOutcome> outcomes = new ArrayList<>(suite.size());
        for (int i = 0; i < tasks.size(); i++) {
            FutureTask<CaseOutcome> task = tasks.get(i);
            EvalCase evalCase = suite.getCases().get(i);
            try {
                outcomes.add(task.get());
            } catch (CancellationException e) {
                logger.warning(
                        "Case timed out after " + timeoutMillis + "ms: " + evalCase.getName());
                outcomes.add(
                        failedOutcome(
                                evalCase,
                                List.of(),
                                "Case timed out after " + timeoutMillis + "ms"));
            } catch (ExecutionException e) {
                tasks.forEach(t -> t.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException(
                        "Case '" + evalCase.getName() + "' failed", cause);
            } catch (InterruptedException e) {
                tasks.forEach(t -> t.cancel(true));
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Suite run interrupted", e);
            }
        }
        return outcomes;
    }

    /// Runs a case on the current worker; the watchdog cancels it once `timeoutMillis`
    /// have passed since it started.
    private void runWithDeadline(FutureTask<CaseOutcome> task, long timeoutMillis) {
        ScheduledFuture<?> deadline =
                watchdog.schedule(() -> task.cancel(true), timeoutMillis, TimeUnit.MILLISECONDS);
        try {
            task.run();
        } finally {
            deadline.cancel(false);
        }
    }

    private CaseOutcome runCase(EvalSuite suite, EvalCase evalCase, String model) {
        ToolCallRequest request =
                new ToolCallRequest(
                        model,
                        evalCase.conversation(suite.getSystemMessage()),
                        suite.getToolCatalog().all(),
                        suite.getToolChoice());

        ToolCallResponse response;
        try {
            response = provider.requestToolCalls(request);
        } catch (RuntimeException e) {
            logger.warning(
                    "Provider failed for case '" + evalCase.getName() + "': " + e.getMessage());
            return failedOutcome(evalCase, List.of(), "Provider failure: " + describe(e));
        }

        if (response instanceof ToolCallResponse.Error error) {
            logger.warning(
                    "Provider error for case '" + evalCase.getName() + "': " + error.message());
            return failedOutcome(evalCase, List.of(), "Provider error: " + error.message());
        }

        List<ActualToolCall> calls = ((ToolCallResponse.ToolCalls) response).calls();

        if (suite.isValidateToolCalls() || config.isValidateToolCalls()) {
            Optional<String> violation =
                    new ToolCallValidator(suite.getToolCatalog()).validate(calls);
            if (violation.isPresent()) {
                logger.fine("Case '" + evalCase.getName() + "' rejected: " + violation.get());
                return failedOutcome(evalCase, calls, violation.get());
            }
        }

        EvaluationResult evaluation = evalCase.evaluate(calls);
        logger.fine(
                "Case '"
                        + evalCase.getName()
                        + "' on "
                        + model
                        + ": "
                        + evaluation.getClassification()
                        + " ("
                        + evaluation.getScore()
                        + ")");
        return outcome(evalCase, calls, evaluation);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static CaseOutcome failedOutcome(
            EvalCase evalCase, List<ActualToolCall> calls, String reason) {
        return outcome(evalCase, calls, EvaluationResult.failure(reason));
    }

    private static CaseOutcome outcome(
            EvalCase evalCase, List<ActualToolCall> calls, EvaluationResult evaluation) {
        return new CaseOutcome(
                evalCase.getName(),
                evalCase.getUserMessage(),
                evalCase.getExpectedToolCalls(),
                calls,
                evaluation);
    }

    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            } finally {
                watchdog.shutdownNow();
            }
        }
    }
}
