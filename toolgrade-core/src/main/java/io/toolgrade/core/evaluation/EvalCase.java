package io.toolgrade.core.evaluation;

import io.toolgrade.core.assignment.Assignment;
import io.toolgrade.core.assignment.AssignmentSolver;
import io.toolgrade.core.assignment.HungarianAssignmentSolver;
import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.critic.ToolSelectionCritic;
import io.toolgrade.core.exception.ValidationException;
import io.toolgrade.core.provider.ConversationMessage;
import io.toolgrade.core.rubric.CriticWeightPolicy;
import io.toolgrade.core.rubric.EvalRubric;
import io.toolgrade.core.toolcall.ActualToolCall;
import io.toolgrade.core.toolcall.ExpectedToolCall;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Immutable evaluation scenario: a user message, the tool calls it should produce, the
/// critics that grade their arguments and the rubric that classifies the result.
///
/// ### Evaluation
/// {@link #evaluate(List)} aligns expected to actual calls with an optimal assignment over
/// a square cost matrix, so the order of actual calls never matters and surplus or missing
/// calls are tolerated (and penalized). Two rubric pre-checks can fail a case before any
/// matching happens.
///
/// ### Validation Rules
/// - `name` and `userMessage` must not be blank
/// - critic weights must satisfy the case's {@link CriticWeightPolicy}
///
/// @implNote Immutable and thread-safe after construction. `evaluate` is a pure function
/// of the case and its argument.
///
/// @see EvalRubric for thresholds and pre-check flags
/// @see CostMatrixBuilder for pairing scores
/// @see HungarianAssignmentSolver for the assignment step
public final class EvalCase {

    private static final Logger logger = Logger.getLogger(EvalCase.class.getName());

    /// Input-independent column order, so tied pairings resolve the same way however the
    /// actual calls arrive.
    private static final Comparator<ActualToolCall> CANONICAL_ORDER =
            Comparator.comparing(ActualToolCall::name)
                    .thenComparing(call -> new TreeMap<>(call.args()).toString());

    private final String name;
    private final String userMessage;
    private final List<ExpectedToolCall> expectedToolCalls;
    private final List<Critic> critics;
    private final EvalRubric rubric;
    private final List<ConversationMessage> additionalMessages;
    private final CriticWeightPolicy criticWeightPolicy;
    private final AssignmentSolver solver;

    private EvalCase(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Case name required");
        this.userMessage = Objects.requireNonNull(builder.userMessage, "User message required");
        this.expectedToolCalls = List.copyOf(builder.expectedToolCalls);
        this.critics = List.copyOf(builder.critics);
        this.rubric = Objects.requireNonNull(builder.rubric, "Rubric required");
        this.additionalMessages = List.copyOf(builder.additionalMessages);
        this.criticWeightPolicy =
                Objects.requireNonNull(builder.criticWeightPolicy, "Critic weight policy required");
        this.solver = Objects.requireNonNull(builder.solver, "Assignment solver required");

        validate();
    }

    private void validate() {
        if (name.isBlank()) {
            throw new ValidationException("Case name must not be blank");
        }
        if (userMessage.isBlank()) {
            throw new ValidationException("Case '" + name + "' user message must not be blank");
        }
        for (Critic critic : critics) {
            if (critic instanceof ToolSelectionCritic) {
                throw new ValidationException(
                        "Case '" + name + "' must not declare a tool selection critic; "
                                + "configure EvalRubric.toolSelectionWeight instead");
            }
        }
        criticWeightPolicy.validate(critics);
    }

    /// Scores actual tool calls against this case's expectations.
    ///
    /// ### Steps
    /// 1. If the rubric fails on tool selection and the sets of tool names differ, or it
    ///    fails on quantity and the counts differ, return score 0 / FAIL immediately.
    /// 2. Sort the actual calls by name and arguments, build the cost matrix and solve the
    ///    maximizing assignment.
    /// 3. Sum score and weight over every real pairing.
    /// 4. Add weight `1` at score `0` for every call left without a partner.
    /// 5. Normalize (`0` when the total weight is `0`) and classify.
    ///
    /// ### Performance
    /// - Time: O(n*m*c + k^3) for `c` critics and `k = max(n, m)`
    ///
    /// @param actualToolCalls calls chosen by the system under test, in any order, not null
    /// @return evaluation result, never null
    /// @throws io.toolgrade.core.exception.CriticConfigurationException if a critic cannot
    ///     execute; the evaluation is aborted rather than scored as zero
    public EvaluationResult evaluate(List<ActualToolCall> actualToolCalls) {
        Objects.requireNonNull(actualToolCalls, "actualToolCalls must not be null");

        if (rubric.isFailOnToolSelection() && !sameToolNames(actualToolCalls)) {
            logger.fine("Case '" + name + "' failed tool selection pre-check");
            return EvaluationResult.failure("tool selection mismatch");
        }
        if (rubric.isFailOnToolCallQuantity()
                && actualToolCalls.size() != expectedToolCalls.size()) {
            logger.fine("Case '" + name + "' failed tool call quantity pre-check");
            return EvaluationResult.failure("tool call quantity mismatch");
        }

        CostMatrixBuilder matrixBuilder =
                new CostMatrixBuilder(
                        new ToolSelectionCritic(rubric.getToolSelectionWeight()), critics);
        List<ActualToolCall> orderedCalls = new ArrayList<>(actualToolCalls);
        orderedCalls.sort(CANONICAL_ORDER);
        PairingTable table = matrixBuilder.build(expectedToolCalls, orderedCalls);
        Assignment assignment = solver.maximize(table.matrix());

        List<FieldResult> fieldResults = new ArrayList<>();
        List<FieldResult> unmatched = new ArrayList<>();
        double totalScore = 0.0;
        double totalWeight = 0.0;

        for (int row = 0; row < assignment.size(); row++) {
            int column = assignment.columnFor(row);
            if (table.isReal(row, column)) {
                PairScore pair = table.pair(row, column);
                totalScore += pair.score();
                totalWeight += pair.weight();
                fieldResults.addAll(pair.fieldResults());
            } else if (row < table.expectedCount()) {
                unmatched.add(FieldResult.missing(expectedToolCalls.get(row).name()));
            } else if (column < table.actualCount()) {
                unmatched.add(FieldResult.extra(orderedCalls.get(column).name()));
            }
        }

        for (FieldResult penalty : unmatched) {
            totalWeight += penalty.weight();
        }
        fieldResults.addAll(unmatched);

        double normalized = totalWeight > 0 ? totalScore / totalWeight : 0.0;

        logger.fine(
                "Case '"
                        + name
                        + "' scored "
                        + totalScore
                        + "/"
                        + totalWeight
                        + " over "
                        + expectedToolCalls.size()
                        + " expected and "
                        + actualToolCalls.size()
                        + " actual calls");

        return EvaluationResult.builder()
                .score(normalized)
                .classification(rubric.classify(normalized))
                .fieldResults(fieldResults)
                .totalScore(totalScore)
                .totalWeight(totalWeight)
                .build();
    }

    private boolean sameToolNames(List<ActualToolCall> actualToolCalls) {
        Set<String> expectedNames =
                expectedToolCalls.stream().map(ExpectedToolCall::name).collect(Collectors.toSet());
        Set<String> actualNames =
                actualToolCalls.stream().map(ActualToolCall::name).collect(Collectors.toSet());
        return expectedNames.equals(actualNames);
    }

    /// Returns the conversation to send for this case, given the suite's system message.
    ///
    /// @param systemMessage suite-level system prompt, not null
    /// @return system message, prior turns, then this case's user message; never null
    public List<ConversationMessage> conversation(String systemMessage) {
        List<ConversationMessage> messages = new ArrayList<>(additionalMessages.size() + 2);
        messages.add(ConversationMessage.system(systemMessage));
        messages.addAll(additionalMessages);
        messages.add(ConversationMessage.user(userMessage));
        return List.copyOf(messages);
    }

    /// Starts a follow-up case that continues this case's conversation.
    ///
    /// The new case inherits expected calls, critics, rubric and weight policy; its
    /// history is this case's history followed by this case's user message.
    ///
    /// @param name name of the follow-up case, not null
    /// @param userMessage next user turn, not null
    /// @return pre-populated builder, never null
    public Builder extend(String name, String userMessage) {
        List<ConversationMessage> history = new ArrayList<>(additionalMessages);
        history.add(ConversationMessage.user(this.userMessage));
        return toBuilder().name(name).userMessage(userMessage).additionalMessages(history);
    }

    public String getName() {
        return name;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public List<ExpectedToolCall> getExpectedToolCalls() {
        return expectedToolCalls;
    }

    public List<Critic> getCritics() {
        return critics;
    }

    public EvalRubric getRubric() {
        return rubric;
    }

    /// Returns prior conversation turns that precede the user message.
    public List<ConversationMessage> getAdditionalMessages() {
        return additionalMessages;
    }

    public CriticWeightPolicy getCriticWeightPolicy() {
        return criticWeightPolicy;
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .userMessage(userMessage)
                .expectedToolCalls(expectedToolCalls)
                .critics(critics)
                .rubric(rubric)
                .additionalMessages(additionalMessages)
                .criticWeightPolicy(criticWeightPolicy)
                .assignmentSolver(solver);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link EvalCase}.
    ///
    /// Required fields: `name`, `userMessage`. Defaults: no expected calls, no critics,
    /// `EvalRubric.builder().build()`, {@link CriticWeightPolicy#standard()} and a
    /// {@link HungarianAssignmentSolver}.
    public static final class Builder {
        private String name;
        private String userMessage;
        private List<ExpectedToolCall> expectedToolCalls = List.of();
        private List<Critic> critics = List.of();
        private EvalRubric rubric = EvalRubric.builder().build();
        private List<ConversationMessage> additionalMessages = List.of();
        private CriticWeightPolicy criticWeightPolicy = CriticWeightPolicy.standard();
        private AssignmentSolver solver = new HungarianAssignmentSolver();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder userMessage(String userMessage) {
            this.userMessage = userMessage;
            return this;
        }

        public Builder expectedToolCalls(List<ExpectedToolCall> expectedToolCalls) {
            this.expectedToolCalls = List.copyOf(expectedToolCalls);
            return this;
        }

        public Builder expectedToolCall(ExpectedToolCall expectedToolCall) {
            List<ExpectedToolCall> calls = new ArrayList<>(expectedToolCalls);
            calls.add(Objects.requireNonNull(expectedToolCall, "expectedToolCall must not be null"));
            this.expectedToolCalls = List.copyOf(calls);
            return this;
        }

        public Builder critics(List<? extends Critic> critics) {
            this.critics = List.copyOf(critics);
            return this;
        }

        public Builder rubric(EvalRubric rubric) {
            this.rubric = rubric;
            return this;
        }

        public Builder additionalMessages(List<ConversationMessage> additionalMessages) {
            this.additionalMessages = List.copyOf(additionalMessages);
            return this;
        }

        public Builder criticWeightPolicy(CriticWeightPolicy criticWeightPolicy) {
            this.criticWeightPolicy = criticWeightPolicy;
            return this;
        }

        public Builder assignmentSolver(AssignmentSolver solver) {
            this.solver = solver;
            return this;
        }

        /// Builds the immutable case.
        ///
        /// @return new case, never null
        /// @throws NullPointerException if name or user message is missing
        /// @throws ValidationException if the definition is structurally invalid
        public EvalCase build() {
            return new EvalCase(this);
        }
    }

    @Override
    public String toString() {
        return "EvalCase{name='" + name + "', expectedToolCalls=" + expectedToolCalls.size() + "}";
    }
}
