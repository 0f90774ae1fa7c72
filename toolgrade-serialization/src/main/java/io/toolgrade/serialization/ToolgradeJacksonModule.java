package io.toolgrade.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.toolgrade.core.critic.Critic;
import io.toolgrade.core.critic.similarity.SimilarityMetricRegistry;
import io.toolgrade.core.evaluation.EvalCase;
import io.toolgrade.core.evaluation.EvaluationResult;
import io.toolgrade.core.rubric.EvalRubric;
import io.toolgrade.core.suite.EvalSuite;
import io.toolgrade.core.suite.SuiteReport;
import io.toolgrade.serialization.mixin.EvalCaseBuilderMixin;
import io.toolgrade.serialization.mixin.EvalCaseMixin;
import io.toolgrade.serialization.mixin.EvalRubricBuilderMixin;
import io.toolgrade.serialization.mixin.EvalRubricMixin;
import io.toolgrade.serialization.mixin.EvaluationResultMixin;
import java.io.Serial;

/// Jackson module for toolgrade domain types.
///
/// Critics and suites use custom (de)serializers; rubrics and cases are bound to their
/// builders through mixins so that JSON input goes through the same validation as code.
/// Reports are write-only.
///
/// @see SuiteSerializer
/// @see ReportSerializer
public class ToolgradeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = -1195436028833016587L;

    /// Creates a module whose similarity critics resolve metrics from the built-in registry.
    public ToolgradeJacksonModule() {
        this(SimilarityMetricRegistry.defaults());
    }

    /// Creates a module whose similarity critics resolve metrics from `metrics`.
    ///
    /// @param metrics registry handed to deserialized similarity critics, not null
    public ToolgradeJacksonModule(SimilarityMetricRegistry metrics) {
        super("ToolgradeJacksonModule");

        addSerializer(Critic.class, new CriticSerializer());
        addDeserializer(Critic.class, new CriticDeserializer(metrics));

        addSerializer(EvalSuite.class, new EvalSuiteSerializer());
        addDeserializer(EvalSuite.class, new EvalSuiteDeserializer());

        addSerializer(SuiteReport.class, new SuiteReportSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(EvalRubric.class, EvalRubricMixin.class);
        context.setMixInAnnotations(EvalRubric.Builder.class, EvalRubricBuilderMixin.class);

        context.setMixInAnnotations(EvalCase.class, EvalCaseMixin.class);
        context.setMixInAnnotations(EvalCase.Builder.class, EvalCaseBuilderMixin.class);

        context.setMixInAnnotations(EvaluationResult.class, EvaluationResultMixin.class);
    }
}
