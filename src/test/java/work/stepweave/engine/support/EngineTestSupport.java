package work.stepweave.engine.support;

import java.util.Map;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.expression.JsExpressionEvaluator;
import work.stepweave.engine.loader.WorkflowLoader;
import work.stepweave.engine.model.Workflow;
import work.stepweave.engine.provider.GenerativeProvider;
import work.stepweave.engine.runtime.ExecutionEngine;
import work.stepweave.engine.runtime.ExecutionOutcome;

/**
 * Shared helpers for engine test suites. One evaluator for the whole test JVM; GraalVM engines are costly to
 * start and safe to share between contexts.
 */
public final class EngineTestSupport {
    public static final JsExpressionEvaluator EVALUATOR = new JsExpressionEvaluator();

    private EngineTestSupport() {}

    public static Workflow workflow(String yaml) {
        return new WorkflowLoader().parse(yaml, null);
    }

    /**
     * Defaults without provider-level retries, so scripted failures surface immediately.
     */
    public static EngineConfiguration configuration() {
        return EngineConfiguration.defaults().toBuilder().providerMaxRetries(0).build();
    }

    public static ExecutionEngine engine(GenerativeProvider provider) {
        return engine(configuration(), provider);
    }

    public static ExecutionEngine engine(EngineConfiguration configuration, GenerativeProvider provider) {
        return new ExecutionEngine(configuration, EVALUATOR, provider);
    }

    public static ExecutionOutcome run(String yaml, Map<String, Object> input, GenerativeProvider provider) {
        return engine(provider).execute(workflow(yaml), input);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> stepResult(ExecutionOutcome outcome, String stepId) {
        return (Map<String, Object>) outcome.steps().get(stepId);
    }
}
