package work.stepweave.engine.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.error.ConditionEvaluationException;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.CollectionStep;
import work.stepweave.engine.model.ConditionalStep;
import work.stepweave.engine.model.GenerativeCallStep;
import work.stepweave.engine.model.Step;
import work.stepweave.engine.model.TextTransformStep;
import work.stepweave.engine.model.Workflow;
import work.stepweave.engine.provider.GenerativeProvider;
import work.stepweave.engine.provider.RetryingProvider;
import work.stepweave.engine.runtime.ExecutionContext.CancellationToken;
import work.stepweave.engine.runtime.ExecutionContext.ExecutionCancelledException;
import work.stepweave.engine.transform.TextTransformExecutor;
import work.stepweave.engine.validation.ValidatorRegistry;

/**
 * Walks step sequences in order, dispatching each step to its executor and committing its result under the
 * step id before the next step starts. Nested sequences of collections and conditionals run through the same
 * loop with their own scope.
 *
 * <p>An engine holds no per-run state and may execute several workflows concurrently.</p>
 */
public final class ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final EngineConfiguration configuration;
    private final ExpressionEvaluator evaluator;
    private final GenerativeCallExecutor generativeCalls;
    private final TextTransformExecutor transforms;
    private final CollectionExecutor collections;
    private final ConditionalExecutor conditionals;
    private final OutputRenderer outputRenderer;

    public ExecutionEngine(EngineConfiguration configuration, ExpressionEvaluator evaluator, GenerativeProvider provider) {
        this(configuration, evaluator, provider, new ValidatorRegistry());
    }

    public ExecutionEngine(
        EngineConfiguration configuration,
        ExpressionEvaluator evaluator,
        GenerativeProvider provider,
        ValidatorRegistry validators
    ) {
        this.configuration = configuration;
        this.evaluator = evaluator;
        var retrying = new RetryingProvider(provider, configuration.providerMaxRetries(), configuration.providerRetryBackoff());
        this.generativeCalls = new GenerativeCallExecutor(configuration, evaluator, retrying, validators);
        this.transforms = new TextTransformExecutor(evaluator);
        this.collections = new CollectionExecutor(configuration, evaluator);
        this.conditionals = new ConditionalExecutor(evaluator);
        this.outputRenderer = new OutputRenderer(evaluator);
    }

    public ExecutionOutcome execute(Workflow workflow, Map<String, Object> input) {
        return execute(workflow, input, new CancellationToken());
    }

    public ExecutionOutcome execute(Workflow workflow, Map<String, Object> input, CancellationToken cancellationToken) {
        long started = System.nanoTime();
        var session = new RunSession(workflow.name(), configuration.maxParallelAiCalls(), cancellationToken);
        log.info("Running workflow '{}' ({} step(s))", workflow.name(), workflow.steps().size());
        ExecutionContext context = null;
        try {
            context = ExecutionContext.root(session, InputBinder.bind(workflow.inputParameters(), input));
            var sequence = runSequence(workflow.steps(), context);
            var output = outputRenderer.resolve(workflow.output(), context, sequence.lastResult());
            var rendered = OutputRenderer.format(output, workflow.output().format());
            var elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (sequence.endedEarly()) {
                log.info("Workflow '{}' completed early in {} ms; skipped {}", workflow.name(), elapsed.toMillis(), sequence.skippedSteps());
            } else {
                log.info("Workflow '{}' completed in {} ms", workflow.name(), elapsed.toMillis());
            }
            return ExecutionOutcome.completed(workflow.name(), output, rendered, context.steps(), sequence.skippedSteps(),
                session.usage().toMap(), elapsed);
        } catch (RuntimeException ex) {
            var error = WorkflowException.wrap(ex);
            var elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.error("Workflow '{}' failed{}: {}", workflow.name(),
                error.stepId() == null ? "" : " at step '" + error.stepId() + "'", error.getMessage());
            if (Boolean.getBoolean("stepweave.debug")) {
                log.error("Failure detail", error);
            }
            return ExecutionOutcome.failed(workflow.name(), error, context == null ? Map.of() : context.steps(),
                session.usage().toMap(), elapsed);
        }
    }

    /**
     * Runs one sequence in {@code context}, applying each step's {@code on_error} policy.
     */
    SequenceResult runSequence(List<Step> steps, ExecutionContext context) {
        Object last = null;
        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            context.ensureNotCancelled();
            Object result;
            try {
                log.debug("Step '{}' ({}) started", step.id(), step.type());
                result = runStep(step, context);
            } catch (ExecutionCancelledException | ConditionEvaluationException ex) {
                throw ex.attachStep(step.id());
            } catch (RuntimeException ex) {
                var error = WorkflowException.wrap(ex).attachStep(step.id());
                switch (step.onError()) {
                    case CONTINUE -> {
                        log.warn("Step '{}' failed, continuing: {}", step.id(), error.getMessage());
                        result = error.toErrorRecord();
                    }
                    case SKIP_REMAINING -> {
                        var record = error.toErrorRecord();
                        context.putStepResult(step.id(), record);
                        var skipped = new ArrayList<String>();
                        for (var rest : steps.subList(index + 1, steps.size())) {
                            skipped.add(rest.id());
                        }
                        log.warn("Step '{}' failed, skipping {} remaining step(s): {}", step.id(), skipped.size(), error.getMessage());
                        return new SequenceResult(record, context.steps(), skipped, error);
                    }
                    default -> throw error;
                }
            }
            context.putStepResult(step.id(), result);
            last = result;
        }
        return new SequenceResult(last, context.steps(), List.of(), null);
    }

    private Object runStep(Step step, ExecutionContext context) {
        if (step instanceof GenerativeCallStep call) {
            return generativeCalls.execute(call, context);
        }
        if (step instanceof TextTransformStep transform) {
            var bindings = context.bindings();
            var input = evaluator.resolve(transform.input(), bindings);
            return transforms.apply(transform.transform(), input, bindings);
        }
        if (step instanceof CollectionStep collection) {
            return collections.execute(collection, context, this::runSequence);
        }
        if (step instanceof ConditionalStep conditional) {
            return conditionals.execute(conditional, context, this::runSequence);
        }
        throw new IllegalStateException("Unsupported step type: " + step.type());
    }
}
