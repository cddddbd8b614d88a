package work.stepweave.engine.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.error.ConditionEvaluationException;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.ItemProcessingException;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.CollectionOperation;
import work.stepweave.engine.model.CollectionStage;
import work.stepweave.engine.model.CollectionStep;
import work.stepweave.engine.model.ItemErrorPolicy;
import work.stepweave.engine.model.ItemErrorPolicy.ConditionFailure;
import work.stepweave.engine.model.ItemErrorPolicy.ItemFailure;
import work.stepweave.engine.runtime.ExecutionContext.CancellationToken;
import work.stepweave.engine.runtime.ExecutionContext.ExecutionCancelledException;
import work.stepweave.engine.shared.Values;
import work.stepweave.engine.validation.JsonDocuments;

/**
 * Runs {@code collection} steps. Map and filter elements run on a fixed pool of {@code max_parallel} workers,
 * one batch at a time; reduce is sequential. Results are placed by input index, never by completion order.
 */
final class CollectionExecutor {
    private static final Logger log = LoggerFactory.getLogger(CollectionExecutor.class);
    static final String INDEX_VAR = "index";
    static final String RESULT_VAR = "result";

    private final EngineConfiguration configuration;
    private final ExpressionEvaluator evaluator;

    CollectionExecutor(EngineConfiguration configuration, ExpressionEvaluator evaluator) {
        this.configuration = configuration;
        this.evaluator = evaluator;
    }

    Map<String, Object> execute(CollectionStep step, ExecutionContext context, SequenceRunner runner) {
        long started = System.nanoTime();
        List<?> items = toList(evaluator.resolve(step.input(), context.bindings()), step);
        var stats = new Stats();
        List<Map<String, Object>> errors = new ArrayList<>();
        Object current = items;
        for (int s = 0; s < step.stages().size(); s++) {
            var stage = step.stages().get(s);
            List<?> stageInput = s == 0 ? items : toList(current, step);
            log.debug("Collection '{}' stage '{}' ({}) over {} element(s)", step.id(), stage.id(), stage.operation().code(), stageInput.size());
            stats.processed += stageInput.size();
            current = switch (stage.operation()) {
                case MAP, FILTER -> runParallel(step, stage, stageInput, context, runner, stats, errors);
                case REDUCE -> runReduce(step, stage, stageInput, context, runner, stats, errors);
                case PIPELINE -> throw new IllegalStateException("pipeline stages cannot be nested");
            };
        }

        var result = new LinkedHashMap<String, Object>();
        result.put("output", current);
        result.put("operation", step.operation().code());
        result.put("input_count", items.size());
        result.put("output_count", current instanceof List<?> list ? list.size() : 1);
        result.put("errors", step.errorHandling().preserveErrors() ? errors : List.of());
        result.put("processing_stats", stats.toMap(System.nanoTime() - started));
        return result;
    }

    private List<Object> runParallel(
        CollectionStep step,
        CollectionStage stage,
        List<?> items,
        ExecutionContext context,
        SequenceRunner runner,
        Stats stats,
        List<Map<String, Object>> errors
    ) {
        var outcomes = new ElementOutcome[items.size()];
        if (!items.isEmpty()) {
            var token = context.cancellationToken().child();
            var elementScope = context.withCancellationToken(token);
            int maxParallel = step.concurrency().effectiveMaxParallel(configuration.maxParallelAiCalls());
            int batchSize = step.concurrency().effectiveBatchSize(items.size());
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxParallel, batchSize), workerThreads(step.id()));
            try {
                for (int start = 0; start < items.size(); start += batchSize) {
                    if (token.isCancelled()) {
                        break;
                    }
                    if (start > 0) {
                        pause(step.concurrency().delayBetweenBatches());
                    }
                    int end = Math.min(start + batchSize, items.size());
                    stats.batches++;
                    log.debug("Collection '{}' batch {} elements [{}, {})", step.id(), stats.batches, start, end);
                    List<Future<?>> futures = new ArrayList<>();
                    for (int index = start; index < end; index++) {
                        final int position = index;
                        futures.add(pool.submit(() -> {
                            outcomes[position] = processElement(step, stage, items.get(position), position, elementScope, runner, token);
                        }));
                    }
                    awaitAll(futures);
                }
            } finally {
                pool.shutdownNow();
            }
        }
        context.ensureNotCancelled();
        return collect(step, stage, items, outcomes, stats, errors);
    }

    private List<Object> collect(
        CollectionStep step,
        CollectionStage stage,
        List<?> items,
        ElementOutcome[] outcomes,
        Stats stats,
        List<Map<String, Object>> errors
    ) {
        var policy = step.errorHandling();
        List<Object> output = new ArrayList<>();
        List<Map<String, Object>> stageErrors = new ArrayList<>();
        ElementOutcome firstStop = null;
        for (int index = 0; index < outcomes.length; index++) {
            var outcome = outcomes[index];
            if (outcome == null || outcome.cancelled()) {
                continue;
            }
            stats.retried += Math.max(0, outcome.attempts() - 1);
            if (outcome.error() == null) {
                stats.succeeded++;
                if (stage.operation() == CollectionOperation.MAP) {
                    output.add(outcome.value());
                } else if (Boolean.TRUE.equals(outcome.value())) {
                    output.add(items.get(index));
                }
                continue;
            }
            if (outcome.conditionFailure() && policy.onConditionError() == ConditionFailure.DEFAULT_FALSE) {
                log.debug("Collection '{}' element {} condition failed, treated as false", step.id(), index);
                continue;
            }
            stats.failed++;
            stageErrors.add(errorEntry(step, stage, index, outcome));
            if (outcome.stops(policy) && firstStop == null) {
                firstStop = outcome;
            }
        }
        errors.addAll(stageErrors);
        if (firstStop != null) {
            throw stopFailure(step, firstStop, stageErrors);
        }
        if (!stageErrors.isEmpty()) {
            log.warn("Collection '{}' skipped {} failed element(s)", step.id(), stageErrors.size());
        }
        return output;
    }

    private Object runReduce(
        CollectionStep step,
        CollectionStage stage,
        List<?> items,
        ExecutionContext context,
        SequenceRunner runner,
        Stats stats,
        List<Map<String, Object>> errors
    ) {
        Object accumulator = Values.deepCopy(stage.initialValue());
        List<Map<String, Object>> stageErrors = new ArrayList<>();
        var token = context.cancellationToken().child();
        for (int index = 0; index < items.size(); index++) {
            context.ensureNotCancelled();
            var accumulatorBinding = new LinkedHashMap<String, Object>();
            accumulatorBinding.put(stage.accumulatorVar(), accumulator);
            var scope = context.withVariables(accumulatorBinding);
            var outcome = processElement(step, stage, items.get(index), index, scope.withCancellationToken(token), runner, token);
            stats.retried += Math.max(0, outcome.attempts() - 1);
            if (outcome.cancelled()) {
                context.ensureNotCancelled();
                continue;
            }
            if (outcome.error() == null) {
                stats.succeeded++;
                accumulator = outcome.value();
                continue;
            }
            stats.failed++;
            stageErrors.add(errorEntry(step, stage, index, outcome));
            if (outcome.stops(step.errorHandling())) {
                errors.addAll(stageErrors);
                throw stopFailure(step, outcome, stageErrors);
            }
        }
        errors.addAll(stageErrors);
        return accumulator;
    }

    private ElementOutcome processElement(
        CollectionStep step,
        CollectionStage stage,
        Object item,
        int index,
        ExecutionContext scope,
        SequenceRunner runner,
        CancellationToken token
    ) {
        var policy = step.errorHandling();
        int attempts = policy.attemptsPerItem();
        int made = 0;
        WorkflowException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (token.isCancelled()) {
                return ElementOutcome.notStarted(index, attempt - 1);
            }
            var elementContext = scope.withVariables(elementVariables(stage, item, index));
            made = attempt;
            try {
                return ElementOutcome.success(index, evaluateElement(stage, elementContext, runner), attempt);
            } catch (ExecutionCancelledException ex) {
                return ElementOutcome.notStarted(index, attempt);
            } catch (RuntimeException ex) {
                lastError = WorkflowException.wrap(ex);
                if (lastError instanceof ConditionCheckFailure) {
                    break;
                }
                if (attempt < attempts) {
                    log.debug("Collection '{}' element {} failed (attempt {}/{}), retrying: {}",
                        step.id(), index, attempt, attempts, ex.getMessage());
                }
            }
        }
        var outcome = ElementOutcome.failure(index, lastError, made);
        if (outcome.stops(policy)) {
            log.debug("Collection '{}' element {} failed with stop policy, cancelling remaining elements", step.id(), index);
            token.cancel();
        }
        return outcome;
    }

    private Object evaluateElement(CollectionStage stage, ExecutionContext elementContext, SequenceRunner runner) {
        Object last = elementContext.variable(stage.itemVar());
        if (!stage.steps().isEmpty()) {
            last = runner.run(stage.steps(), elementContext).lastResult();
        }
        if (stage.operation() != CollectionOperation.FILTER) {
            return last;
        }
        if (!stage.hasCondition()) {
            return Values.isTruthy(last);
        }
        var bindings = elementContext.bindings();
        if (!stage.steps().isEmpty()) {
            bindings.put(RESULT_VAR, last);
        }
        try {
            return Values.isTruthy(evaluator.evaluate(stage.condition(), bindings));
        } catch (RuntimeException ex) {
            throw new ConditionCheckFailure(stage.condition(), WorkflowException.wrap(ex));
        }
    }

    private static Map<String, Object> elementVariables(CollectionStage stage, Object item, int index) {
        var variables = new LinkedHashMap<String, Object>();
        variables.put(stage.itemVar(), item);
        variables.put(INDEX_VAR, index);
        return variables;
    }

    private static Map<String, Object> errorEntry(CollectionStep step, CollectionStage stage, int index, ElementOutcome outcome) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("index", index);
        entry.put("message", outcome.error().getMessage());
        entry.put("kind", outcome.error().kind().code());
        entry.put("attempts", outcome.attempts());
        if (step.operation() == CollectionOperation.PIPELINE) {
            entry.put("stage", stage.id());
        }
        return entry;
    }

    private static WorkflowException stopFailure(CollectionStep step, ElementOutcome outcome, List<Map<String, Object>> errors) {
        var error = outcome.error();
        if (error instanceof ConditionCheckFailure conditionFailure) {
            var details = new LinkedHashMap<String, Object>();
            details.put("index", outcome.index());
            details.put("condition", conditionFailure.condition());
            details.put("errors", errors);
            return new ConditionEvaluationException(
                "Filter condition evaluation failed for element " + outcome.index() + ": " + conditionFailure.getCause().getMessage(),
                details, conditionFailure.getCause());
        }
        return new ItemProcessingException(outcome.index(),
            "Element " + outcome.index() + " of collection '" + step.id() + "' failed: " + error.getMessage(), errors, error);
    }

    private static List<?> toList(Object value, CollectionStep step) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof String text) {
            try {
                if (JsonDocuments.parse(text) instanceof List<?> parsed) {
                    return parsed;
                }
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                throw new ItemProcessingException(-1, "Collection input of '" + step.id() + "' is not a JSON array: "
                    + JsonDocuments.describe(ex), ex);
            }
        }
        throw new ItemProcessingException(-1, "Collection input of '" + step.id() + "' must be an array, got "
            + Values.typeName(value), null);
    }

    private static void awaitAll(List<Future<?>> futures) {
        for (var future : futures) {
            try {
                future.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ExecutionCancelledException("Interrupted while waiting for collection elements");
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new WorkflowException(ErrorKind.INTERNAL, cause.getMessage(), cause);
            }
        }
    }

    private static void pause(Duration delay) {
        if (delay == null || delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted between collection batches");
        }
    }

    private static ThreadFactory workerThreads(String stepId) {
        var counter = new AtomicInteger();
        return task -> {
            var thread = new Thread(task, "stepweave-" + stepId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Filter predicate failure; handled by {@code on_condition_error} rather than {@code on_item_failure}.
     */
    private static final class ConditionCheckFailure extends WorkflowException {
        private final String condition;

        ConditionCheckFailure(String condition, WorkflowException cause) {
            super(cause.kind(), cause.getMessage(), cause);
            this.condition = condition;
        }

        String condition() {
            return condition;
        }
    }

    private record ElementOutcome(int index, Object value, WorkflowException error, int attempts, boolean cancelled) {
        static ElementOutcome success(int index, Object value, int attempts) {
            return new ElementOutcome(index, value, null, attempts, false);
        }

        static ElementOutcome failure(int index, WorkflowException error, int attempts) {
            return new ElementOutcome(index, null, error, attempts, false);
        }

        static ElementOutcome notStarted(int index, int attempts) {
            return new ElementOutcome(index, null, null, attempts, true);
        }

        boolean conditionFailure() {
            return error instanceof ConditionCheckFailure;
        }

        boolean stops(ItemErrorPolicy policy) {
            if (error == null) {
                return false;
            }
            if (conditionFailure()) {
                return policy.onConditionError() == ConditionFailure.STOP;
            }
            return policy.terminalPolicy() == ItemFailure.STOP;
        }
    }

    private static final class Stats {
        int processed;
        int succeeded;
        int failed;
        int retried;
        int batches;

        Map<String, Object> toMap(long elapsedNanos) {
            var map = new LinkedHashMap<String, Object>();
            map.put("processing_time_ms", elapsedNanos / 1_000_000L);
            map.put("succeeded", succeeded);
            map.put("failed", failed);
            map.put("retried", retried);
            map.put("batches", batches);
            map.put("error_rate", processed == 0 ? 0d : (double) failed / processed);
            return map;
        }
    }
}
