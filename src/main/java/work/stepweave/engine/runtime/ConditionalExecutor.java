package work.stepweave.engine.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.ConditionEvaluationException;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.ConditionalBranch;
import work.stepweave.engine.model.ConditionalStep;
import work.stepweave.engine.runtime.ExecutionContext.ExecutionCancelledException;
import work.stepweave.engine.shared.Values;

/**
 * Runs {@code conditional} steps. Predicates are tried in declaration order and the first true one wins;
 * otherwise the default branch, if any, runs. Branch steps see the enclosing scope but their own results
 * stay inside the branch.
 */
final class ConditionalExecutor {
    private static final Logger log = LoggerFactory.getLogger(ConditionalExecutor.class);

    private final ExpressionEvaluator evaluator;

    ConditionalExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    Map<String, Object> execute(ConditionalStep step, ExecutionContext context, SequenceRunner runner) {
        List<String> evaluationErrors = new ArrayList<>();
        for (var branch : step.conditionalBranches()) {
            context.ensureNotCancelled();
            boolean matched;
            try {
                matched = Values.isTruthy(evaluator.evaluate(branch.condition(), context.bindings()));
            } catch (ExecutionCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                var message = "Condition '" + branch.condition() + "' of branch '" + branch.name() + "' failed: "
                    + WorkflowException.wrap(ex).getMessage();
                switch (step.onConditionError()) {
                    case CONTINUE -> {
                        log.warn("Step '{}': {}; treating it as false", step.id(), message);
                        evaluationErrors.add(message);
                        continue;
                    }
                    case SKIP_REMAINING -> {
                        log.warn("Step '{}': {}; skipping the conditional", step.id(), message);
                        return result(null, null, null, message);
                    }
                    default -> {
                        var details = new LinkedHashMap<String, Object>();
                        details.put("condition", branch.condition());
                        details.put("branch", branch.name());
                        throw new ConditionEvaluationException(message, details, ex);
                    }
                }
            }
            if (matched) {
                return runBranch(step, branch, true, context, runner, evaluationErrors);
            }
        }
        var fallback = step.defaultBranch();
        if (fallback.isPresent()) {
            return runBranch(step, fallback.get(), !step.basicForm(), context, runner, evaluationErrors);
        }
        log.debug("Step '{}': no branch matched", step.id());
        return result(null, false, null, joined(evaluationErrors));
    }

    private Map<String, Object> runBranch(
        ConditionalStep step,
        ConditionalBranch branch,
        boolean conditionResult,
        ExecutionContext context,
        SequenceRunner runner,
        List<String> evaluationErrors
    ) {
        log.debug("Step '{}' runs branch '{}'", step.id(), branch.name());
        Object output = null;
        if (!branch.steps().isEmpty()) {
            output = runner.run(branch.steps(), context.nested()).lastResult();
        }
        return result(output, conditionResult, branch.name(), joined(evaluationErrors));
    }

    private static String joined(List<String> errors) {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }

    private static Map<String, Object> result(Object output, Boolean conditionResult, String branch, String evaluationError) {
        var result = new LinkedHashMap<String, Object>();
        result.put("output", output);
        result.put("condition_result", conditionResult);
        result.put("executed_branch", branch);
        result.put("evaluation_error", evaluationError);
        return result;
    }
}
