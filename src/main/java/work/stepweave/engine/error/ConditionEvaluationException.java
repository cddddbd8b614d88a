package work.stepweave.engine.error;

import java.util.Map;

/**
 * A branch or filter predicate could not be evaluated.
 */
public final class ConditionEvaluationException extends WorkflowException {
    public ConditionEvaluationException(String message, String condition, Throwable cause) {
        super(ErrorKind.CONDITION_EVALUATION, message, null, condition == null ? Map.of() : Map.of("condition", condition), cause);
    }

    public ConditionEvaluationException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.CONDITION_EVALUATION, message, null, details, cause);
    }
}
