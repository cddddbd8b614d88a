package work.stepweave.engine.error;

import java.util.Map;

/**
 * Caller-supplied input does not satisfy the workflow's declared parameters.
 */
public final class InvalidInputException extends WorkflowException {
    public InvalidInputException(String parameter, String message) {
        super(ErrorKind.INVALID_INPUT, message, null, parameter == null ? Map.of() : Map.of("parameter", parameter), null);
    }
}
