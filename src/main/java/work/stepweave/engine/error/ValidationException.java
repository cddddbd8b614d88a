package work.stepweave.engine.error;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Provider output still failed validation after the retry and recovery budget was spent.
 */
public final class ValidationException extends WorkflowException {
    private final List<String> validationErrors;
    private final String lastOutput;
    private final int attempts;

    public ValidationException(String message, List<String> validationErrors, String lastOutput, int attempts) {
        super(ErrorKind.VALIDATION, message, null, details(validationErrors, attempts), null);
        this.validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        this.lastOutput = lastOutput;
        this.attempts = attempts;
    }

    public List<String> validationErrors() {
        return validationErrors;
    }

    public String lastOutput() {
        return lastOutput;
    }

    public int attempts() {
        return attempts;
    }

    private static LinkedHashMap<String, Object> details(List<String> errors, int attempts) {
        var details = new LinkedHashMap<String, Object>();
        details.put("validation_errors", errors == null ? List.of() : List.copyOf(errors));
        details.put("attempts", attempts);
        return details;
    }
}
