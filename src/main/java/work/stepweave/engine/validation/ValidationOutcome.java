package work.stepweave.engine.validation;

import java.util.List;

/**
 * Result of checking one provider answer. {@code value} is the parsed output when valid.
 */
public record ValidationOutcome(boolean valid, Object value, List<String> errors, String rawOutput) {
    public ValidationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationOutcome success(Object value, String rawOutput) {
        return new ValidationOutcome(true, value, List.of(), rawOutput);
    }

    public static ValidationOutcome failure(List<String> errors, String rawOutput) {
        return new ValidationOutcome(false, null, errors, rawOutput);
    }

    public String errorSummary() {
        return String.join("; ", errors);
    }
}
