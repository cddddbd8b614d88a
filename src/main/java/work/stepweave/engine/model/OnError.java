package work.stepweave.engine.model;

import java.util.Locale;

/**
 * What a sequence does when one of its steps fails. Also reused by conditionals for predicate failures.
 */
public enum OnError {
    STOP,
    CONTINUE,
    SKIP_REMAINING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OnError from(String value) {
        if (value == null || value.isBlank()) {
            return STOP;
        }
        try {
            return OnError.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported error policy: " + value + " (expected stop|continue|skip_remaining)");
        }
    }
}
