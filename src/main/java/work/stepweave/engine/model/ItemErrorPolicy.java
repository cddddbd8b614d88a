package work.stepweave.engine.model;

import java.util.Locale;

/**
 * Per-element error handling of a collection step.
 */
public record ItemErrorPolicy(
    ItemFailure onItemFailure,
    ConditionFailure onConditionError,
    int maxRetriesPerItem,
    ItemFailure onRetryExhausted,
    boolean preserveErrors
) {
    public static final int DEFAULT_MAX_RETRIES_PER_ITEM = 2;
    public static final ItemErrorPolicy DEFAULT = new ItemErrorPolicy(
        ItemFailure.SKIP, ConditionFailure.SKIP_ITEM, DEFAULT_MAX_RETRIES_PER_ITEM, ItemFailure.SKIP, true);

    public ItemErrorPolicy {
        onItemFailure = onItemFailure == null ? ItemFailure.SKIP : onItemFailure;
        onConditionError = onConditionError == null ? ConditionFailure.SKIP_ITEM : onConditionError;
        if (maxRetriesPerItem < 0) {
            throw new IllegalArgumentException("max_retries_per_item must be >= 0");
        }
        onRetryExhausted = onRetryExhausted == null ? ItemFailure.SKIP : onRetryExhausted;
        if (onRetryExhausted == ItemFailure.RETRY) {
            throw new IllegalArgumentException("on_retry_exhausted must be skip or stop");
        }
    }

    /**
     * Policy applied once an element has definitively failed (after retries, if any).
     */
    public ItemFailure terminalPolicy() {
        return onItemFailure == ItemFailure.RETRY ? onRetryExhausted : onItemFailure;
    }

    public int attemptsPerItem() {
        return onItemFailure == ItemFailure.RETRY ? maxRetriesPerItem + 1 : 1;
    }

    public enum ItemFailure {
        SKIP,
        STOP,
        RETRY;

        public static ItemFailure from(String value) {
            if (value == null || value.isBlank()) {
                return SKIP;
            }
            try {
                return ItemFailure.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported on_item_failure: " + value + " (expected skip|stop|retry)");
            }
        }
    }

    public enum ConditionFailure {
        SKIP_ITEM,
        STOP,
        DEFAULT_FALSE;

        public static ConditionFailure from(String value) {
            if (value == null || value.isBlank()) {
                return SKIP_ITEM;
            }
            try {
                return ConditionFailure.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported on_condition_error: " + value + " (expected skip_item|stop|default_false)");
            }
        }
    }
}
