package work.stepweave.engine.model;

import java.util.Locale;

public enum CollectionOperation {
    MAP,
    FILTER,
    REDUCE,
    PIPELINE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CollectionOperation from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("operation is required (map|filter|reduce|pipeline)");
        }
        try {
            return CollectionOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported collection operation: " + value);
        }
    }
}
