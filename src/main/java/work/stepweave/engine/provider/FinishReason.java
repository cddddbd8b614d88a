package work.stepweave.engine.provider;

import java.util.Locale;

/**
 * Why the provider stopped generating. Only {@link #LENGTH} asks for a continuation.
 */
public enum FinishReason {
    STOP,
    LENGTH,
    CONTENT_FILTER,
    OTHER;

    public boolean isTruncated() {
        return this == LENGTH;
    }

    public static FinishReason from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STOP;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "stop", "end_turn", "stop_sequence", "eos" -> STOP;
            case "length", "max_tokens" -> LENGTH;
            case "content_filter", "safety" -> CONTENT_FILTER;
            default -> OTHER;
        };
    }
}
