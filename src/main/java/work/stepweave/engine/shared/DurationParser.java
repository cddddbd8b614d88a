package work.stepweave.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 500ms}, {@code 30s}, {@code 2m}, {@code 5h}).
 * Bare numbers are milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        double multiplier = 1d;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000d;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000d;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000d;
        }
        double value;
        try {
            value = Double.parseDouble(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.round(value * multiplier)));
    }

    /**
     * Workflow and config documents give plain numbers in seconds ({@code delay_between_batches: 0.5}).
     */
    public static Optional<Duration> fromDocument(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            if (number.doubleValue() < 0) {
                throw new IllegalArgumentException("Duration must not be negative: " + raw);
            }
            return Optional.of(Duration.ofMillis(Math.round(number.doubleValue() * 1_000d)));
        }
        return parse(String.valueOf(raw));
    }
}
