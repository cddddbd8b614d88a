package work.stepweave.engine.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine log thresholds accepted by configuration files and {@code --log-level}.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    OFF(Level.OFF);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public Level logbackLevel() {
        return logbackLevel;
    }

    /**
     * Sets the Logback root logger threshold. No-op when another SLF4J binding is active.
     */
    public void applyToRootLogger() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(logbackLevel);
        }
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            return WARN;
        }
        if (normalized.equals("FATAL") || normalized.equals("CRITICAL")) {
            return ERROR;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
