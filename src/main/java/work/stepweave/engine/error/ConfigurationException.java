package work.stepweave.engine.error;

import java.nio.file.Path;
import java.util.Map;

/**
 * Engine configuration file missing, unreadable or holding invalid values.
 */
public final class ConfigurationException extends WorkflowException {
    public ConfigurationException(Path source, String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, source == null ? message : source + ": " + message, null,
            source == null ? Map.of() : Map.of("source", source.toString()), cause);
    }
}
