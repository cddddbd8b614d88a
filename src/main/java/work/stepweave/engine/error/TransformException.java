package work.stepweave.engine.error;

import java.util.Map;

/**
 * Malformed input or parameters for a deterministic text transform.
 */
public final class TransformException extends WorkflowException {
    private final String method;

    public TransformException(String method, String message) {
        this(method, message, null);
    }

    public TransformException(String method, String message, Throwable cause) {
        super(ErrorKind.TRANSFORM, message, null, method == null ? Map.of() : Map.of("method", method), cause);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
