package work.stepweave.engine.error;

import java.util.Map;

/**
 * Transport, timeout or provider-side failure of a generative call.
 */
public final class ProviderException extends WorkflowException {
    private final boolean retryable;
    private final int statusCode;

    public ProviderException(String message, boolean retryable) {
        this(message, retryable, -1, null);
    }

    public ProviderException(String message, boolean retryable, int statusCode, Throwable cause) {
        super(ErrorKind.PROVIDER, message, null, statusCode > 0 ? Map.of("status", statusCode) : Map.of(), cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public boolean retryable() {
        return retryable;
    }

    public int statusCode() {
        return statusCode;
    }
}
