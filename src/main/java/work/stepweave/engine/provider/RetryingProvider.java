package work.stepweave.engine.provider;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.ProviderException;

/**
 * Retries retryable {@link ProviderException}s with exponential backoff: {@code backoff}, {@code 2 * backoff}, ...
 */
public final class RetryingProvider implements GenerativeProvider {
    private static final Logger log = LoggerFactory.getLogger(RetryingProvider.class);

    private final GenerativeProvider delegate;
    private final int maxRetries;
    private final Duration backoff;
    private final Sleeper sleeper;

    public RetryingProvider(GenerativeProvider delegate, int maxRetries, Duration backoff) {
        this(delegate, maxRetries, backoff, Thread::sleep);
    }

    RetryingProvider(GenerativeProvider delegate, int maxRetries, Duration backoff, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
        this.sleeper = sleeper;
    }

    @Override
    public ProviderResponse invoke(ProviderRequest request) {
        return invoke(request, GenerativeProvider::invoke, () -> { });
    }

    /**
     * Retries {@code attempt} against the wrapped provider. {@code beforeRetry} runs before and after every backoff pause
     * and may throw to abandon the call. Resources an attempt takes must be released by the attempt itself, so
     * nothing is held while pausing.
     */
    public ProviderResponse invoke(ProviderRequest request, Attempt attempt, Runnable beforeRetry) {
        int retries = 0;
        while (true) {
            try {
                return attempt.call(delegate, request);
            } catch (ProviderException ex) {
                if (!ex.retryable() || retries >= maxRetries) {
                    throw ex;
                }
                long delay = backoff.toMillis() * (1L << Math.min(retries, 20));
                retries++;
                log.debug("Provider call for step '{}' failed ({}), retry {}/{} in {}ms",
                    request.stepId(), ex.getMessage(), retries, maxRetries, delay);
                beforeRetry.run();
                pause(delay);
                beforeRetry.run();
            }
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting to retry provider call", false, -1, ex);
        }
    }

    /** One call against the wrapped provider. */
    @FunctionalInterface
    public interface Attempt {
        ProviderResponse call(GenerativeProvider provider, ProviderRequest request);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
