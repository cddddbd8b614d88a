package work.stepweave.engine.provider;

import work.stepweave.engine.error.ProviderException;

/**
 * Black-box request/response access to a generative-text service. Implementations must be thread-safe:
 * collection workers call them concurrently.
 */
@FunctionalInterface
public interface GenerativeProvider {
    ProviderResponse invoke(ProviderRequest request) throws ProviderException;
}
