package work.stepweave.engine.provider;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.error.ProviderException;

/**
 * Sends each request to the endpoint configured for its model's provider prefix ({@code provider_settings.<prefix>
 * .base_url} and {@code api_key}), falling back to the global {@code base_url} and {@code api_key}.
 */
public final class ModelRoutingProvider implements GenerativeProvider {
    private final EngineConfiguration configuration;
    private final BiFunction<String, String, GenerativeProvider> factory;
    private final Map<String, GenerativeProvider> endpoints = new ConcurrentHashMap<>();

    public ModelRoutingProvider(EngineConfiguration configuration) {
        this(configuration, OpenAiCompatibleProvider::new);
    }

    ModelRoutingProvider(EngineConfiguration configuration, BiFunction<String, String, GenerativeProvider> factory) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public ProviderResponse invoke(ProviderRequest request) throws ProviderException {
        var settings = configuration.settingsFor(request.model());
        var baseUrl = stringOr(settings.get("base_url"), configuration.baseUrl());
        var apiKey = stringOr(settings.get("api_key"), configuration.apiKey());
        var key = (baseUrl == null ? "" : baseUrl) + "|" + (apiKey == null ? "" : Integer.toHexString(apiKey.hashCode()));
        return endpoints.computeIfAbsent(key, ignored -> factory.apply(baseUrl, apiKey)).invoke(request);
    }

    private static String stringOr(Object value, String fallback) {
        return value == null || String.valueOf(value).isBlank() ? fallback : String.valueOf(value);
    }
}
