package work.stepweave.engine.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.stepweave.engine.api.LogLevel;

/**
 * Immutable engine-wide settings threaded into every run.
 */
public record EngineConfiguration(
    String defaultModel,
    String baseUrl,
    String apiKey,
    int maxParallelAiCalls,
    Duration timeoutPerStep,
    int maxAutoRetryAttempts,
    int providerMaxRetries,
    Duration providerRetryBackoff,
    LogLevel logLevel,
    Map<String, Map<String, Object>> providerSettings
) {
    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final int DEFAULT_MAX_PARALLEL_AI_CALLS = 3;
    public static final Duration DEFAULT_TIMEOUT_PER_STEP = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_AUTO_RETRY_ATTEMPTS = 10;
    public static final int DEFAULT_PROVIDER_MAX_RETRIES = 3;
    public static final Duration DEFAULT_PROVIDER_RETRY_BACKOFF = Duration.ofSeconds(1);

    /**
     * Connection keys of a provider settings block; everything else is sent as a request parameter.
     */
    public static final Set<String> CONNECTION_KEYS = Set.of("api_key", "base_url", "organization", "region", "timeout");

    public EngineConfiguration {
        Objects.requireNonNull(defaultModel, "defaultModel");
        Objects.requireNonNull(timeoutPerStep, "timeoutPerStep");
        Objects.requireNonNull(providerRetryBackoff, "providerRetryBackoff");
        Objects.requireNonNull(logLevel, "logLevel");
        if (defaultModel.isBlank()) {
            throw new IllegalArgumentException("default_model must not be blank");
        }
        if (maxParallelAiCalls < 1) {
            throw new IllegalArgumentException("max_parallel_ai_calls must be >= 1");
        }
        if (timeoutPerStep.isNegative() || timeoutPerStep.isZero()) {
            throw new IllegalArgumentException("timeout_per_step must be > 0");
        }
        if (maxAutoRetryAttempts < 0) {
            throw new IllegalArgumentException("max_auto_retry_attempts must be >= 0");
        }
        if (providerMaxRetries < 0) {
            throw new IllegalArgumentException("provider_max_retries must be >= 0");
        }
        var settings = new LinkedHashMap<String, Map<String, Object>>();
        if (providerSettings != null) {
            providerSettings.forEach((provider, values) ->
                settings.put(provider, values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        }
        providerSettings = Collections.unmodifiableMap(settings);
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    /**
     * Provider prefix of a model name: {@code ollama/llama3} belongs to {@code ollama}; bare names have none.
     */
    public static String providerOf(String model) {
        if (model == null) {
            return null;
        }
        int slash = model.indexOf('/');
        return slash > 0 ? model.substring(0, slash) : null;
    }

    /**
     * Settings block for the model's provider prefix, empty when there is none.
     */
    public Map<String, Object> settingsFor(String model) {
        var provider = providerOf(model);
        if (provider == null) {
            return Map.of();
        }
        return providerSettings.getOrDefault(provider, Map.of());
    }

    /**
     * Extra request parameters contributed by the provider settings (connection keys excluded).
     */
    public Map<String, Object> requestParamsFor(String model) {
        var params = new LinkedHashMap<String, Object>();
        settingsFor(model).forEach((key, value) -> {
            if (!CONNECTION_KEYS.contains(key)) {
                params.put(key, value);
            }
        });
        return params;
    }

    public Builder toBuilder() {
        return new Builder()
            .defaultModel(defaultModel)
            .baseUrl(baseUrl)
            .apiKey(apiKey)
            .maxParallelAiCalls(maxParallelAiCalls)
            .timeoutPerStep(timeoutPerStep)
            .maxAutoRetryAttempts(maxAutoRetryAttempts)
            .providerMaxRetries(providerMaxRetries)
            .providerRetryBackoff(providerRetryBackoff)
            .logLevel(logLevel)
            .providerSettings(providerSettings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String defaultModel = DEFAULT_MODEL;
        private String baseUrl;
        private String apiKey;
        private int maxParallelAiCalls = DEFAULT_MAX_PARALLEL_AI_CALLS;
        private Duration timeoutPerStep = DEFAULT_TIMEOUT_PER_STEP;
        private int maxAutoRetryAttempts = DEFAULT_MAX_AUTO_RETRY_ATTEMPTS;
        private int providerMaxRetries = DEFAULT_PROVIDER_MAX_RETRIES;
        private Duration providerRetryBackoff = DEFAULT_PROVIDER_RETRY_BACKOFF;
        private LogLevel logLevel = LogLevel.INFO;
        private Map<String, Map<String, Object>> providerSettings = Map.of();

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder maxParallelAiCalls(int maxParallelAiCalls) {
            this.maxParallelAiCalls = maxParallelAiCalls;
            return this;
        }

        public Builder timeoutPerStep(Duration timeoutPerStep) {
            this.timeoutPerStep = timeoutPerStep;
            return this;
        }

        public Builder maxAutoRetryAttempts(int maxAutoRetryAttempts) {
            this.maxAutoRetryAttempts = maxAutoRetryAttempts;
            return this;
        }

        public Builder providerMaxRetries(int providerMaxRetries) {
            this.providerMaxRetries = providerMaxRetries;
            return this;
        }

        public Builder providerRetryBackoff(Duration providerRetryBackoff) {
            this.providerRetryBackoff = providerRetryBackoff;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder providerSettings(Map<String, Map<String, Object>> providerSettings) {
            this.providerSettings = providerSettings;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                defaultModel,
                baseUrl,
                apiKey,
                maxParallelAiCalls,
                timeoutPerStep,
                maxAutoRetryAttempts,
                providerMaxRetries,
                providerRetryBackoff,
                logLevel,
                providerSettings
            );
        }
    }
}
