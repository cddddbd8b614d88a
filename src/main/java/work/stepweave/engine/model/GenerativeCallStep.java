package work.stepweave.engine.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Calls the generative provider with a rendered prompt, optionally validating the answer.
 */
public record GenerativeCallStep(
    String id,
    String description,
    OnError onError,
    String prompt,
    String model,
    Double temperature,
    Integer maxTokens,
    Map<String, Object> aiParams,
    Integer maxAutoRetryAttempts,
    Duration timeout,
    ValidationConfig validation
) implements Step {
    public static final String TYPE = "ai_call";
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public GenerativeCallStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(prompt, "prompt");
        onError = onError == null ? OnError.STOP : onError;
        aiParams = aiParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aiParams));
    }

    @Override
    public String type() {
        return TYPE;
    }

    public double effectiveTemperature() {
        return temperature == null ? DEFAULT_TEMPERATURE : temperature;
    }

    public Optional<ValidationConfig> validationConfig() {
        return Optional.ofNullable(validation);
    }
}
