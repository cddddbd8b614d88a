package work.stepweave.engine.validation;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named {@link OutputCheck}s referenced by {@code custom_validator}. Starts with the built-in checks
 * {@code json}, {@code json_object} and {@code non_empty}; callers may register their own.
 */
public final class ValidatorRegistry {
    public static final String JSON = "json";
    public static final String JSON_OBJECT = "json_object";
    public static final String NON_EMPTY = "non_empty";

    private final Map<String, OutputCheck> checks = new ConcurrentHashMap<>();

    public ValidatorRegistry() {
        register(JSON, ValidatorRegistry::wellFormedJson);
        register(JSON_OBJECT, ValidatorRegistry::jsonObject);
        register(NON_EMPTY, ValidatorRegistry::nonEmpty);
    }

    public ValidatorRegistry register(String name, OutputCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("validator name must not be blank");
        }
        checks.put(name.trim(), check);
        return this;
    }

    public Optional<OutputCheck> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(checks.get(name.trim()));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Set<String> names() {
        return new TreeSet<>(checks.keySet());
    }

    static ValidationOutcome wellFormedJson(String output, Map<String, Object> criteria) {
        try {
            return ValidationOutcome.success(JsonDocuments.parse(output), output);
        } catch (Exception ex) {
            return ValidationOutcome.failure(List.of("Invalid JSON format: " + JsonDocuments.describe(ex)), output);
        }
    }

    private static ValidationOutcome jsonObject(String output, Map<String, Object> criteria) {
        var outcome = wellFormedJson(output, criteria);
        if (!outcome.valid()) {
            return outcome;
        }
        if (!(outcome.value() instanceof Map<?, ?> object)) {
            return ValidationOutcome.failure(List.of("Expected a JSON object"), output);
        }
        if (criteria.get("required_fields") instanceof List<?> required) {
            var missing = required.stream().map(String::valueOf).filter(field -> !object.containsKey(field)).toList();
            if (!missing.isEmpty()) {
                return ValidationOutcome.failure(List.of("Missing required fields: " + String.join(", ", missing)), output);
            }
        }
        return outcome;
    }

    private static ValidationOutcome nonEmpty(String output, Map<String, Object> criteria) {
        var text = output == null ? "" : output.trim();
        if (text.isEmpty()) {
            return ValidationOutcome.failure(List.of("Response is empty"), output);
        }
        if (criteria.get("min_length") instanceof Number min && text.length() < min.intValue()) {
            return ValidationOutcome.failure(
                List.of("Response is shorter than " + min.intValue() + " characters (got " + text.length() + ")"), output);
        }
        return ValidationOutcome.success(text, output);
    }
}
