package work.stepweave.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output validation attached to a generative call. Either {@code schema} or {@code customValidator} is set;
 * when neither is, the output only has to be well-formed JSON.
 */
public record ValidationConfig(
    Map<String, Object> schema,
    String customValidator,
    Map<String, Object> criteria,
    int maxRetries,
    String retryPrompt,
    boolean allowPartialSuccess,
    String extractJsonPattern,
    boolean forceJsonOutput,
    String jsonWrapperInstruction
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int MAX_RETRIES_LIMIT = 10;
    public static final String DEFAULT_JSON_INSTRUCTION = "Please format your response as valid JSON.";

    public ValidationConfig {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("max_retries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        schema = schema == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        criteria = criteria == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
        jsonWrapperInstruction = jsonWrapperInstruction == null || jsonWrapperInstruction.isBlank()
            ? DEFAULT_JSON_INSTRUCTION
            : jsonWrapperInstruction;
    }

    public boolean hasSchema() {
        return schema != null;
    }

    public boolean hasCustomValidator() {
        return customValidator != null && !customValidator.isBlank();
    }

    public boolean hasExtractPattern() {
        return extractJsonPattern != null && !extractJsonPattern.isBlank();
    }
}
