package work.stepweave.engine.validation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.stepweave.engine.model.ValidationConfig;
import work.stepweave.engine.shared.Values;

/**
 * Applies one {@link ValidationConfig} to provider answers: primary check, pattern extraction fallback and
 * the correction text appended to retry prompts.
 */
public final class OutputValidator {
    private final ValidationConfig config;
    private final OutputCheck check;
    private final JsonSchemaCheck schemaCheck;
    private final Pattern extractPattern;

    public OutputValidator(ValidationConfig config, ValidatorRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.hasSchema()) {
            this.schemaCheck = new JsonSchemaCheck(config.schema());
            this.check = schemaCheck;
        } else if (config.hasCustomValidator()) {
            this.schemaCheck = null;
            this.check = registry.find(config.customValidator())
                .orElseThrow(() -> new IllegalArgumentException("Unknown custom validator: " + config.customValidator()));
        } else {
            this.schemaCheck = null;
            this.check = ValidatorRegistry::wellFormedJson;
        }
        this.extractPattern = compileExtractPattern(config.extractJsonPattern());
    }

    public ValidationConfig config() {
        return config;
    }

    /**
     * Prompt sent on the first attempt: the rendered prompt, plus the JSON instruction when forced.
     */
    public String initialPrompt(String renderedPrompt) {
        if (!config.forceJsonOutput()) {
            return renderedPrompt;
        }
        return renderedPrompt + "\n\n" + config.jsonWrapperInstruction();
    }

    public ValidationOutcome validate(String output) {
        var outcome = runCheck(output);
        if (outcome.valid() || extractPattern == null) {
            return outcome;
        }
        var extracted = extract(output);
        if (extracted == null) {
            return outcome;
        }
        var recovered = runCheck(extracted);
        return recovered.valid() ? recovered : outcome;
    }

    /**
     * Prompt for the next attempt: the original prompt, the configured retry prompt and the validator's
     * correction message.
     */
    public String retryPrompt(String originalPrompt, ValidationOutcome failed) {
        var builder = new StringBuilder(originalPrompt).append("\n\n");
        if (config.retryPrompt() != null && !config.retryPrompt().isBlank()) {
            builder.append(config.retryPrompt().trim()).append('\n');
        }
        builder.append(correction(failed));
        return builder.toString();
    }

    String correction(ValidationOutcome failed) {
        var errors = failed.errorSummary();
        if (schemaCheck != null) {
            return "Previous response failed validation: " + errors + "\n\n"
                + "Please respond with valid JSON that matches this schema:\n"
                + Values.toPrettyJson(schemaCheck.schema()) + "\n\n"
                + "Ensure your response is valid JSON and includes all required fields.";
        }
        var builder = new StringBuilder("Previous response failed validation: ").append(errors);
        if (!config.criteria().isEmpty()) {
            builder.append("\nValidation criteria: ").append(Values.toPrettyJson(config.criteria()));
        }
        builder.append("\n\nPlease ensure your response meets all the specified requirements.");
        return builder.toString();
    }

    /**
     * Best-effort value once retries are exhausted: parsed JSON of the extracted or raw text if possible,
     * the raw text otherwise.
     */
    public Object bestEffort(String output) {
        var extracted = extractPattern == null ? null : extract(output);
        for (var candidate : extracted == null ? List.of(output) : List.of(extracted, output)) {
            var parsed = tryParse(candidate);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return output;
    }

    private static Optional<Object> tryParse(String text) {
        try {
            return Optional.ofNullable(JsonDocuments.parse(text));
        } catch (Exception ex) {
            return Optional.empty();
        }
    }

    private ValidationOutcome runCheck(String output) {
        try {
            return check.check(output, config.criteria());
        } catch (RuntimeException ex) {
            return ValidationOutcome.failure(List.of("Custom validation error: " + ex.getMessage()), output);
        }
    }

    private String extract(String output) {
        if (output == null) {
            return null;
        }
        Matcher matcher = extractPattern.matcher(output);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
    }

    private static Pattern compileExtractPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(pattern, Pattern.DOTALL);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid extract_json_pattern: " + ex.getDescription(), ex);
        }
    }
}
