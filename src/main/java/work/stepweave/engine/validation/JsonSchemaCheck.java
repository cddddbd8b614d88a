package work.stepweave.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON Schema (draft 7) validation backed by networknt json-schema-validator.
 */
public final class JsonSchemaCheck implements OutputCheck {
    private static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final Map<String, Object> schema;
    private final JsonSchema compiled;

    public JsonSchemaCheck(Map<String, Object> schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
        try {
            this.compiled = FACTORY.getSchema(JsonDocuments.toTree(schema));
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Invalid JSON schema: " + ex.getMessage(), ex);
        }
    }

    public Map<String, Object> schema() {
        return schema;
    }

    @Override
    public ValidationOutcome check(String output, Map<String, Object> criteria) {
        JsonNode node;
        try {
            node = JsonDocuments.readTree(output);
        } catch (Exception ex) {
            return ValidationOutcome.failure(List.of("Invalid JSON format: " + JsonDocuments.describe(ex)), output);
        }
        var errors = validateTree(node);
        if (!errors.isEmpty()) {
            return ValidationOutcome.failure(errors.stream().map(error -> "Schema validation failed: " + error).toList(), output);
        }
        return ValidationOutcome.success(JsonDocuments.toJava(node), output);
    }

    /**
     * Validates an already parsed value; returns the schema violations, empty when it conforms.
     */
    public List<String> validateValue(Object value) {
        return validateTree(JsonDocuments.toTree(value));
    }

    private List<String> validateTree(JsonNode node) {
        return compiled.validate(node).stream()
            .map(ValidationMessage::getMessage)
            .sorted()
            .toList();
    }
}
