package work.stepweave.engine.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSchemaCheckTest {
    private final JsonSchemaCheck check = new JsonSchemaCheck(Map.of(
        "type", "object",
        "required", List.of("name"),
        "properties", Map.of(
            "name", Map.of("type", "string"),
            "age", Map.of("type", "integer"))));

    @Test
    void acceptsConformingDocument() {
        var outcome = check.check("{\"name\": \"Ada\", \"age\": 36}", Map.of());

        assertTrue(outcome.valid());
        assertEquals(Map.of("name", "Ada", "age", 36), outcome.value());
    }

    @Test
    void reportsSchemaViolations() {
        var outcome = check.check("{\"age\": \"old\"}", Map.of());

        assertFalse(outcome.valid());
        assertEquals(2, outcome.errors().size());
        assertTrue(outcome.errors().stream().allMatch(error -> error.startsWith("Schema validation failed: ")));
        assertTrue(outcome.errorSummary().contains("name"), outcome.errorSummary());
        assertTrue(outcome.errorSummary().contains("age"), outcome.errorSummary());
    }

    @Test
    void reportsUnparseableOutput() {
        var outcome = check.check("Sure! Here is the JSON you asked for", Map.of());

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().get(0).startsWith("Invalid JSON format: "));
        assertEquals("Sure! Here is the JSON you asked for", outcome.rawOutput());
    }

    @Test
    void validatesParsedValues() {
        assertEquals(List.of(), check.validateValue(Map.of("name", "Ada")));
        assertEquals(1, check.validateValue(Map.of("name", 7)).size());
    }
}
