package work.stepweave.engine.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValidatorRegistryTest {
    private final ValidatorRegistry registry = new ValidatorRegistry();

    private ValidationOutcome check(String name, String output, Map<String, Object> criteria) {
        return registry.find(name).orElseThrow().check(output, criteria);
    }

    @Test
    void listsBuiltInChecksInOrder() {
        assertEquals(List.of("json", "json_object", "non_empty"), List.copyOf(registry.names()));
    }

    @Test
    void jsonAcceptsAnyDocumentAndRejectsTrailingText() {
        var ok = check("json", " [1, 2] ", Map.of());
        assertTrue(ok.valid());
        assertEquals(List.of(1, 2), ok.value());

        var bad = check("json", "{\"a\": 1} and more", Map.of());
        assertFalse(bad.valid());
        assertTrue(bad.errors().get(0).startsWith("Invalid JSON format: "), bad.errorSummary());
    }

    @Test
    void jsonObjectChecksRequiredFields() {
        var criteria = Map.<String, Object>of("required_fields", List.of("title", "score"));

        assertTrue(check("json_object", "{\"title\": \"t\", \"score\": 3}", criteria).valid());
        assertEquals(List.of("Missing required fields: score"),
            check("json_object", "{\"title\": \"t\"}", criteria).errors());
        assertEquals(List.of("Expected a JSON object"), check("json_object", "[1]", Map.of()).errors());
    }

    @Test
    void nonEmptyHonoursMinimumLength() {
        assertEquals(List.of("Response is empty"), check("non_empty", "   ", Map.of()).errors());
        assertEquals(List.of("Response is shorter than 10 characters (got 5)"),
            check("non_empty", "short", Map.of("min_length", 10)).errors());

        var ok = check("non_empty", "  long enough text ", Map.of("min_length", 10));
        assertTrue(ok.valid());
        assertEquals("long enough text", ok.value());
    }

    @Test
    void registersCustomChecks() {
        registry.register("shout", (output, criteria) -> output.equals(output.toUpperCase())
            ? ValidationOutcome.success(output, output)
            : ValidationOutcome.failure(List.of("not loud enough"), output));

        assertTrue(registry.contains(" shout "));
        assertTrue(check("shout", "HEY", Map.of()).valid());
        assertFalse(check("shout", "hey", Map.of()).valid());
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", (output, criteria) -> null));
    }
}
