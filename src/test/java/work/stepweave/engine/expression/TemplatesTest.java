package work.stepweave.engine.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TemplatesTest {
    @Test
    void detectsSinglePlaceholders() {
        assertEquals(Optional.of("steps.a"), Templates.singlePlaceholder(" {{ steps.a }} "));
        assertEquals(Optional.empty(), Templates.singlePlaceholder("x {{ a }}"));
        assertEquals(Optional.empty(), Templates.singlePlaceholder("{{ a }}{{ b }}"));
        assertTrue(Templates.hasPlaceholders("a {{ b }}"));
        assertFalse(Templates.hasPlaceholders("no braces"));
    }

    @Test
    void findsReferencedSteps() {
        assertEquals(Set.of("outline", "draft-2"),
            Templates.referencedSteps("{{ steps.outline.title }} {{ steps['draft-2'] }} {{ input.steps }}"));
        assertEquals(Set.of("a"), Templates.referencedStepsInExpression("steps.a > 1"));
    }

    @Test
    void listsExpressions() {
        assertEquals(List.of("a", "b + 1"), Templates.expressions("{{a}} and {{ b + 1 }}"));
        assertEquals(List.of("empty expression '{{ }}'"), Templates.structuralProblems("x {{ }}"));
    }
}
