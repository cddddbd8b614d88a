package work.stepweave.engine.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.stepweave.engine.support.EngineTestSupport.EVALUATOR;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.stepweave.engine.error.TemplateResolutionException;

final class JsExpressionEvaluatorTest {
    private static final Map<String, Object> BINDINGS = Map.of(
        "topic", "rivers",
        "count", 3,
        "steps", Map.of("outline", Map.of("points", List.of("a", "b"))),
        "empty", "");

    @Test
    void rendersTemplatesWithNestedAccess() {
        assertEquals("3 points on rivers: a,b",
            EVALUATOR.render("{{ count }} points on {{ topic }}: {{ steps.outline.points.join(',') }}", BINDINGS));
        assertEquals("plain text", EVALUATOR.render("plain text", BINDINGS));
        assertEquals("[\"a\",\"b\"]", EVALUATOR.render("{{ steps.outline.points }}", BINDINGS));
    }

    @Test
    void singlePlaceholderResolvesToTheRawValue() {
        assertEquals(List.of("a", "b"), EVALUATOR.resolve("{{ steps.outline.points }}", BINDINGS));
        assertEquals(3, EVALUATOR.resolve("  {{ count }} ", BINDINGS));
        assertEquals("count: 3", EVALUATOR.resolve("count: {{ count }}", BINDINGS));
        assertEquals(Map.of("n", 4), EVALUATOR.resolve("{{ {n: count + 1} }}", BINDINGS));
    }

    @Test
    void numbersComeBackAsTheNarrowestJavaType() {
        assertEquals(7, EVALUATOR.evaluate("count + 4", BINDINGS));
        assertEquals(1.5, EVALUATOR.evaluate("count / 2", BINDINGS));
        assertEquals(10_000_000_000L, EVALUATOR.evaluate("10000000000", BINDINGS));
        assertEquals(true, EVALUATOR.evaluate("{{ topic.startsWith('ri') }}", BINDINGS));
    }

    @Test
    void variablesNamedLikeBuiltInsCannotBeReferenced() {
        var bindings = Map.<String, Object>of("Math", 5, "count", 3);

        var error = assertThrows(TemplateResolutionException.class, () -> EVALUATOR.evaluate("Math + count", bindings));
        assertTrue(error.getMessage().contains("'Math'"), error.getMessage());
        assertThrows(TemplateResolutionException.class, () -> EVALUATOR.render("total {{ Math }}", bindings));
        assertEquals(3, EVALUATOR.evaluate("count", bindings));
        assertEquals("Math says 3", EVALUATOR.render("Math says {{ count }}", bindings));
    }

    @Test
    void missingNamesAreErrorsNotEmptyStrings() {
        var error = assertThrows(TemplateResolutionException.class, () -> EVALUATOR.render("about {{ subject }}", BINDINGS));
        assertEquals("subject", error.expression());
        assertThrows(TemplateResolutionException.class, () -> EVALUATOR.evaluate("steps.outline.missing", BINDINGS));
        assertEquals("", EVALUATOR.render("{{ empty }}", BINDINGS));
    }

    @Test
    void checkFindsSyntaxAndStructureProblems() {
        assertEquals(List.of(), EVALUATOR.check("{{ a.b + 1 }} and {{ c }}"));
        var problems = EVALUATOR.check("{{ a + }} then {{ open");
        assertEquals(2, problems.size());
        assertEquals("unterminated '{{' in template", problems.get(0));
        assertTrue(problems.get(1).startsWith("invalid expression 'a +'"), problems.get(1));
    }

    @Test
    void hostClassesAreUnreachable() {
        assertThrows(TemplateResolutionException.class, () -> EVALUATOR.evaluate("Java.type('java.lang.System')", Map.of()));
    }
}
