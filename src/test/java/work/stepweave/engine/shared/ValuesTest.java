package work.stepweave.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void truthinessFollowsValueShape() {
        assertFalse(Values.isTruthy(null));
        assertFalse(Values.isTruthy(0));
        assertFalse(Values.isTruthy(Double.NaN));
        assertFalse(Values.isTruthy("false"));
        assertFalse(Values.isTruthy("maybe"));
        assertFalse(Values.isTruthy(List.of()));
        assertTrue(Values.isTruthy(" Yes "));
        assertTrue(Values.isTruthy(2));
        assertTrue(Values.isTruthy(Map.of("a", 1)));
    }

    @Test
    void textFormOfValues() {
        assertEquals("", Values.toText(null));
        assertEquals("3", Values.toText(3.0));
        assertEquals("3.5", Values.toText(3.5));
        assertEquals("{\"a\":[1,2]}", Values.toText(Map.of("a", List.of(1, 2))));
    }

    @Test
    void deepCopyDetachesNestedStructures() {
        Map<String, Object> original = Map.of("list", List.of(Map.of("k", "v")));

        var copy = Values.deepCopy(original);

        assertEquals(original, copy);
        assertNotSame(original.get("list"), ((Map<?, ?>) copy).get("list"));
    }

    @Test
    void typeNames() {
        assertEquals("integer", Values.typeName(5L));
        assertEquals("number", Values.typeName(1.5));
        assertEquals("array", Values.typeName(List.of()));
        assertEquals("null", Values.typeName(null));
        assertEquals(4, Values.asInteger("4"));
        assertEquals(4, Values.asInteger(4.0));
    }
}
