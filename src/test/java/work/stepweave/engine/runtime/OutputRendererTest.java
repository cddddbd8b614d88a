package work.stepweave.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.stepweave.engine.model.OutputSpec.Format;

class OutputRendererTest {
    @Test
    void textPrintsStringsRawAndStructuresAsJson() {
        assertEquals("hello", OutputRenderer.format("hello", Format.TEXT));
        assertEquals("42", OutputRenderer.format(42, Format.TEXT));
        assertEquals("", OutputRenderer.format(null, Format.TEXT));
        assertEquals("[ 1, 2 ]", OutputRenderer.format(List.of(1, 2), Format.TEXT));
    }

    @Test
    void jsonReparsesStringsHoldingDocuments() {
        assertEquals("{\n  \"a\" : 1\n}", OutputRenderer.format("{\"a\":1}", Format.JSON));
        assertEquals("\"plain words\"", OutputRenderer.format("plain words", Format.JSON));
    }

    @Test
    void yamlOmitsTheDocumentMarker() {
        var value = new LinkedHashMap<String, Object>();
        value.put("title", "Report");
        value.put("items", List.of("one", "two"));

        assertEquals("title: Report\nitems:\n- one\n- two", OutputRenderer.format(value, Format.YAML));
        assertEquals("count: 2", OutputRenderer.format(Map.of("count", 2), Format.YAML));
    }
}
