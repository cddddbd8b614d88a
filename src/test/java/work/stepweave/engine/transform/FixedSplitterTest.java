package work.stepweave.engine.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.stepweave.engine.model.TransformSpec.FixedSplit;

class FixedSplitterTest {
    private static List<Object> contents(List<Map<String, Object>> chunks) {
        return chunks.stream().map(chunk -> chunk.get("content")).toList();
    }

    @Test
    void overlappingCharacterChunks() {
        var chunks = FixedSplitter.split("abcdefghij", new FixedSplit(false, 4, 2, false));

        assertEquals(List.of("abcd", "cdef", "efgh", "ghij"), contents(chunks));
        assertEquals(6, chunks.get(3).get("start_pos"));
        assertEquals(10, chunks.get(3).get("end_pos"));
    }

    @Test
    void preservedBoundariesPullBackToTheLastSpace() {
        var text = "a".repeat(18) + " " + "b".repeat(10);

        var preserved = FixedSplitter.split(text, new FixedSplit(false, 20, 0, true));
        var raw = FixedSplitter.split(text, new FixedSplit(false, 20, 0, false));

        assertEquals(List.of("a".repeat(18), "b".repeat(10)), contents(preserved));
        assertEquals(List.of("a".repeat(18) + " b", "b".repeat(9)), contents(raw));
    }

    @Test
    void tokenChunksSlideByStride() {
        var chunks = FixedSplitter.split("one two  three\nfour five", new FixedSplit(true, 2, 1, true));

        assertEquals(List.of("one two", "two three", "three four", "four five"), contents(chunks));
        assertEquals(2, chunks.get(0).get("token_count"));
        assertEquals(3, chunks.get(3).get("index"));
    }
}
