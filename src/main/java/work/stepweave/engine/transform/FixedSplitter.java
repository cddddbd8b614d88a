package work.stepweave.engine.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.stepweave.engine.model.TransformSpec.FixedSplit;

/**
 * Fixed-size chunking by characters or by whitespace-separated tokens, with overlap.
 */
final class FixedSplitter {
    private FixedSplitter() {}

    static List<Map<String, Object>> split(String text, FixedSplit spec) {
        return spec.byTokens() ? byTokens(text, spec) : byCharacters(text, spec);
    }

    private static List<Map<String, Object>> byCharacters(String text, FixedSplit spec) {
        List<Map<String, Object>> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + spec.size(), length);
            if (spec.preserveBoundaries() && end < length) {
                int boundary = end;
                while (boundary > start && text.charAt(boundary) != ' ') {
                    boundary--;
                }
                // only pull back when the word boundary is within the last 10% of the chunk
                if (boundary > start && (end - boundary) <= spec.size() * 0.1) {
                    end = boundary;
                }
            }
            var content = text.substring(start, end).strip();
            if (!content.isEmpty()) {
                Map<String, Object> chunk = new LinkedHashMap<>();
                chunk.put("content", content);
                chunk.put("index", chunks.size());
                chunk.put("start_pos", start);
                chunk.put("end_pos", end);
                chunk.put("char_count", content.length());
                chunk.put("word_count", MarkdownSplitter.wordCount(content));
                chunks.add(chunk);
            }
            if (end >= length) {
                break;
            }
            int next = end - spec.overlap();
            start = next > start ? next : end;
        }
        return chunks;
    }

    private static List<Map<String, Object>> byTokens(String text, FixedSplit spec) {
        List<Map<String, Object>> chunks = new ArrayList<>();
        var stripped = text.strip();
        if (stripped.isEmpty()) {
            return chunks;
        }
        String[] tokens = stripped.split("\\s+");
        int stride = spec.size() - spec.overlap();
        for (int start = 0; start < tokens.length; start += stride) {
            int end = Math.min(start + spec.size(), tokens.length);
            var content = String.join(" ", Arrays.copyOfRange(tokens, start, end));
            Map<String, Object> chunk = new LinkedHashMap<>();
            chunk.put("content", content);
            chunk.put("index", chunks.size());
            chunk.put("start_token", start);
            chunk.put("end_token", end);
            chunk.put("token_count", end - start);
            chunk.put("char_count", content.length());
            chunks.add(chunk);
            if (end >= tokens.length) {
                break;
            }
        }
        return chunks;
    }
}
