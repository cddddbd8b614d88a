package work.stepweave.engine.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.stepweave.engine.model.TransformSpec.MarkdownSplit;

/**
 * Splits markdown into sections, paragraphs or sentences. Every chunk is a map with at least {@code content}.
 */
final class MarkdownSplitter {
    private static final Pattern HEADER = Pattern.compile("^(#{1,6})\\s*(.*)");
    private static final Pattern MISSING_SPACE_AFTER_PUNCTUATION = Pattern.compile("([.!?])(?=[^\\s.!?])");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MarkdownSplitter() {}

    static List<Map<String, Object>> split(String text, MarkdownSplit spec) {
        return switch (spec.splitType()) {
            case SECTION -> sections(text, spec);
            case PARAGRAPH -> paragraphs(text, spec.preserveMetadata());
            case SENTENCE -> sentences(text, spec.preserveMetadata());
        };
    }

    private static List<Map<String, Object>> sections(String text, MarkdownSplit spec) {
        List<Map<String, Object>> sections = new ArrayList<>();
        if (text.isBlank()) {
            return sections;
        }
        Map<String, Object> current = newSection("", null, null, false);
        var content = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            Matcher header = HEADER.matcher(line.strip());
            if (!header.matches()) {
                content.append(line).append('\n');
                continue;
            }
            int level = header.group(1).length();
            if (spec.headerLevel() != null && level > spec.headerLevel()) {
                content.append(line).append('\n');
                continue;
            }
            flush(sections, current, content);
            current = newSection(header.group(2).strip(), level, line.strip(), spec.preserveMetadata());
            content.setLength(0);
        }
        flush(sections, current, content);
        return sections;
    }

    private static Map<String, Object> newSection(String title, Integer level, String rawHeader, boolean metadata) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("title", title);
        section.put("content", "");
        if (metadata && level != null) {
            section.put("level", level);
            section.put("raw_header", rawHeader);
        }
        return section;
    }

    private static void flush(List<Map<String, Object>> sections, Map<String, Object> section, StringBuilder content) {
        var body = content.toString().strip();
        if (!String.valueOf(section.get("title")).isEmpty() || !body.isEmpty()) {
            section.put("content", body);
            sections.add(section);
        }
    }

    private static List<Map<String, Object>> paragraphs(String text, boolean metadata) {
        List<Map<String, Object>> paragraphs = new ArrayList<>();
        String[] chunks = text.split("\n\n", -1);
        for (int i = 0; i < chunks.length; i++) {
            var chunk = chunks[i].strip();
            if (chunk.isEmpty()) {
                continue;
            }
            Map<String, Object> paragraph = new LinkedHashMap<>();
            paragraph.put("content", chunk);
            if (metadata) {
                paragraph.put("index", i);
                paragraph.put("word_count", wordCount(chunk));
            }
            paragraphs.add(paragraph);
        }
        return paragraphs;
    }

    private static List<Map<String, Object>> sentences(String text, boolean metadata) {
        List<Map<String, Object>> sentences = new ArrayList<>();
        var normalized = MISSING_SPACE_AFTER_PUNCTUATION.matcher(text).replaceAll("$1 ");
        int index = 0;
        for (String part : SENTENCE_BREAK.split(normalized)) {
            var sentence = part.strip();
            if (sentence.isEmpty()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("content", sentence);
            if (metadata) {
                entry.put("index", index);
                entry.put("word_count", wordCount(sentence));
                entry.put("char_count", sentence.length());
            }
            sentences.add(entry);
            index++;
        }
        return sentences;
    }

    static int wordCount(String text) {
        var trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
