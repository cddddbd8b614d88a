package work.stepweave.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parameters of a text transform, one record per method. Built and checked by the loader so the
 * executor never looks at raw keys.
 */
public interface TransformSpec {
    String method();

    record Split(String separator, Integer maxSplits) implements TransformSpec {
        public Split {
            Objects.requireNonNull(separator, "separator");
            if (separator.isEmpty()) {
                throw new IllegalArgumentException("separator must not be empty");
            }
            if (maxSplits != null && maxSplits < 0) {
                throw new IllegalArgumentException("max_splits must be >= 0");
            }
        }

        @Override
        public String method() {
            return "split";
        }
    }

    record ExtractBetween(String begin, String end, boolean extractAll) implements TransformSpec {
        public ExtractBetween {
            if (begin == null || begin.isEmpty() || end == null || end.isEmpty()) {
                throw new IllegalArgumentException("begin and end markers are required");
            }
        }

        @Override
        public String method() {
            return "extract_between_marker";
        }
    }

    /**
     * {@code group} is a group name or number; {@code null} means whole match, or a map of the named groups
     * when the pattern declares any.
     */
    record RegexExtract(Pattern pattern, String group, List<String> namedGroups, boolean asArray) implements TransformSpec {
        public RegexExtract {
            Objects.requireNonNull(pattern, "pattern");
            namedGroups = namedGroups == null ? List.of() : List.copyOf(namedGroups);
        }

        @Override
        public String method() {
            return "regex_extract";
        }
    }

    record SelectItem(Integer index, String slice, String condition) implements TransformSpec {
        public SelectItem {
            int selectors = (index != null ? 1 : 0) + (slice != null ? 1 : 0) + (condition != null ? 1 : 0);
            if (selectors != 1) {
                throw new IllegalArgumentException("exactly one of 'index', 'slice' or 'condition' must be specified");
            }
        }

        @Override
        public String method() {
            return "select_item";
        }
    }

    record ParseAsJson(Map<String, Object> schema, String schemaSource, boolean strictValidation, boolean formatOutput)
        implements TransformSpec {
        public ParseAsJson {
            schema = schema == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        }

        @Override
        public String method() {
            return "parse_as_json";
        }
    }

    record Replace(List<Replacement> replacements) implements TransformSpec {
        public Replace {
            replacements = replacements == null ? List.of() : List.copyOf(replacements);
        }

        @Override
        public String method() {
            return "replace";
        }
    }

    /**
     * Literal rule when {@code pattern} is null, regex rule otherwise.
     */
    record Replacement(String from, Pattern pattern, String to) {
        public Replacement {
            Objects.requireNonNull(to, "to");
            if ((from == null) == (pattern == null)) {
                throw new IllegalArgumentException("replacement needs exactly one of 'from' or 'pattern'");
            }
        }
    }

    record JsonParse() implements TransformSpec {
        @Override
        public String method() {
            return "json_parse";
        }
    }

    record YamlParse() implements TransformSpec {
        @Override
        public String method() {
            return "yaml_parse";
        }
    }

    /**
     * A {@code null} delimiter on {@code csv_parse} means detect it from the header line.
     */
    record CsvParse(String method, Character delimiter, boolean strictValidation) implements TransformSpec {
        public CsvParse {
            if (!"csv_parse".equals(method) && !"tsv_parse".equals(method)) {
                throw new IllegalArgumentException("unsupported delimited format: " + method);
            }
            if (delimiter == null && "tsv_parse".equals(method)) {
                delimiter = '\t';
            }
        }
    }

    record Format(String template) implements TransformSpec {
        public Format {
            if (template == null || template.isBlank()) {
                throw new IllegalArgumentException("template cannot be empty");
            }
        }

        @Override
        public String method() {
            return "format";
        }
    }

    record MarkdownSplit(SplitType splitType, Integer headerLevel, boolean preserveMetadata) implements TransformSpec {
        public MarkdownSplit {
            splitType = splitType == null ? SplitType.SECTION : splitType;
            if (headerLevel != null && (headerLevel < 1 || headerLevel > 6)) {
                throw new IllegalArgumentException("header_level must be between 1 and 6");
            }
        }

        @Override
        public String method() {
            return "markdown_split";
        }

        public enum SplitType {
            SECTION,
            PARAGRAPH,
            SENTENCE;

            public static SplitType from(String value) {
                if (value == null || value.isBlank()) {
                    return SECTION;
                }
                try {
                    return SplitType.valueOf(value.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Unsupported split_type: " + value);
                }
            }
        }
    }

    record FixedSplit(boolean byTokens, int size, int overlap, boolean preserveBoundaries) implements TransformSpec {
        public FixedSplit {
            if (size <= 0) {
                throw new IllegalArgumentException("size must be > 0");
            }
            if (overlap < 0 || overlap >= size) {
                throw new IllegalArgumentException("overlap must be >= 0 and smaller than size");
            }
        }

        @Override
        public String method() {
            return "fixed_split";
        }
    }

    record ArrayFilter(String condition) implements TransformSpec {
        public ArrayFilter {
            if (condition == null || condition.isBlank()) {
                throw new IllegalArgumentException("condition is required");
            }
        }

        @Override
        public String method() {
            return "array_filter";
        }
    }

    /** Maps every element through {@code transformExpression}; a blank expression keeps the array as is. */
    record ArrayTransform(String transformExpression) implements TransformSpec {
        public boolean isIdentity() {
            return transformExpression == null || transformExpression.isBlank();
        }

        @Override
        public String method() {
            return "array_transform";
        }
    }

    record ArraySort(String sortKey, boolean reverse) implements TransformSpec {
        @Override
        public String method() {
            return "array_sort";
        }
    }

    record ArrayAggregate(Aggregation operation, String separator) implements TransformSpec {
        public ArrayAggregate {
            Objects.requireNonNull(operation, "aggregate_operation");
            separator = separator == null ? ", " : separator;
        }

        @Override
        public String method() {
            return "array_aggregate";
        }

        public enum Aggregation {
            SUM,
            AVG,
            MIN,
            MAX,
            COUNT,
            JOIN;

            public static Aggregation from(String value) {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("aggregate_operation is required (sum|avg|min|max|count|join)");
                }
                try {
                    return Aggregation.valueOf(value.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Unsupported aggregate_operation: " + value);
                }
            }
        }
    }
}
