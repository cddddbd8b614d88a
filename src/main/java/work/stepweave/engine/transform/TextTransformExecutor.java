package work.stepweave.engine.transform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.TemplateResolutionException;
import work.stepweave.engine.error.TransformException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.TransformSpec;
import work.stepweave.engine.model.TransformSpec.ArrayAggregate;
import work.stepweave.engine.model.TransformSpec.ArrayFilter;
import work.stepweave.engine.model.TransformSpec.ArraySort;
import work.stepweave.engine.model.TransformSpec.ArrayTransform;
import work.stepweave.engine.model.TransformSpec.CsvParse;
import work.stepweave.engine.model.TransformSpec.ExtractBetween;
import work.stepweave.engine.model.TransformSpec.FixedSplit;
import work.stepweave.engine.model.TransformSpec.Format;
import work.stepweave.engine.model.TransformSpec.JsonParse;
import work.stepweave.engine.model.TransformSpec.MarkdownSplit;
import work.stepweave.engine.model.TransformSpec.ParseAsJson;
import work.stepweave.engine.model.TransformSpec.RegexExtract;
import work.stepweave.engine.model.TransformSpec.Replace;
import work.stepweave.engine.model.TransformSpec.SelectItem;
import work.stepweave.engine.model.TransformSpec.Split;
import work.stepweave.engine.model.TransformSpec.YamlParse;
import work.stepweave.engine.shared.Values;
import work.stepweave.engine.validation.JsonDocuments;
import work.stepweave.engine.validation.JsonSchemaCheck;

/**
 * Deterministic text transforms. No I/O: schema files are read by the loader. Any malformed input fails with
 * a {@link TransformException} and produces no partial output.
 */
public final class TextTransformExecutor {
    private static final Logger log = LoggerFactory.getLogger(TextTransformExecutor.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ExpressionEvaluator evaluator;
    private final Map<Map<String, Object>, JsonSchemaCheck> schemaChecks = new HashMap<>();

    public TextTransformExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Applies {@code spec} to the resolved {@code input}. {@code bindings} is the evaluation context of the
     * step; predicates and {@code format} templates see it.
     */
    public Object apply(TransformSpec spec, Object input, Map<String, Object> bindings) {
        log.debug("Applying transform {}", spec.method());
        try {
            if (spec instanceof Split split) return split(text(input), split);
            if (spec instanceof ExtractBetween between) return extractBetween(text(input), between);
            if (spec instanceof RegexExtract regex) return regexExtract(text(input), regex);
            if (spec instanceof SelectItem select) return selectItem(input, select, bindings);
            if (spec instanceof ParseAsJson parse) return parseAsJson(text(input), parse);
            if (spec instanceof Replace replace) return replace(text(input), replace);
            if (spec instanceof JsonParse) return jsonParse(input);
            if (spec instanceof YamlParse) return yamlParse(input);
            if (spec instanceof CsvParse csv) return DelimitedParser.parse(text(input), csv);
            if (spec instanceof Format format) return format(input, format, bindings);
            if (spec instanceof MarkdownSplit markdown) return MarkdownSplitter.split(text(input), markdown);
            if (spec instanceof FixedSplit fixed) return FixedSplitter.split(text(input), fixed);
            if (spec instanceof ArrayFilter filter) return arrayFilter(array(input, spec), filter, bindings);
            if (spec instanceof ArrayTransform mapping) return arrayTransform(array(input, spec), mapping, bindings);
            if (spec instanceof ArraySort sort) return ArrayOperations.sort(array(input, spec), sort);
            if (spec instanceof ArrayAggregate aggregate) return ArrayOperations.aggregate(array(input, spec), aggregate);
        } catch (TransformException ex) {
            throw ex;
        } catch (TemplateResolutionException ex) {
            throw new TransformException(spec.method(), "Error evaluating expression: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new TransformException(spec.method(), "Failed to apply " + spec.method() + ": " + ex.getMessage(), ex);
        }
        throw new TransformException(spec.method(), "Unsupported transform method: " + spec.method());
    }

    private static List<String> split(String text, Split spec) {
        int limit = spec.maxSplits() == null ? -1 : spec.maxSplits() + 1;
        return Arrays.asList(text.split(Pattern.quote(spec.separator()), limit));
    }

    private static Object extractBetween(String text, ExtractBetween spec) {
        if (!spec.extractAll()) {
            int begin = text.indexOf(spec.begin());
            if (begin < 0) {
                return "";
            }
            int start = begin + spec.begin().length();
            int end = text.indexOf(spec.end(), start);
            return end < 0 ? "" : text.substring(start, end);
        }
        List<String> results = new ArrayList<>();
        int cursor = 0;
        while (true) {
            int begin = text.indexOf(spec.begin(), cursor);
            if (begin < 0) {
                break;
            }
            int start = begin + spec.begin().length();
            int end = text.indexOf(spec.end(), start);
            if (end < 0) {
                break;
            }
            results.add(text.substring(start, end));
            cursor = end + spec.end().length();
        }
        return results;
    }

    private static Object regexExtract(String text, RegexExtract spec) {
        List<Object> matches = new ArrayList<>();
        Matcher matcher = spec.pattern().matcher(text);
        while (matcher.find()) {
            matches.add(matchValue(matcher, spec));
            if (!spec.asArray()) {
                break;
            }
        }
        if (spec.asArray()) {
            return matches;
        }
        return matches.isEmpty() ? "" : matches.get(0);
    }

    private static Object matchValue(Matcher matcher, RegexExtract spec) {
        var group = spec.group();
        if (group == null || group.isBlank()) {
            if (spec.namedGroups().isEmpty()) {
                return matcher.group();
            }
            Map<String, Object> named = new LinkedHashMap<>();
            for (var name : spec.namedGroups()) {
                named.put(name, matcher.group(name));
            }
            return named;
        }
        if (group.chars().allMatch(Character::isDigit)) {
            int number = Integer.parseInt(group);
            if (number > matcher.groupCount()) {
                throw new TransformException("regex_extract", "Pattern has no group " + number);
            }
            return matcher.group(number);
        }
        if (!spec.namedGroups().contains(group)) {
            throw new TransformException("regex_extract", "Pattern has no group named '" + group + "'");
        }
        return matcher.group(group);
    }

    private Object selectItem(Object input, SelectItem spec, Map<String, Object> bindings) {
        List<?> items = selectableItems(input);
        if (spec.index() != null) {
            int index = spec.index();
            if (Math.abs(index) >= items.size()) {
                throw new TransformException("select_item",
                    "Index " + index + " out of range for array of length " + items.size());
            }
            return items.get(index < 0 ? items.size() + index : index);
        }
        if (spec.slice() != null) {
            return ArrayOperations.slice(items, spec.slice());
        }
        return filterItems(items, spec.condition(), bindings);
    }

    private static List<?> selectableItems(Object input) {
        if (input instanceof List<?> list) {
            return list;
        }
        if (input instanceof String text) {
            try {
                if (JsonDocuments.parse(text) instanceof List<?> parsed) {
                    return parsed;
                }
            } catch (IOException | IllegalArgumentException ex) {
                log.debug("select_item input is not a JSON array, splitting on commas");
            }
            return Arrays.stream(text.split(",", -1)).map(String::strip).toList();
        }
        throw new TransformException("select_item", "Input must be a list or array, got " + Values.typeName(input));
    }

    private List<Object> filterItems(List<?> items, String condition, Map<String, Object> bindings) {
        List<Object> selected = new ArrayList<>();
        for (Object item : items) {
            var scope = new LinkedHashMap<>(bindings == null ? Map.<String, Object>of() : bindings);
            scope.put("item", item);
            if (Values.isTruthy(evaluator.evaluate(condition, scope))) {
                selected.add(item);
            }
        }
        return selected;
    }

    private Map<String, Object> parseAsJson(String text, ParseAsJson spec) {
        Object parsed;
        try {
            parsed = JsonDocuments.parse(text);
        } catch (IOException | IllegalArgumentException ex) {
            throw new TransformException("parse_as_json", "Invalid JSON format: " + JsonDocuments.describe(ex), ex);
        }
        List<String> errors = new ArrayList<>();
        boolean schemaValid = true;
        if (spec.schema() != null) {
            errors.addAll(schemaCheck(spec.schema()).validateValue(parsed));
            schemaValid = errors.isEmpty();
            if (!schemaValid && spec.strictValidation()) {
                throw new TransformException("parse_as_json", "JSON schema validation failed: " + String.join("; ", errors));
            }
        }
        var validation = new LinkedHashMap<String, Object>();
        validation.put("valid", schemaValid && errors.isEmpty());
        validation.put("errors", errors);
        validation.put("schema_valid", schemaValid);

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("schema_file", spec.schemaSource());
        metadata.put("strict_validation", spec.strictValidation());
        metadata.put("format_output", spec.formatOutput());
        metadata.put("data_type", Values.typeName(parsed));
        metadata.put("data_size", Values.toJson(parsed).length());

        var result = new LinkedHashMap<String, Object>();
        result.put("data", spec.formatOutput() ? Values.toPrettyJson(parsed) : parsed);
        result.put("validation_result", validation);
        result.put("metadata", metadata);
        return result;
    }

    private synchronized JsonSchemaCheck schemaCheck(Map<String, Object> schema) {
        return schemaChecks.computeIfAbsent(schema, JsonSchemaCheck::new);
    }

    private static String replace(String text, Replace spec) {
        var result = text;
        for (var rule : spec.replacements()) {
            result = rule.pattern() == null
                ? result.replace(rule.from(), rule.to())
                : rule.pattern().matcher(result).replaceAll(rule.to());
        }
        return result;
    }

    private static Object jsonParse(Object input) {
        if (!(input instanceof String text)) {
            return input;
        }
        try {
            return JsonDocuments.parse(text);
        } catch (IOException | IllegalArgumentException ex) {
            throw new TransformException("json_parse", "Invalid JSON format: " + JsonDocuments.describe(ex), ex);
        }
    }

    private static Object yamlParse(Object input) {
        if (!(input instanceof String text)) {
            return input;
        }
        if (text.isBlank()) {
            return null;
        }
        try {
            return YAML.readValue(text, Object.class);
        } catch (IOException ex) {
            throw new TransformException("yaml_parse", "Invalid YAML format: " + ex.getMessage(), ex);
        }
    }

    private String format(Object input, Format spec, Map<String, Object> bindings) {
        var scope = new LinkedHashMap<>(bindings == null ? Map.<String, Object>of() : bindings);
        scope.put("input", input);
        try {
            return evaluator.render(spec.template(), scope);
        } catch (TemplateResolutionException ex) {
            throw new TransformException("format", "Template rendering failed: " + ex.getMessage(), ex);
        }
    }

    private List<Object> arrayFilter(List<?> items, ArrayFilter spec, Map<String, Object> bindings) {
        return filterItems(items, spec.condition(), bindings);
    }

    private List<Object> arrayTransform(List<?> items, ArrayTransform spec, Map<String, Object> bindings) {
        if (spec.isIdentity()) {
            return new ArrayList<>(items);
        }
        List<Object> mapped = new ArrayList<>(items.size());
        for (int index = 0; index < items.size(); index++) {
            var scope = new LinkedHashMap<>(bindings == null ? Map.<String, Object>of() : bindings);
            scope.put("item", items.get(index));
            scope.put("index", index);
            try {
                mapped.add(evaluator.evaluate(spec.transformExpression(), scope));
            } catch (TemplateResolutionException ex) {
                throw new TransformException("array_transform",
                    "Error transforming item at index " + index + ": " + ex.getMessage(), ex);
            }
        }
        return mapped;
    }

    private static String text(Object input) {
        return input instanceof String text ? text : Values.toText(input);
    }

    private static List<?> array(Object input, TransformSpec spec) {
        if (input instanceof List<?> list) {
            return list;
        }
        if (input instanceof String text) {
            try {
                if (JsonDocuments.parse(text) instanceof List<?> parsed) {
                    return parsed;
                }
            } catch (IOException | IllegalArgumentException ex) {
                throw new TransformException(spec.method(), "Input must be an array for " + spec.method(), ex);
            }
        }
        throw new TransformException(spec.method(), "Input must be an array for " + spec.method());
    }
}
