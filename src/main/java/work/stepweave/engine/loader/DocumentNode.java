package work.stepweave.engine.loader;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.stepweave.engine.error.WorkflowDefinitionException;
import work.stepweave.engine.shared.DurationParser;

/**
 * Typed, path-aware view over one mapping of a parsed workflow document. Every failure names the offending
 * location, e.g. {@code steps[2].concurrency.max_parallel}.
 */
final class DocumentNode {
    private final Map<String, Object> raw;
    private final String path;

    DocumentNode(Map<String, Object> raw, String path) {
        this.raw = raw == null ? Map.of() : raw;
        this.path = path;
    }

    String path() {
        return path;
    }

    String path(String key) {
        return path == null || path.isEmpty() ? key : path + "." + key;
    }

    boolean has(String key) {
        return raw.get(key) != null;
    }

    Object raw(String key) {
        return raw.get(key);
    }

    String string(String key) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw fail(key, "expected a string");
        }
        return String.valueOf(value);
    }

    String requiredString(String key) {
        var value = string(key);
        if (value == null || value.isBlank()) {
            throw fail(key, "is required");
        }
        return value;
    }

    boolean bool(String key, boolean fallback) {
        var value = raw.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        var text = String.valueOf(value).trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw fail(key, "expected true or false but got '" + text + "'");
    }

    Integer integer(String key) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw fail(key, "expected an integer but got '" + value + "'");
        }
    }

    Integer integer(String key, int min, int max) {
        var value = integer(key);
        if (value != null && (value < min || value > max)) {
            throw fail(key, max == Integer.MAX_VALUE
                ? "must be >= " + min + " but was " + value
                : "must be between " + min + " and " + max + " but was " + value);
        }
        return value;
    }

    Double decimal(String key, double min, double max) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException ex) {
                throw fail(key, "expected a number but got '" + value + "'");
            }
        }
        if (parsed < min || parsed > max) {
            throw fail(key, "must be between " + min + " and " + max + " but was " + parsed);
        }
        return parsed;
    }

    Duration duration(String key) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        try {
            return DurationParser.fromDocument(value)
                .orElseThrow(() -> fail(key, "invalid duration '" + value + "' (use 500ms, 30s, 2m, 1h or seconds)"));
        } catch (IllegalArgumentException ex) {
            throw new WorkflowDefinitionException(path(key), ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> map(String key) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        throw fail(key, "expected a mapping");
    }

    DocumentNode child(String key) {
        var value = map(key);
        return value == null ? null : new DocumentNode(value, path(key));
    }

    List<?> list(String key) {
        var value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw fail(key, "expected a list");
    }

    /**
     * Elements of a list of mappings, each with its indexed path ({@code key[i]}).
     */
    @SuppressWarnings("unchecked")
    List<DocumentNode> children(String key) {
        var list = list(key);
        if (list == null) {
            return List.of();
        }
        var nodes = new ArrayList<DocumentNode>(list.size());
        for (int i = 0; i < list.size(); i++) {
            var itemPath = path(key) + "[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> item)) {
                throw new WorkflowDefinitionException(itemPath, "expected a mapping");
            }
            nodes.add(new DocumentNode((Map<String, Object>) item, itemPath));
        }
        return nodes;
    }

    WorkflowDefinitionException fail(String key, String message) {
        return new WorkflowDefinitionException(path(key), message);
    }

    WorkflowDefinitionException fail(String message) {
        return new WorkflowDefinitionException(path, message);
    }
}
