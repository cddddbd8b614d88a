package work.stepweave.engine.transform;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.stepweave.engine.model.TransformSpec.ArrayAggregate;
import work.stepweave.engine.model.TransformSpec.ArraySort;
import work.stepweave.engine.shared.Values;

/**
 * Sorting, aggregation and Python-style slicing over plain lists.
 */
final class ArrayOperations {
    private ArrayOperations() {}

    static List<Object> sort(List<?> items, ArraySort spec) {
        Comparator<Object> comparator = (left, right) -> compare(sortValue(left, spec.sortKey()), sortValue(right, spec.sortKey()));
        List<Object> sorted = new ArrayList<>(items);
        sorted.sort(spec.reverse() ? comparator.reversed() : comparator);
        return sorted;
    }

    private static Object sortValue(Object item, String key) {
        if (key == null || key.isBlank()) {
            return item;
        }
        if (item instanceof Map<?, ?> map && map.containsKey(key)) {
            return map.get(key);
        }
        return Values.toText(item);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object left, Object right) {
        if (left == null || right == null) {
            if (left == right) {
                return 0;
            }
            throw new IllegalArgumentException("cannot compare null with " + Values.typeName(left == null ? right : left));
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof Comparable comparable && left.getClass() == right.getClass()) {
            return comparable.compareTo(right);
        }
        throw new IllegalArgumentException("cannot compare " + Values.typeName(left) + " with " + Values.typeName(right));
    }

    static Object aggregate(List<?> items, ArrayAggregate spec) {
        if (spec.operation() == ArrayAggregate.Aggregation.COUNT) {
            return items.size();
        }
        if (spec.operation() == ArrayAggregate.Aggregation.JOIN) {
            return items.stream().map(Values::toText).collect(Collectors.joining(spec.separator()));
        }
        List<Number> numbers = items.stream()
            .filter(item -> item instanceof Number)
            .map(Number.class::cast)
            .toList();
        boolean integral = numbers.stream().allMatch(n -> n instanceof Integer || n instanceof Long);
        return switch (spec.operation()) {
            case SUM -> integral
                ? (Object) numbers.stream().mapToLong(Number::longValue).sum()
                : numbers.stream().mapToDouble(Number::doubleValue).sum();
            case AVG -> numbers.isEmpty() ? (Object) 0 : numbers.stream().mapToDouble(Number::doubleValue).average().orElse(0d);
            case MIN -> numbers.stream().min(Comparator.comparingDouble(Number::doubleValue)).orElse(null);
            case MAX -> numbers.stream().max(Comparator.comparingDouble(Number::doubleValue)).orElse(null);
            default -> throw new IllegalStateException("Unhandled aggregation " + spec.operation());
        };
    }

    /**
     * {@code start:end:step} with Python semantics: negative positions count from the end, bounds are clamped.
     */
    static List<Object> slice(List<?> items, String notation) {
        String[] parts = notation.split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("slice must look like 'start:end' or 'start:end:step'");
        }
        Integer start = slicePart(parts[0]);
        Integer end = slicePart(parts[1]);
        Integer stepPart = parts.length == 3 ? slicePart(parts[2]) : null;
        int step = stepPart == null ? 1 : stepPart;
        if (step == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
        int size = items.size();
        List<Object> result = new ArrayList<>();
        if (step > 0) {
            int from = start == null ? 0 : clamp(start < 0 ? start + size : start, 0, size);
            int to = end == null ? size : clamp(end < 0 ? end + size : end, 0, size);
            for (int i = from; i < to; i += step) {
                result.add(items.get(i));
            }
        } else {
            int from = start == null ? size - 1 : clamp(start < 0 ? start + size : start, -1, size - 1);
            int to = end == null ? -1 : clamp(end < 0 ? end + size : end, -1, size - 1);
            for (int i = from; i > to; i += step) {
                result.add(items.get(i));
            }
        }
        return result;
    }

    private static Integer slicePart(String raw) {
        var trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid slice part: '" + raw + "'");
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
