package work.stepweave.engine.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    ANY;

    public static ParameterType from(String value) {
        if (value == null || value.isBlank()) {
            return ANY;
        }
        try {
            return ParameterType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parameter type: " + value);
        }
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                || (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue()));
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof List<?>;
            case OBJECT -> value instanceof Map<?, ?>;
            case ANY -> true;
        };
    }
}
