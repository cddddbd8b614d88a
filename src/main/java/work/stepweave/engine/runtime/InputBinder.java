package work.stepweave.engine.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.stepweave.engine.error.InvalidInputException;
import work.stepweave.engine.model.InputParameter;
import work.stepweave.engine.shared.Values;

/**
 * Applies declared input parameters to caller input: defaults first, then required and type checks.
 * Undeclared keys pass through untouched.
 */
public final class InputBinder {
    private InputBinder() {}

    public static Map<String, Object> bind(List<InputParameter> parameters, Map<String, Object> supplied) {
        var bound = new LinkedHashMap<String, Object>(supplied == null ? Map.of() : supplied);
        for (var parameter : parameters) {
            var name = parameter.name();
            if (bound.get(name) == null) {
                if (parameter.defaultValue() != null) {
                    bound.put(name, Values.deepCopy(parameter.defaultValue()));
                } else if (parameter.required()) {
                    throw new InvalidInputException(name, "Missing required input parameter '" + name + "'");
                }
                continue;
            }
            var value = bound.get(name);
            if (!parameter.type().accepts(value)) {
                throw new InvalidInputException(name, "Input parameter '" + name + "' must be of type "
                    + parameter.type().name().toLowerCase(Locale.ROOT) + ", got " + Values.typeName(value));
            }
        }
        return bound;
    }
}
