package work.stepweave.engine.model;

import java.util.Objects;

public record InputParameter(String name, ParameterType type, boolean required, Object defaultValue, String description) {
    public InputParameter {
        Objects.requireNonNull(name, "name");
        type = type == null ? ParameterType.ANY : type;
    }
}
