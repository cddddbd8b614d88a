package work.stepweave.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * Named branch of a conditional. A default branch has no condition.
 */
public record ConditionalBranch(String name, String condition, List<Step> steps, boolean isDefault) {
    public ConditionalBranch {
        Objects.requireNonNull(name, "name");
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (!isDefault && (condition == null || condition.isBlank())) {
            throw new IllegalArgumentException("branch '" + name + "' requires a condition");
        }
    }
}
