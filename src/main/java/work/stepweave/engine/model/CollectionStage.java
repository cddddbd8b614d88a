package work.stepweave.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * One map, filter or reduce pass. A plain collection step has a single stage; a pipeline chains several.
 */
public record CollectionStage(
    String id,
    CollectionOperation operation,
    List<Step> steps,
    String condition,
    Object initialValue,
    String accumulatorVar,
    String itemVar
) {
    public static final String DEFAULT_ACCUMULATOR_VAR = "acc";
    public static final String DEFAULT_ITEM_VAR = "item";

    public CollectionStage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        if (operation == CollectionOperation.PIPELINE) {
            throw new IllegalArgumentException("pipeline stages cannot be nested");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        accumulatorVar = accumulatorVar == null || accumulatorVar.isBlank() ? DEFAULT_ACCUMULATOR_VAR : accumulatorVar;
        itemVar = itemVar == null || itemVar.isBlank() ? DEFAULT_ITEM_VAR : itemVar;
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
