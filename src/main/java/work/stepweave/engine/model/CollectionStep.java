package work.stepweave.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * Runs map, filter, reduce or a pipeline of them over an array resolved from {@code input}.
 */
public record CollectionStep(
    String id,
    String description,
    OnError onError,
    CollectionOperation operation,
    String input,
    List<CollectionStage> stages,
    ConcurrencyPolicy concurrency,
    ItemErrorPolicy errorHandling
) implements Step {
    public static final String TYPE = "collection";

    public CollectionStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(input, "input");
        stages = stages == null ? List.of() : List.copyOf(stages);
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("collection step requires at least one stage");
        }
        if (operation != CollectionOperation.PIPELINE && stages.size() != 1) {
            throw new IllegalArgumentException(operation.code() + " takes exactly one stage");
        }
        onError = onError == null ? OnError.STOP : onError;
        concurrency = concurrency == null ? ConcurrencyPolicy.DEFAULT : concurrency;
        errorHandling = errorHandling == null ? ItemErrorPolicy.DEFAULT : errorHandling;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
