package work.stepweave.engine.model;

import java.util.Objects;

/**
 * Applies one deterministic text transform to the resolved {@code input}.
 */
public record TextTransformStep(
    String id,
    String description,
    OnError onError,
    String input,
    TransformSpec transform
) implements Step {
    public static final String TYPE = "text_process";

    public TextTransformStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(transform, "transform");
        onError = onError == null ? OnError.STOP : onError;
    }

    @Override
    public String type() {
        return TYPE;
    }

    public String method() {
        return transform.method();
    }
}
