package work.stepweave.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * A loaded workflow document. Immutable; shared freely between runs.
 */
public record Workflow(
    String name,
    String description,
    String version,
    List<InputParameter> inputParameters,
    List<Step> steps,
    OutputSpec output
) {
    public Workflow {
        Objects.requireNonNull(name, "name");
        inputParameters = inputParameters == null ? List.of() : List.copyOf(inputParameters);
        steps = steps == null ? List.of() : List.copyOf(steps);
        output = output == null ? OutputSpec.DEFAULT : output;
    }
}
