package work.stepweave.engine.runtime;

import java.util.List;
import java.util.Map;
import work.stepweave.engine.error.WorkflowException;

/**
 * What a step sequence produced. {@code skipCause} is set when a {@code skip_remaining} step ended it early;
 * {@code skippedSteps} then lists the ids that never ran.
 */
public record SequenceResult(
    Object lastResult,
    Map<String, Object> stepResults,
    List<String> skippedSteps,
    WorkflowException skipCause
) {
    public SequenceResult {
        stepResults = stepResults == null ? Map.of() : stepResults;
        skippedSteps = skippedSteps == null ? List.of() : List.copyOf(skippedSteps);
    }

    public boolean endedEarly() {
        return skipCause != null;
    }
}
