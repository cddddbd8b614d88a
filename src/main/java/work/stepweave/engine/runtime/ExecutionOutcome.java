package work.stepweave.engine.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.stepweave.engine.error.WorkflowException;

/**
 * Terminal state of one run. A completed run carries the resolved output and its formatted text; a failed run
 * carries the error and whatever step results were committed before it.
 */
public record ExecutionOutcome(
    Status status,
    String workflowName,
    Object output,
    String renderedOutput,
    Map<String, Object> steps,
    List<String> skippedSteps,
    WorkflowException error,
    Map<String, Object> usage,
    Duration elapsed
) {
    public ExecutionOutcome {
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        skippedSteps = skippedSteps == null ? List.of() : List.copyOf(skippedSteps);
        usage = usage == null ? Map.of() : usage;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    static ExecutionOutcome completed(
        String workflowName,
        Object output,
        String renderedOutput,
        Map<String, Object> steps,
        List<String> skippedSteps,
        Map<String, Object> usage,
        Duration elapsed
    ) {
        return new ExecutionOutcome(Status.COMPLETED, workflowName, output, renderedOutput, steps, skippedSteps, null, usage, elapsed);
    }

    static ExecutionOutcome failed(
        String workflowName,
        WorkflowException error,
        Map<String, Object> steps,
        Map<String, Object> usage,
        Duration elapsed
    ) {
        return new ExecutionOutcome(Status.FAILED, workflowName, null, null, steps, List.of(), error, usage, elapsed);
    }

    public boolean succeeded() {
        return status == Status.COMPLETED;
    }

    public enum Status {
        COMPLETED,
        FAILED
    }
}
