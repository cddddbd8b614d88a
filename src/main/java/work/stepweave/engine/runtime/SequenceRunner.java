package work.stepweave.engine.runtime;

import java.util.List;
import work.stepweave.engine.model.Step;

/**
 * Runs a nested step sequence in the given scope. Collection and conditional executors call back into the
 * engine through it.
 */
@FunctionalInterface
interface SequenceRunner {
    SequenceResult run(List<Step> steps, ExecutionContext context);
}
