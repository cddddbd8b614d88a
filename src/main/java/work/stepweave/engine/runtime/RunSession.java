package work.stepweave.engine.runtime;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import work.stepweave.engine.runtime.ExecutionContext.CancellationToken;

/**
 * State shared by every sequence of a single run and discarded with it.
 */
public final class RunSession {
    private final String workflowName;
    private final Semaphore providerPermits;
    private final UsageSummary usage = new UsageSummary();
    private final CancellationToken cancellationToken;

    public RunSession(String workflowName, int maxParallelProviderCalls, CancellationToken cancellationToken) {
        this.workflowName = Objects.requireNonNull(workflowName, "workflowName");
        this.providerPermits = new Semaphore(Math.max(1, maxParallelProviderCalls), true);
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
    }

    public String workflowName() {
        return workflowName;
    }

    public Semaphore providerPermits() {
        return providerPermits;
    }

    public UsageSummary usage() {
        return usage;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }
}
