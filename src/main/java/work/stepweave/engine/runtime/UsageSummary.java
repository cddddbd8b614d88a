package work.stepweave.engine.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import work.stepweave.engine.provider.Usage;

/**
 * Provider usage of one run, in total and per step id. Safe for concurrent collection workers.
 */
public final class UsageSummary {
    private final Map<String, StepUsage> perStep = new LinkedHashMap<>();
    private Usage total = Usage.ZERO;
    private int calls;

    public synchronized void record(String stepId, Usage usage, int providerCalls) {
        total = total.plus(usage);
        calls += providerCalls;
        perStep.merge(stepId, new StepUsage(providerCalls, usage),
            (left, right) -> new StepUsage(left.calls() + right.calls(), left.usage().plus(right.usage())));
    }

    public synchronized int providerCalls() {
        return calls;
    }

    public synchronized Usage total() {
        return total;
    }

    public synchronized Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("provider_calls", calls);
        map.putAll(total.toMap());
        var steps = new LinkedHashMap<String, Object>();
        perStep.forEach((id, stepUsage) -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("provider_calls", stepUsage.calls());
            entry.putAll(stepUsage.usage().toMap());
            steps.put(id, entry);
        });
        map.put("steps", steps);
        return map;
    }

    private record StepUsage(int calls, Usage usage) {}
}
