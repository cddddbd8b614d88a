package work.stepweave.engine.provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token and cost accounting for one or more provider calls.
 */
public record Usage(long promptTokens, long completionTokens, double costEstimate) {
    public static final Usage ZERO = new Usage(0, 0, 0d);

    public long totalTokens() {
        return promptTokens + completionTokens;
    }

    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(promptTokens + other.promptTokens, completionTokens + other.completionTokens, costEstimate + other.costEstimate);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("prompt_tokens", promptTokens);
        map.put("completion_tokens", completionTokens);
        map.put("total_tokens", totalTokens());
        map.put("cost_estimate", costEstimate);
        return map;
    }
}
