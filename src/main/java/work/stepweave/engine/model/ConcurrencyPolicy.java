package work.stepweave.engine.model;

import java.time.Duration;

/**
 * Worker-pool shape of a map or filter. A {@code null} max parallelism falls back to the engine configuration;
 * a {@code null} batch size runs every element in one batch.
 */
public record ConcurrencyPolicy(Integer maxParallel, Integer batchSize, Duration delayBetweenBatches) {
    public static final ConcurrencyPolicy DEFAULT = new ConcurrencyPolicy(null, null, Duration.ZERO);

    public ConcurrencyPolicy {
        if (maxParallel != null && maxParallel < 1) {
            throw new IllegalArgumentException("max_parallel must be >= 1");
        }
        if (batchSize != null && batchSize < 1) {
            throw new IllegalArgumentException("batch_size must be >= 1");
        }
        delayBetweenBatches = delayBetweenBatches == null ? Duration.ZERO : delayBetweenBatches;
    }

    public int effectiveMaxParallel(int fallback) {
        return maxParallel == null ? Math.max(1, fallback) : maxParallel;
    }

    public int effectiveBatchSize(int inputSize) {
        return batchSize == null ? Math.max(1, inputSize) : batchSize;
    }
}
