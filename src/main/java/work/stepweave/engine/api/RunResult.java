package work.stepweave.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.runtime.ExecutionOutcome;

/**
 * Outcome of a {@link WorkflowRunner} execution (usable by the CLI and embedding apps).
 */
public record RunResult(Status status, String output, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static RunResult fromOutcome(ExecutionOutcome outcome, Instant startedAt) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("workflow", outcome.workflowName());
        metadata.put("steps", outcome.steps());
        if (!outcome.skippedSteps().isEmpty()) {
            metadata.put("skipped_steps", outcome.skippedSteps());
        }
        metadata.put("usage", outcome.usage());
        metadata.put("elapsed_ms", outcome.elapsed().toMillis());
        if (!outcome.succeeded()) {
            metadata.put("error", describe(outcome.error()));
            return new RunResult(Status.FAILURE, null, metadata, startedAt, Instant.now());
        }
        return new RunResult(Status.SUCCESS, outcome.renderedOutput(), metadata, startedAt, Instant.now());
    }

    static RunResult failure(WorkflowException error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("error", describe(error));
        return new RunResult(Status.FAILURE, null, meta, startedAt, Instant.now());
    }

    @SuppressWarnings("unchecked")
    public String errorMessage() {
        if (metadata.get("error") instanceof Map<?, ?> error) {
            return String.valueOf(((Map<String, Object>) error).get("message"));
        }
        return null;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("output", output);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static Map<String, Object> describe(WorkflowException error) {
        var description = new LinkedHashMap<String, Object>();
        description.put("kind", error.kind().code());
        description.put("stepId", error.stepId());
        description.put("message", error.getMessage());
        if (!error.details().isEmpty()) {
            description.put("details", error.details());
        }
        return description;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
