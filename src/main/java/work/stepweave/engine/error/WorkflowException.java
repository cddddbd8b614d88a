package work.stepweave.engine.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every engine failure. Carries the error kind, the originating step id and structured details.
 */
public class WorkflowException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;
    private volatile String stepId;

    public WorkflowException(ErrorKind kind, String message) {
        this(kind, message, null, Map.of(), null);
    }

    public WorkflowException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, Map.of(), cause);
    }

    public WorkflowException(ErrorKind kind, String message, String stepId, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
        this.stepId = stepId;
        this.details = details == null ? Map.of() : new LinkedHashMap<>(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String stepId() {
        return stepId;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Records the step that raised this error. The innermost step wins: once set, the id is kept.
     */
    public WorkflowException attachStep(String id) {
        if (this.stepId == null && id != null) {
            this.stepId = id;
        }
        return this;
    }

    public Map<String, Object> toErrorRecord() {
        var record = new LinkedHashMap<String, Object>();
        record.put("error", true);
        record.put("kind", kind.code());
        record.put("message", getMessage());
        if (stepId != null) {
            record.put("step_id", stepId);
        }
        if (!details.isEmpty()) {
            record.put("details", details);
        }
        return record;
    }

    public static WorkflowException wrap(Throwable error) {
        if (error instanceof WorkflowException workflowError) {
            return workflowError;
        }
        var message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new WorkflowException(ErrorKind.INTERNAL, message, error);
    }
}
