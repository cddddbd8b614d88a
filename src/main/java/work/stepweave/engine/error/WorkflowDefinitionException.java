package work.stepweave.engine.error;

import java.util.Map;

/**
 * Structural problem found while loading a workflow document.
 */
public final class WorkflowDefinitionException extends WorkflowException {
    private final String path;

    public WorkflowDefinitionException(String path, String message) {
        this(path, message, null);
    }

    public WorkflowDefinitionException(String path, String message, Throwable cause) {
        super(ErrorKind.WORKFLOW_DEFINITION, path == null ? message : path + ": " + message, null,
            path == null ? Map.of() : Map.of("path", path), cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
