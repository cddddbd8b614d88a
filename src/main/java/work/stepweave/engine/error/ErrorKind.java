package work.stepweave.engine.error;

/**
 * Stable error categories surfaced in run results and CLI output.
 */
public enum ErrorKind {
    TEMPLATE_RESOLUTION("template_resolution_error"),
    PROVIDER("provider_error"),
    VALIDATION("validation_error"),
    TRANSFORM("transform_error"),
    CONDITION_EVALUATION("condition_evaluation_error"),
    ITEM_PROCESSING("item_processing_error"),
    WORKFLOW_DEFINITION("workflow_definition_error"),
    INVALID_INPUT("invalid_input_error"),
    CONFIGURATION("configuration_error"),
    CANCELLED("cancelled"),
    INTERNAL("internal_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
