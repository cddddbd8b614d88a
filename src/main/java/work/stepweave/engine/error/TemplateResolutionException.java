package work.stepweave.engine.error;

import java.util.Map;

/**
 * Raised when a template or expression references a name that is not bound, or cannot be evaluated.
 */
public final class TemplateResolutionException extends WorkflowException {
    private final String expression;

    public TemplateResolutionException(String message, String expression) {
        this(message, expression, null);
    }

    public TemplateResolutionException(String message, String expression, Throwable cause) {
        super(ErrorKind.TEMPLATE_RESOLUTION, message, null, expression == null ? Map.of() : Map.of("expression", expression), cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
