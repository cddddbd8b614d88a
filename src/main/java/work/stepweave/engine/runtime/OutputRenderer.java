package work.stepweave.engine.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.List;
import java.util.Map;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.OutputSpec;
import work.stepweave.engine.shared.Values;
import work.stepweave.engine.validation.JsonDocuments;

/**
 * Produces the workflow output: the {@code output.template} when declared, else the last top-level result,
 * then formatted as text, JSON or YAML.
 */
public final class OutputRenderer {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private final ExpressionEvaluator evaluator;

    public OutputRenderer(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Object resolve(OutputSpec spec, ExecutionContext context, Object lastResult) {
        if (!spec.hasTemplate()) {
            return lastResult;
        }
        return evaluator.resolve(spec.template(), context.bindings());
    }

    /**
     * Text prints strings raw and structures as JSON. JSON re-indents a string that already holds a JSON
     * document and quotes any other string.
     */
    public static String format(Object value, OutputSpec.Format format) {
        return switch (format) {
            case TEXT -> value instanceof Map<?, ?> || value instanceof List<?> ? Values.toPrettyJson(value) : Values.toText(value);
            case JSON -> Values.toPrettyJson(structured(value));
            case YAML -> toYaml(structured(value));
        };
    }

    private static Object structured(Object value) {
        if (value instanceof String text) {
            try {
                return JsonDocuments.parse(text);
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                return text;
            }
        }
        return value;
    }

    private static String toYaml(Object value) {
        try {
            return YAML.writeValueAsString(value).stripTrailing();
        } catch (JsonProcessingException ex) {
            throw new WorkflowException(ErrorKind.INTERNAL, "Unable to format output as YAML: " + ex.getOriginalMessage(), ex);
        }
    }
}
