package work.stepweave.engine.expression;

import java.util.List;
import java.util.Map;

/**
 * Template and expression capability consumed by the engine. Templates embed expressions as
 * {@code {{ expression }}}; bindings are plain Java values (maps, lists, strings, numbers, booleans, null).
 * Implementations must throw {@link work.stepweave.engine.error.TemplateResolutionException} when a referenced
 * name is absent instead of producing an empty string.
 */
public interface ExpressionEvaluator extends AutoCloseable {
    String render(String template, Map<String, Object> bindings);

    Object evaluate(String expression, Map<String, Object> bindings);

    /**
     * Syntax-only check used by workflow validation. Returns human readable problems, empty when valid.
     */
    List<String> check(String template);

    /**
     * Resolves a field that may hold structured data: a template made of exactly one placeholder yields the
     * expression value itself, text without placeholders is returned as is, anything else is rendered.
     */
    default Object resolve(String template, Map<String, Object> bindings) {
        if (template == null) {
            return null;
        }
        var single = Templates.singlePlaceholder(template);
        if (single.isPresent()) {
            return evaluate(single.get(), bindings);
        }
        if (!Templates.hasPlaceholders(template)) {
            return template;
        }
        return render(template, bindings);
    }

    @Override
    default void close() {}
}
