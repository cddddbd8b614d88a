package work.stepweave.engine.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.TemplateResolutionException;
import work.stepweave.engine.shared.Values;

/**
 * Evaluates {@code {{ ... }}} expressions as JavaScript with GraalVM. Bindings are copied into each evaluation
 * context through {@code JSON.parse}, so expressions see ordinary JS objects and cannot reach host classes.
 * One shared {@link Engine}; a fresh {@link Context} per call, which keeps concurrent collection workers isolated.
 */
public final class JsExpressionEvaluator implements ExpressionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(JsExpressionEvaluator.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final Engine engine;

    public JsExpressionEvaluator() {
        this.engine = Engine.newBuilder()
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .build();
    }

    @Override
    public String render(String template, Map<String, Object> bindings) {
        if (template == null || !Templates.hasPlaceholders(template)) {
            return template;
        }
        try (Context context = newContext(bindings, String.join("\n", Templates.expressions(template)))) {
            Matcher matcher = Templates.PLACEHOLDER.matcher(template);
            var rendered = new StringBuilder();
            while (matcher.find()) {
                var expression = matcher.group(1).trim();
                var value = evaluateIn(context, expression);
                matcher.appendReplacement(rendered, Matcher.quoteReplacement(Values.toText(value)));
            }
            matcher.appendTail(rendered);
            return rendered.toString();
        }
    }

    @Override
    public Object evaluate(String expression, Map<String, Object> bindings) {
        var body = Templates.singlePlaceholder(expression).orElse(expression == null ? "" : expression.trim());
        if (body.isEmpty()) {
            throw new TemplateResolutionException("Empty expression", expression);
        }
        try (Context context = newContext(bindings, body)) {
            return evaluateIn(context, body);
        }
    }

    @Override
    public List<String> check(String template) {
        var problems = new ArrayList<>(Templates.structuralProblems(template));
        var expressions = Templates.expressions(template);
        if (expressions.isEmpty()) {
            return problems;
        }
        try (Context context = Context.newBuilder("js").engine(engine).build()) {
            for (var expression : expressions) {
                if (expression.isBlank()) {
                    continue;
                }
                try {
                    context.parse(Source.create("js", wrap(expression)));
                } catch (PolyglotException ex) {
                    problems.add("invalid expression '" + expression + "': " + ex.getMessage());
                }
            }
        }
        return problems;
    }

    @Override
    public void close() {
        engine.close();
    }

    /**
     * A binding whose name is already a JavaScript global is not installed. Referencing it from {@code source}
     * fails rather than silently reading the global.
     */
    private Context newContext(Map<String, Object> bindings, String source) {
        Context context = Context.newBuilder("js").engine(engine).build();
        try {
            Value global = context.getBindings("js");
            Value parse = context.eval("js", "JSON").getMember("parse");
            if (bindings != null) {
                for (var entry : bindings.entrySet()) {
                    var name = entry.getKey();
                    if (!IDENTIFIER.matcher(name).matches()) {
                        continue;
                    }
                    if (global.hasMember(name)) {
                        if (references(source, name)) {
                            throw new TemplateResolutionException(
                                "Variable '" + name + "' clashes with a JavaScript built-in and cannot be used in expressions", source);
                        }
                        log.debug("Binding '{}' shadows a JavaScript global and is skipped", name);
                        continue;
                    }
                    global.putMember(name, parse.execute(Values.toJson(entry.getValue())));
                }
            }
            return context;
        } catch (RuntimeException ex) {
            context.close();
            throw ex;
        }
    }

    private static boolean references(String source, String name) {
        return source != null
            && Pattern.compile("(?<![\\w$.])" + Pattern.quote(name) + "(?![\\w$])").matcher(source).find();
    }

    private static Object evaluateIn(Context context, String expression) {
        try {
            Value result = context.eval(Source.create("js", wrap(expression)));
            return valueToJava(result);
        } catch (PolyglotException ex) {
            var reason = ex.isSyntaxError() ? "Invalid expression" : "Cannot resolve expression";
            throw new TemplateResolutionException(reason + " '" + expression + "': " + ex.getMessage(), expression, ex);
        }
    }

    private static String wrap(String expression) {
        return "(function() {\nconst __value = (\n" + expression + "\n);\n"
            + "if (__value === undefined) { throw new ReferenceError('expression resolved to undefined'); }\n"
            + "return __value;\n})()";
    }

    private static Object valueToJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(valueToJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.canExecute()) {
            return value.toString();
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, valueToJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }
}
