package work.stepweave.engine.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder scanning shared by evaluators and workflow validation.
 */
public final class Templates {
    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern SINGLE = Pattern.compile("^\\s*\\{\\{(.*?)}}\\s*$", Pattern.DOTALL);
    private static final Pattern STEP_REFERENCE = Pattern.compile(
        "\\bsteps\\s*(?:\\.\\s*([A-Za-z_$][\\w$]*)|\\[\\s*['\"]([^'\"]+)['\"]\\s*])");

    private Templates() {}

    public static boolean hasPlaceholders(String template) {
        return template != null && PLACEHOLDER.matcher(template).find();
    }

    public static Optional<String> singlePlaceholder(String template) {
        if (template == null) {
            return Optional.empty();
        }
        Matcher matcher = SINGLE.matcher(template);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        var inner = matcher.group(1);
        if (inner.contains("{{") || inner.contains("}}")) {
            return Optional.empty();
        }
        return Optional.of(inner.trim());
    }

    public static List<String> expressions(String template) {
        var expressions = new ArrayList<String>();
        if (template == null) {
            return expressions;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            expressions.add(matcher.group(1).trim());
        }
        return expressions;
    }

    /**
     * Step ids referenced as {@code steps.id} or {@code steps['id']} anywhere in the template's expressions.
     */
    public static Set<String> referencedSteps(String template) {
        var ids = new LinkedHashSet<String>();
        for (var expression : expressions(template)) {
            collectStepReferences(expression, ids);
        }
        return ids;
    }

    public static Set<String> referencedStepsInExpression(String expression) {
        var ids = new LinkedHashSet<String>();
        collectStepReferences(expression, ids);
        return ids;
    }

    private static void collectStepReferences(String expression, Set<String> target) {
        if (expression == null) {
            return;
        }
        Matcher matcher = STEP_REFERENCE.matcher(expression);
        while (matcher.find()) {
            target.add(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
        }
    }

    /**
     * Text outside placeholders must not contain an opening delimiter.
     */
    static List<String> structuralProblems(String template) {
        var problems = new ArrayList<String>();
        if (template == null) {
            return problems;
        }
        var outside = PLACEHOLDER.matcher(template).replaceAll("");
        if (outside.contains("{{")) {
            problems.add("unterminated '{{' in template");
        }
        for (var expression : expressions(template)) {
            if (expression.isBlank()) {
                problems.add("empty expression '{{ }}'");
            }
        }
        return problems;
    }
}
