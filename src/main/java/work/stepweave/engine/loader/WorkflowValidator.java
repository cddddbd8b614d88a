package work.stepweave.engine.loader;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.expression.Templates;
import work.stepweave.engine.model.CollectionOperation;
import work.stepweave.engine.model.CollectionStep;
import work.stepweave.engine.model.ConditionalStep;
import work.stepweave.engine.model.GenerativeCallStep;
import work.stepweave.engine.model.Step;
import work.stepweave.engine.model.TextTransformStep;
import work.stepweave.engine.model.TransformSpec;
import work.stepweave.engine.model.ValidationConfig;
import work.stepweave.engine.model.Workflow;
import work.stepweave.engine.validation.JsonSchemaCheck;
import work.stepweave.engine.validation.ValidatorRegistry;

/**
 * Checks a loaded workflow without running it: template syntax, references to steps that have not run yet,
 * validator names and schemas. Returns every problem found rather than stopping at the first.
 */
public final class WorkflowValidator {
    private final ExpressionEvaluator evaluator;
    private final ValidatorRegistry validators;

    public WorkflowValidator(ExpressionEvaluator evaluator, ValidatorRegistry validators) {
        this.evaluator = evaluator;
        this.validators = validators;
    }

    public List<String> validate(Workflow workflow) {
        var problems = new ArrayList<String>();
        var visible = sequence(workflow.steps(), "steps", Set.of(), problems);
        if (workflow.output().hasTemplate()) {
            template("output.template", workflow.output().template(), visible, problems);
        }
        return problems;
    }

    /**
     * Returns the ids visible after the sequence: the enclosing ones plus every step of this sequence.
     */
    private Set<String> sequence(List<Step> steps, String path, Set<String> enclosing, List<String> problems) {
        var visible = new LinkedHashSet<>(enclosing);
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            step(step, path + "[" + i + "]", visible, problems);
            visible.add(step.id());
        }
        return visible;
    }

    private void step(Step step, String path, Set<String> visible, List<String> problems) {
        if (step instanceof GenerativeCallStep call) {
            template(path + ".prompt", call.prompt(), visible, problems);
            call.validationConfig().ifPresent(config -> validation(path + ".validation", config, problems));
        } else if (step instanceof TextTransformStep transform) {
            template(path + ".input", transform.input(), visible, problems);
            transform(path, transform.transform(), visible, problems);
        } else if (step instanceof CollectionStep collection) {
            template(path + ".input", collection.input(), visible, problems);
            for (int s = 0; s < collection.stages().size(); s++) {
                var stage = collection.stages().get(s);
                var stagePath = collection.stages().size() == 1 && collection.operation() != CollectionOperation.PIPELINE
                    ? path
                    : path + ".pipeline[" + s + "]";
                if (stage.hasCondition()) {
                    expression(stagePath + ".condition", stage.condition(), visible, problems);
                }
                sequence(stage.steps(), stagePath + ".steps", visible, problems);
            }
        } else if (step instanceof ConditionalStep conditional) {
            for (int b = 0; b < conditional.branches().size(); b++) {
                var branch = conditional.branches().get(b);
                var branchPath = conditional.basicForm() ? path + "." + branch.name() : path + ".conditions[" + b + "]";
                if (!branch.isDefault()) {
                    expression((conditional.basicForm() ? path : branchPath) + ".condition", branch.condition(), visible, problems);
                }
                sequence(branch.steps(), conditional.basicForm() ? branchPath : branchPath + ".steps", visible, problems);
            }
        }
    }

    private void transform(String path, TransformSpec spec, Set<String> visible, List<String> problems) {
        if (spec instanceof TransformSpec.Format format) {
            template(path + ".template", format.template(), visible, problems);
        } else if (spec instanceof TransformSpec.SelectItem select && select.condition() != null) {
            expression(path + ".condition", select.condition(), visible, problems);
        } else if (spec instanceof TransformSpec.ArrayFilter filter) {
            expression(path + ".condition", filter.condition(), visible, problems);
        } else if (spec instanceof TransformSpec.ArrayTransform mapping && !mapping.isIdentity()) {
            expression(path + ".transform_expression", mapping.transformExpression(), visible, problems);
        } else if (spec instanceof TransformSpec.ParseAsJson parse && parse.schema() != null) {
            schema(path + ".schema", parse.schema(), problems);
        }
    }

    private void validation(String path, ValidationConfig config, List<String> problems) {
        if (config.hasSchema()) {
            schema(path + ".schema", config.schema(), problems);
        }
        if (config.hasCustomValidator() && !validators.contains(config.customValidator())) {
            problems.add(path + ".custom_validator: unknown validator '" + config.customValidator()
                + "' (available: " + String.join(", ", validators.names()) + ")");
        }
    }

    private static void schema(String path, Map<String, Object> schema, List<String> problems) {
        try {
            new JsonSchemaCheck(schema);
        } catch (IllegalArgumentException ex) {
            problems.add(path + ": " + ex.getMessage());
        }
    }

    private void expression(String path, String expression, Set<String> visible, List<String> problems) {
        var template = Templates.hasPlaceholders(expression) ? expression : "{{ " + expression + " }}";
        template(path, template, visible, problems);
    }

    private void template(String path, String template, Set<String> visible, List<String> problems) {
        if (template == null) {
            return;
        }
        for (var problem : evaluator.check(template)) {
            problems.add(path + ": " + problem);
        }
        for (var reference : Templates.referencedSteps(template)) {
            if (!visible.contains(reference)) {
                problems.add(path + ": references step '" + reference + "' which has not run at this point");
            }
        }
    }
}
