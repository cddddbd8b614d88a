package work.stepweave.engine.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.stepweave.engine.error.WorkflowDefinitionException;
import work.stepweave.engine.model.CollectionOperation;
import work.stepweave.engine.model.CollectionStep;
import work.stepweave.engine.model.ConditionalStep;
import work.stepweave.engine.model.GenerativeCallStep;
import work.stepweave.engine.model.ItemErrorPolicy.ConditionFailure;
import work.stepweave.engine.model.ItemErrorPolicy.ItemFailure;
import work.stepweave.engine.model.OnError;
import work.stepweave.engine.model.OutputSpec;
import work.stepweave.engine.model.ParameterType;
import work.stepweave.engine.model.TextTransformStep;
import work.stepweave.engine.model.TransformSpec;

final class WorkflowLoaderTest {
    private final WorkflowLoader loader = new WorkflowLoader();

    @Test
    void parsesWorkflowHeaderAndParameters() {
        var workflow = loader.parse("""
            name: Research Brief
            description: Drafts a brief
            input_parameters:
              - name: topic
                type: string
              - name: depth
                type: integer
                required: false
                default: 2
            steps:
              - id: draft
                type: ai_call
                prompt: "Brief on {{ topic }}"
            output:
              format: yaml
            """, null);

        assertEquals("Research Brief", workflow.name());
        assertEquals("1.0", workflow.version());
        assertEquals(2, workflow.inputParameters().size());
        var depth = workflow.inputParameters().get(1);
        assertEquals(ParameterType.INTEGER, depth.type());
        assertFalse(depth.required());
        assertEquals(2, depth.defaultValue());
        assertTrue(workflow.inputParameters().get(0).required());
        assertEquals(OutputSpec.Format.YAML, workflow.output().format());
    }

    @Test
    void parsesGenerativeCallSettings() {
        var workflow = loader.parse("""
            name: calls
            steps:
              - id: draft
                type: ai_call
                prompt: "hello"
                provider: anthropic
                model: claude-test
                temperature: 0.1
                max_tokens: 500
                timeout: 90s
                max_auto_retry_attempts: 2
                on_error: continue
                ai_params:
                  top_p: 0.9
            """, null);

        var step = assertInstanceOf(GenerativeCallStep.class, workflow.steps().get(0));
        assertEquals("anthropic/claude-test", step.model());
        assertEquals(0.1, step.temperature(), 1e-9);
        assertEquals(500, step.maxTokens());
        assertEquals(Duration.ofSeconds(90), step.timeout());
        assertEquals(2, step.maxAutoRetryAttempts());
        assertEquals(OnError.CONTINUE, step.onError());
        assertEquals(Map.of("top_p", 0.9), step.aiParams());
        assertTrue(step.validationConfig().isEmpty());
    }

    @Test
    void parsesCollectionPipelineWithPolicies() {
        var workflow = loader.parse("""
            name: pipeline
            steps:
              - id: chain
                type: collection
                operation: pipeline
                input: "{{ items }}"
                concurrency:
                  max_parallel: 4
                  batch_size: 10
                  delay_between_batches: 250ms
                error_handling:
                  on_item_failure: retry
                  max_retries_per_item: 1
                  on_retry_exhausted: stop
                  on_condition_error: default_false
                pipeline:
                  - operation: filter
                    condition: "item.ok"
                  - id: totals
                    operation: reduce
                    initial_value: 0
                    accumulator_var: total
                    steps:
                      - id: add
                        type: text_process
                        method: json_parse
                        input: "{{ total + item.value }}"
            """, null);

        var step = assertInstanceOf(CollectionStep.class, workflow.steps().get(0));
        assertEquals(CollectionOperation.PIPELINE, step.operation());
        assertEquals(2, step.stages().size());
        assertEquals("stage_1", step.stages().get(0).id());
        assertEquals("totals", step.stages().get(1).id());
        assertEquals("total", step.stages().get(1).accumulatorVar());
        assertEquals("item", step.stages().get(1).itemVar());
        assertEquals(0, step.stages().get(1).initialValue());
        assertEquals(4, step.concurrency().maxParallel());
        assertEquals(Duration.ofMillis(250), step.concurrency().delayBetweenBatches());
        assertEquals(ItemFailure.RETRY, step.errorHandling().onItemFailure());
        assertEquals(ItemFailure.STOP, step.errorHandling().terminalPolicy());
        assertEquals(2, step.errorHandling().attemptsPerItem());
        assertEquals(ConditionFailure.DEFAULT_FALSE, step.errorHandling().onConditionError());
    }

    @Test
    void parsesConditionalForms() {
        var workflow = loader.parse("""
            name: branches
            steps:
              - id: basic
                type: conditional
                condition: "flag"
                if_true:
                  - id: t
                    type: ai_call
                    prompt: "t"
              - id: multi
                type: conditional
                conditions:
                  - condition: "a > 1"
                    steps: []
                  - name: other
                    default: true
                    steps: []
            """, null);

        var basic = assertInstanceOf(ConditionalStep.class, workflow.steps().get(0));
        assertTrue(basic.basicForm());
        assertEquals(1, basic.branches().size());
        assertTrue(basic.defaultBranch().isEmpty());
        var multi = assertInstanceOf(ConditionalStep.class, workflow.steps().get(1));
        assertEquals("condition_1", multi.branches().get(0).name());
        assertEquals("other", multi.defaultBranch().orElseThrow().name());
    }

    @Test
    void parsesRegexExtractWithPythonNamedGroupsAndFlags() {
        var workflow = loader.parse("""
            name: regex
            steps:
              - id: find
                type: text_process
                method: regex_extract
                input: "{{ text }}"
                pattern: "(?P<key>[a-z]+)=(?P<value>\\\\d+)"
                flags: IGNORECASE|MULTILINE
                output_format: array
            """, null);

        var step = assertInstanceOf(TextTransformStep.class, workflow.steps().get(0));
        var regex = assertInstanceOf(TransformSpec.RegexExtract.class, step.transform());
        assertEquals(List.of("key", "value"), regex.namedGroups());
        assertTrue(regex.asArray());
        assertEquals("(?<key>[a-z]+)=(?<value>\\d+)", regex.pattern().pattern());
        assertTrue((regex.pattern().flags() & Pattern.CASE_INSENSITIVE) != 0);
        assertTrue((regex.pattern().flags() & Pattern.MULTILINE) != 0);
    }

    @Test
    void parsesArrayTransformExpression() {
        var workflow = loader.parse("""
            name: mapping
            steps:
              - id: names
                type: text_process
                method: array_transform
                input: "{{ people }}"
                transform_expression: "item.name"
            """, null);

        var step = assertInstanceOf(TextTransformStep.class, workflow.steps().get(0));
        var mapping = assertInstanceOf(TransformSpec.ArrayTransform.class, step.transform());
        assertEquals("item.name", mapping.transformExpression());
    }

    @Test
    void readsSchemaFilesRelativeToTheWorkflow(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("person.json"), "{\"type\": \"object\", \"required\": [\"name\"]}");
        var file = dir.resolve("flow.yaml");
        Files.writeString(file, """
            name: schema-file
            steps:
              - id: person
                type: ai_call
                prompt: "Describe someone"
                validation:
                  schema_file: person.json
                  max_retries: 2
            """);

        var workflow = loader.load(file);

        var step = assertInstanceOf(GenerativeCallStep.class, workflow.steps().get(0));
        var validation = step.validationConfig().orElseThrow();
        assertEquals(List.of("name"), validation.schema().get("required"));
        assertEquals(2, validation.maxRetries());
        assertNull(validation.customValidator());
    }

    @Test
    void errorsNameTheOffendingPath() {
        var error = assertThrows(WorkflowDefinitionException.class, () -> loader.parse("""
            name: bad
            steps:
              - id: ok
                type: ai_call
                prompt: "x"
              - id: fan
                type: collection
                operation: map
                input: "{{ items }}"
                concurrency:
                  max_parallel: 0
                steps:
                  - id: inner
                    type: ai_call
                    prompt: "y"
            """, null));

        assertEquals("steps[1].concurrency.max_parallel", error.path());
        assertTrue(error.getMessage().contains("must be >= 1"), error.getMessage());
    }

    @Test
    void rejectsStructuralMistakes() {
        assertDefinitionError("steps[0].type", """
            name: bad
            steps:
              - id: a
                type: teleport
            """);
        assertDefinitionError("steps[1].id", """
            name: bad
            steps:
              - id: a
                type: ai_call
                prompt: "x"
              - id: a
                type: ai_call
                prompt: "y"
            """);
        assertDefinitionError("name", """
            name: 9lives
            steps:
              - id: a
                type: ai_call
                prompt: "x"
            """);
        assertDefinitionError("steps", """
            name: empty
            steps: []
            """);
        assertDefinitionError("steps[0].steps", """
            name: bad
            steps:
              - id: m
                type: collection
                operation: map
                input: "{{ items }}"
            """);
        assertDefinitionError("steps[0].pattern", """
            name: bad
            steps:
              - id: r
                type: text_process
                method: regex_extract
                input: "x"
                pattern: "([a-z"
            """);
        assertDefinitionError("steps[0].validation", """
            name: bad
            steps:
              - id: v
                type: ai_call
                prompt: "x"
                validation:
                  max_retries: 1
            """);
        assertDefinitionError("steps[0].validation.max_retries", """
            name: bad
            steps:
              - id: v
                type: ai_call
                prompt: "x"
                validation:
                  custom_validator: json
                  max_retries: 11
            """);
    }

    @Test
    void rejectsMalformedYaml() {
        var error = assertThrows(WorkflowDefinitionException.class, () -> loader.parse("name: [unclosed", null));

        assertTrue(error.getMessage().startsWith("Invalid YAML/JSON syntax"), error.getMessage());
    }

    private void assertDefinitionError(String expectedPath, String yaml) {
        var error = assertThrows(WorkflowDefinitionException.class, () -> loader.parse(yaml, null));
        assertEquals(expectedPath, error.path(), error.getMessage());
    }
}
