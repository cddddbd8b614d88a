package work.stepweave.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.stepweave.engine.support.EngineTestSupport.engine;
import static work.stepweave.engine.support.EngineTestSupport.run;
import static work.stepweave.engine.support.EngineTestSupport.workflow;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.ProviderException;
import work.stepweave.engine.runtime.ExecutionContext.CancellationToken;
import work.stepweave.engine.support.ScriptedProvider;

final class ExecutionEngineTest {
    private static final String THREE_STEPS = """
        name: three-steps
        steps:
          - id: first
            type: ai_call
            prompt: "first"
          - id: second
            type: ai_call
            prompt: "second after {{ steps.first }}"
            on_error: %s
          - id: third
            type: ai_call
            prompt: "third"
        """;

    private static ScriptedProvider failingOn(String prompt) {
        return ScriptedProvider.answering(request -> {
            if (request.prompt().startsWith(prompt)) {
                throw new ProviderException("provider down", false);
            }
            return ScriptedProvider.text("ok " + request.prompt());
        });
    }

    @Test
    void laterStepsSeeEarlierResults() {
        var provider = ScriptedProvider.echoing();

        var outcome = run(THREE_STEPS.formatted("stop"), Map.of(), provider);

        assertTrue(outcome.succeeded());
        assertEquals("second after echo: first", provider.requests().get(1).prompt());
        assertEquals(List.of("first", "second", "third"), List.copyOf(outcome.steps().keySet()));
        assertEquals("echo: third", outcome.output());
    }

    @Test
    void stopFailsTheRunAndKeepsCompletedSteps() {
        var provider = failingOn("second");

        var outcome = run(THREE_STEPS.formatted("stop"), Map.of(), provider);

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.PROVIDER, outcome.error().kind());
        assertEquals("second", outcome.error().stepId());
        assertEquals(List.of("first"), List.copyOf(outcome.steps().keySet()));
        assertEquals(2, provider.calls());
    }

    @Test
    void continueRecordsTheErrorAndRunsTheRest() {
        var provider = failingOn("second");

        var outcome = run(THREE_STEPS.formatted("continue"), Map.of(), provider);

        assertTrue(outcome.succeeded());
        @SuppressWarnings("unchecked")
        var record = (Map<String, Object>) outcome.steps().get("second");
        assertEquals(true, record.get("error"));
        assertEquals("provider_error", record.get("kind"));
        assertEquals("second", record.get("step_id"));
        assertEquals("ok third", outcome.steps().get("third"));
        assertEquals(3, provider.calls());
    }

    @Test
    void skipRemainingEndsTheRunSuccessfully() {
        var provider = failingOn("second");

        var outcome = run(THREE_STEPS.formatted("skip_remaining"), Map.of(), provider);

        assertTrue(outcome.succeeded());
        assertEquals(List.of("third"), outcome.skippedSteps());
        assertFalse(outcome.steps().containsKey("third"));
        assertEquals(2, provider.calls());
    }

    @Test
    void skipRemainingInsideABranchEndsOnlyThatBranch() {
        var yaml = """
            name: nested-skip
            steps:
              - id: route
                type: conditional
                condition: "{{ flag }}"
                if_true:
                  - id: inner_fail
                    type: ai_call
                    prompt: "inner fail"
                    on_error: skip_remaining
                  - id: inner_later
                    type: ai_call
                    prompt: "inner later"
              - id: after
                type: ai_call
                prompt: "after"
            """;
        var provider = failingOn("inner fail");

        var outcome = run(yaml, Map.of("flag", true), provider);

        assertTrue(outcome.succeeded(), () -> String.valueOf(outcome.error()));
        assertEquals(List.of(), outcome.skippedSteps());
        assertEquals("ok after", outcome.steps().get("after"));
        @SuppressWarnings("unchecked")
        var route = (Map<String, Object>) outcome.steps().get("route");
        assertEquals("if_true", route.get("executed_branch"));
        @SuppressWarnings("unchecked")
        var branchOutput = (Map<String, Object>) route.get("output");
        assertEquals(true, branchOutput.get("error"));
        assertEquals("inner_fail", branchOutput.get("step_id"));
        assertEquals(List.of("inner fail", "after"), provider.requests().stream().map(r -> r.prompt()).toList());
    }

    @Test
    void skipRemainingInsideAMapElementEndsOnlyThatElement() {
        var yaml = """
            name: element-skip
            steps:
              - id: mapped
                type: collection
                operation: map
                input: "{{ items }}"
                concurrency:
                  max_parallel: 1
                steps:
                  - id: first
                    type: ai_call
                    prompt: "first {{ item }}"
                    on_error: skip_remaining
                  - id: second
                    type: ai_call
                    prompt: "second {{ item }}"
              - id: after
                type: ai_call
                prompt: "after"
            """;
        var provider = failingOn("first 1");

        var outcome = run(yaml, Map.of("items", List.of(1, 2)), provider);

        assertTrue(outcome.succeeded(), () -> String.valueOf(outcome.error()));
        assertEquals("ok after", outcome.steps().get("after"));
        @SuppressWarnings("unchecked")
        var mapped = (Map<String, Object>) outcome.steps().get("mapped");
        var output = (List<?>) mapped.get("output");
        assertEquals(2, output.size());
        assertEquals(true, ((Map<?, ?>) output.get(0)).get("error"));
        assertEquals("ok second 2", output.get(1));
        var prompts = provider.requests().stream().map(r -> r.prompt()).toList();
        assertFalse(prompts.contains("second 1"), prompts::toString);
        assertTrue(prompts.contains("second 2"), prompts::toString);
    }

    @Test
    void transformOnlyWorkflowsAreDeterministic() {
        var yaml = """
            name: words
            input_parameters:
              - name: text
                type: string
            steps:
              - id: parts
                type: text_process
                method: split
                input: "{{ text }}"
                separator: ","
              - id: sorted
                type: text_process
                method: array_sort
                input: "{{ steps.parts }}"
              - id: joined
                type: text_process
                method: array_aggregate
                input: "{{ steps.sorted }}"
                aggregate_operation: join
                separator: "|"
            output:
              format: json
              template: "{{ {joined: steps.joined, count: steps.parts.length} }}"
            """;
        var input = Map.<String, Object>of("text", "pear,apple,fig");
        var engine = engine(ScriptedProvider.echoing());
        var parsed = workflow(yaml);

        var first = engine.execute(parsed, input);
        var second = engine.execute(parsed, input);

        assertTrue(first.succeeded(), () -> String.valueOf(first.error()));
        assertEquals(Map.of("joined", "apple|fig|pear", "count", 3), first.output());
        assertEquals(first.output(), second.output());
        assertEquals(first.renderedOutput(), second.renderedOutput());
        assertEquals(first.steps(), second.steps());
    }

    @Test
    void missingRequiredInputFailsBeforeAnyStep() {
        var yaml = """
            name: needs-input
            input_parameters:
              - name: topic
                type: string
            steps:
              - id: write
                type: ai_call
                prompt: "{{ topic }}"
            """;
        var provider = ScriptedProvider.echoing();

        var outcome = run(yaml, Map.of(), provider);

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.INVALID_INPUT, outcome.error().kind());
        assertEquals(0, provider.calls());
    }

    @Test
    void unresolvedTemplateNamesFailTheStep() {
        var yaml = """
            name: undefined-name
            steps:
              - id: write
                type: ai_call
                prompt: "about {{ nothing_here }}"
            """;

        var outcome = run(yaml, Map.of(), ScriptedProvider.echoing());

        assertEquals(ErrorKind.TEMPLATE_RESOLUTION, outcome.error().kind());
        assertEquals("write", outcome.error().stepId());
    }

    @Test
    void cancelledRunStopsBeforeTheFirstStep() {
        var token = new CancellationToken();
        token.cancel();
        var provider = ScriptedProvider.echoing();

        var outcome = engine(provider).execute(workflow(THREE_STEPS.formatted("continue")), Map.of(), token);

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.CANCELLED, outcome.error().kind());
        assertEquals(0, provider.calls());
        assertNull(outcome.output());
    }
}
