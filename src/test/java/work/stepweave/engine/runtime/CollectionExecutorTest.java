package work.stepweave.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.stepweave.engine.support.EngineTestSupport.run;
import static work.stepweave.engine.support.EngineTestSupport.stepResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.ItemProcessingException;
import work.stepweave.engine.error.ProviderException;
import work.stepweave.engine.support.ScriptedProvider;

final class CollectionExecutorTest {
    private static final String MAP_WORKFLOW = """
        name: map-test
        steps:
          - id: mapped
            type: collection
            operation: map
            input: "{{ items }}"
            concurrency:
              max_parallel: %d
            error_handling:
              on_item_failure: %s
            steps:
              - id: call
                type: ai_call
                prompt: "item {{ item }}"
        """;

    @Test
    void mapKeepsInputOrderRegardlessOfCompletionOrder() {
        var provider = ScriptedProvider.answering(request -> {
            int n = Integer.parseInt(request.prompt().substring("item ".length()));
            sleep((8 - n) * 15L);
            return ScriptedProvider.text("R" + n);
        });

        var outcome = run(MAP_WORKFLOW.formatted(4, "skip"), Map.of("items", List.of(0, 1, 2, 3, 4, 5, 6, 7)), provider);

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "mapped");
        assertEquals(List.of("R0", "R1", "R2", "R3", "R4", "R5", "R6", "R7"), result.get("output"));
        assertEquals(8, result.get("input_count"));
        assertEquals(8, result.get("output_count"));
        assertEquals("map", result.get("operation"));
        assertEquals(8, provider.calls());
    }

    @Test
    void mapRunsElementsConcurrentlyUpToMaxParallel() {
        var active = new AtomicInteger();
        var peak = new AtomicInteger();
        var provider = ScriptedProvider.answering(request -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            sleep(60);
            active.decrementAndGet();
            return ScriptedProvider.text("ok");
        });

        var outcome = run(MAP_WORKFLOW.formatted(3, "skip"), Map.of("items", List.of(1, 2, 3, 4, 5, 6)), provider);

        assertTrue(outcome.succeeded());
        assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
        assertTrue(peak.get() >= 2, "elements never overlapped");
    }

    @Test
    void skipPolicyOmitsFailedElementsAndRecordsErrors() {
        var provider = ScriptedProvider.answering(request -> {
            if (request.prompt().equals("item 2")) {
                throw new ProviderException("bad element", false);
            }
            return ScriptedProvider.text(request.prompt().toUpperCase());
        });

        var outcome = run(MAP_WORKFLOW.formatted(2, "skip"), Map.of("items", List.of(1, 2, 3, 4)), provider);

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "mapped");
        assertEquals(List.of("ITEM 1", "ITEM 3", "ITEM 4"), result.get("output"));
        @SuppressWarnings("unchecked")
        var errors = (List<Map<String, Object>>) result.get("errors");
        assertEquals(1, errors.size());
        assertEquals(1, errors.get(0).get("index"));
        assertEquals(ErrorKind.PROVIDER.code(), errors.get(0).get("kind"));
        @SuppressWarnings("unchecked")
        var stats = (Map<String, Object>) result.get("processing_stats");
        assertEquals(3, stats.get("succeeded"));
        assertEquals(1, stats.get("failed"));
        assertEquals(0.25, (Double) stats.get("error_rate"), 1e-9);
    }

    @Test
    void stopPolicyKeepsLaterElementsFromStarting() {
        var provider = ScriptedProvider.answering(request -> {
            if (request.prompt().equals("item 3")) {
                throw new ProviderException("element 3 exploded", false);
            }
            return ScriptedProvider.text("ok");
        });
        var items = new ArrayList<Object>();
        for (int i = 0; i < 10; i++) {
            items.add(i);
        }

        var outcome = run(MAP_WORKFLOW.formatted(1, "stop"), Map.of("items", items), provider);

        assertFalse(outcome.succeeded());
        assertTrue(outcome.error() instanceof ItemProcessingException);
        var error = (ItemProcessingException) outcome.error();
        assertEquals(3, error.index());
        assertEquals("mapped", error.stepId());
        assertEquals(1, error.itemErrors().size());
        assertEquals(4, provider.calls());
        var prompts = provider.requests().stream().map(request -> request.prompt()).toList();
        assertEquals(List.of("item 0", "item 1", "item 2", "item 3"), prompts);
    }

    @Test
    void retryPolicyReattemptsFailedElements() {
        var attempts = new ConcurrentHashMap<String, AtomicInteger>();
        var provider = ScriptedProvider.answering(request -> {
            int attempt = attempts.computeIfAbsent(request.prompt(), key -> new AtomicInteger()).incrementAndGet();
            if (request.prompt().equals("item b") && attempt == 1) {
                throw new ProviderException("flaky", false);
            }
            return ScriptedProvider.text(request.prompt());
        });

        var outcome = run(MAP_WORKFLOW.formatted(2, "retry"), Map.of("items", List.of("a", "b", "c")), provider);

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "mapped");
        assertEquals(List.of("item a", "item b", "item c"), result.get("output"));
        @SuppressWarnings("unchecked")
        var stats = (Map<String, Object>) result.get("processing_stats");
        assertEquals(1, stats.get("retried"));
        assertEquals(0, stats.get("failed"));
    }

    @Test
    void retryExhaustionFallsBackToSkip() {
        var provider = ScriptedProvider.answering(request -> {
            if (request.prompt().equals("item b")) {
                throw new ProviderException("always failing", false);
            }
            return ScriptedProvider.text(request.prompt());
        });

        var outcome = run(MAP_WORKFLOW.formatted(2, "retry"), Map.of("items", List.of("a", "b")), provider);

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "mapped");
        assertEquals(List.of("item a"), result.get("output"));
        @SuppressWarnings("unchecked")
        var errors = (List<Map<String, Object>>) result.get("errors");
        assertEquals(3, errors.get(0).get("attempts"));
        assertEquals(4, provider.calls());
    }

    @Test
    void reduceOverEmptyInputReturnsInitialValueWithoutRunningSteps() {
        var provider = ScriptedProvider.echoing();
        var yaml = """
            name: reduce-empty
            steps:
              - id: total
                type: collection
                operation: reduce
                input: "{{ items }}"
                initial_value: 42
                steps:
                  - id: add
                    type: ai_call
                    prompt: "{{ acc }} + {{ item }}"
            """;

        var outcome = run(yaml, Map.of("items", List.of()), provider);

        assertTrue(outcome.succeeded());
        assertEquals(42, stepResult(outcome, "total").get("output"));
        assertEquals(0, provider.calls());
    }

    @Test
    void reduceThreadsTheAccumulatorInOrder() {
        var yaml = """
            name: reduce-sum
            steps:
              - id: total
                type: collection
                operation: reduce
                input: "{{ items }}"
                initial_value: ""
                accumulator_var: text
                item_var: word
                steps:
                  - id: append
                    type: text_process
                    method: format
                    input: "{{ word }}"
                    template: "{{ text }}{{ input }}"
            """;

        var outcome = run(yaml, Map.of("items", List.of("a", "b", "c")), ScriptedProvider.echoing());

        assertTrue(outcome.succeeded());
        assertEquals("abc", stepResult(outcome, "total").get("output"));
        assertEquals(1, stepResult(outcome, "total").get("output_count"));
    }

    @Test
    void filterWithDefaultFalseExcludesElementsWhosePredicateThrows() {
        var outcome = run(filterWorkflow("default_false"), Map.of("items", filterItems()), ScriptedProvider.echoing());

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "kept");
        assertEquals(List.of(Map.of("nested", Map.of("value", 5))), result.get("output"));
        assertEquals(List.of(), result.get("errors"));
    }

    @Test
    void filterWithSkipItemRecordsPredicateFailures() {
        var outcome = run(filterWorkflow("skip_item"), Map.of("items", filterItems()), ScriptedProvider.echoing());

        assertTrue(outcome.succeeded());
        @SuppressWarnings("unchecked")
        var errors = (List<Map<String, Object>>) stepResult(outcome, "kept").get("errors");
        assertEquals(1, errors.size());
        assertEquals(1, errors.get(0).get("index"));
    }

    @Test
    void filterWithStopFailsWithConditionError() {
        var outcome = run(filterWorkflow("stop"), Map.of("items", filterItems()), ScriptedProvider.echoing());

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.CONDITION_EVALUATION, outcome.error().kind());
        assertEquals("kept", outcome.error().stepId());
    }

    @Test
    void filterWithoutConditionUsesTheNestedResult() {
        var yaml = """
            name: filter-steps
            steps:
              - id: kept
                type: collection
                operation: filter
                input: "{{ words }}"
                steps:
                  - id: long_enough
                    type: text_process
                    method: format
                    input: "{{ item }}"
                    template: "{{ input.length > 3 }}"
            """;

        var outcome = run(yaml, Map.of("words", List.of("ab", "abcd", "xyz", "hello")), ScriptedProvider.echoing());

        assertEquals(List.of("abcd", "hello"), stepResult(outcome, "kept").get("output"));
    }

    @Test
    void pipelineFeedsEachStageIntoTheNext() {
        var yaml = """
            name: pipeline-test
            steps:
              - id: chained
                type: collection
                operation: pipeline
                input: "{{ numbers }}"
                pipeline:
                  - operation: map
                    steps:
                      - id: doubled
                        type: text_process
                        method: json_parse
                        input: "{{ item * 2 }}"
                  - operation: filter
                    condition: "item > 4"
                  - operation: reduce
                    initial_value: 0
                    steps:
                      - id: sum
                        type: text_process
                        method: json_parse
                        input: "{{ acc + item }}"
            """;

        var outcome = run(yaml, Map.of("numbers", List.of(1, 2, 3, 4)), ScriptedProvider.echoing());

        assertTrue(outcome.succeeded());
        var result = stepResult(outcome, "chained");
        assertEquals(14, result.get("output"));
        assertEquals("pipeline", result.get("operation"));
    }

    @Test
    void nonArrayInputFailsTheStep() {
        var outcome = run(MAP_WORKFLOW.formatted(2, "skip"), Map.of("items", "not a list"), ScriptedProvider.echoing());

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.ITEM_PROCESSING, outcome.error().kind());
    }

    @Test
    void reduceStopFailureIsHandledByTheStepOnErrorPolicy() {
        var yaml = """
            name: reduce-stop
            steps:
              - id: total
                type: collection
                operation: reduce
                input: "{{ items }}"
                initial_value: ""
                on_error: continue
                error_handling:
                  on_item_failure: stop
                steps:
                  - id: add
                    type: ai_call
                    prompt: "{{ item }}"
              - id: after
                type: ai_call
                prompt: "after"
            """;

        var outcome = run(yaml, Map.of("items", List.of("a", "boom", "c")), failingOn("boom"));

        assertTrue(outcome.succeeded(), () -> String.valueOf(outcome.error()));
        assertEquals("ok after", outcome.steps().get("after"));
        var total = stepResult(outcome, "total");
        assertEquals(true, total.get("error"));
        assertEquals("item_processing_error", total.get("kind"));
    }

    @Test
    void reduceStopInsideMapElementLeavesSiblingElementsRunning() {
        var yaml = """
            name: nested-reduce-stop
            steps:
              - id: groups
                type: collection
                operation: map
                input: "{{ items }}"
                concurrency:
                  max_parallel: 1
                steps:
                  - id: joined
                    type: collection
                    operation: reduce
                    input: "{{ item }}"
                    initial_value: ""
                    on_error: continue
                    error_handling:
                      on_item_failure: stop
                    steps:
                      - id: add
                        type: ai_call
                        prompt: "{{ item }}"
                  - id: tail
                    type: ai_call
                    prompt: "tail"
            """;
        var items = List.<Object>of(List.of("a", "boom"), List.of("c"));

        var outcome = run(yaml, Map.of("items", items), failingOn("boom"));

        assertTrue(outcome.succeeded(), () -> String.valueOf(outcome.error()));
        var result = stepResult(outcome, "groups");
        assertEquals(List.of("ok tail", "ok tail"), result.get("output"));
        assertEquals(List.of(), result.get("errors"));
    }

    private static ScriptedProvider failingOn(String prompt) {
        return ScriptedProvider.answering(request -> {
            if (request.prompt().equals(prompt)) {
                throw new ProviderException("provider rejected " + prompt, false);
            }
            return ScriptedProvider.text("ok " + request.prompt());
        });
    }

    private static String filterWorkflow(String onConditionError) {
        return """
            name: filter-test
            steps:
              - id: kept
                type: collection
                operation: filter
                input: "{{ items }}"
                condition: "item.nested.value > 1"
                error_handling:
                  on_condition_error: %s
            """.formatted(onConditionError);
    }

    private static List<Object> filterItems() {
        return List.of(Map.of("nested", Map.of("value", 0)), Map.of(), Map.of("nested", Map.of("value", 5)));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
