package work.stepweave.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.error.InvalidInputException;
import work.stepweave.engine.error.WorkflowDefinitionException;
import work.stepweave.engine.error.WorkflowException;
import work.stepweave.engine.expression.JsExpressionEvaluator;
import work.stepweave.engine.loader.WorkflowLoader;
import work.stepweave.engine.loader.WorkflowValidator;
import work.stepweave.engine.provider.GenerativeProvider;
import work.stepweave.engine.provider.ModelRoutingProvider;
import work.stepweave.engine.runtime.ExecutionEngine;
import work.stepweave.engine.validation.ValidatorRegistry;

/**
 * Public entry point for embedding the engine: loads a workflow file, parses the JSON input and runs it.
 */
public final class WorkflowRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Function<EngineConfiguration, GenerativeProvider> providerFactory;
    private final ValidatorRegistry validators;
    private final WorkflowLoader loader = new WorkflowLoader();

    public WorkflowRunner() {
        this(ModelRoutingProvider::new, new ValidatorRegistry());
    }

    public WorkflowRunner(Function<EngineConfiguration, GenerativeProvider> providerFactory, ValidatorRegistry validators) {
        this.providerFactory = providerFactory;
        this.validators = validators;
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        try {
            var workflow = loader.load(configuration.workflowFile());
            var input = parseInput(configuration.inputPayload());
            var engineConfiguration = configuration.engineConfiguration();
            try (var evaluator = new JsExpressionEvaluator()) {
                var engine = new ExecutionEngine(engineConfiguration, evaluator, providerFactory.apply(engineConfiguration), validators);
                return RunResult.fromOutcome(engine.execute(workflow, input), started);
            }
        } catch (WorkflowException ex) {
            log.debug("Run of {} failed before execution", configuration.workflowFile(), ex);
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("workflow_file", configuration.workflowFile().toString());
            return RunResult.failure(ex, metadata, started);
        }
    }

    /**
     * Structural and template problems of a workflow file; empty when it is valid. Never calls the provider.
     */
    public List<String> validate(Path workflowFile) {
        try (var evaluator = new JsExpressionEvaluator()) {
            var workflow = loader.load(workflowFile);
            return new WorkflowValidator(evaluator, validators).validate(workflow);
        } catch (WorkflowDefinitionException ex) {
            return List.of(ex.getMessage());
        }
    }

    private static Map<String, Object> parseInput(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (JsonProcessingException ex) {
            throw new InvalidInputException(null, "Invalid JSON input payload: must be a JSON object (" + ex.getOriginalMessage() + ")");
        }
    }
}
