package work.stepweave.engine.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.config.EngineConfiguration;
import work.stepweave.engine.error.ValidationException;
import work.stepweave.engine.error.WorkflowDefinitionException;
import work.stepweave.engine.expression.ExpressionEvaluator;
import work.stepweave.engine.model.GenerativeCallStep;
import work.stepweave.engine.model.ValidationConfig;
import work.stepweave.engine.provider.ChatMessage;
import work.stepweave.engine.provider.FinishReason;
import work.stepweave.engine.provider.GenerativeProvider;
import work.stepweave.engine.provider.ProviderRequest;
import work.stepweave.engine.provider.ProviderResponse;
import work.stepweave.engine.provider.RetryingProvider;
import work.stepweave.engine.provider.Usage;
import work.stepweave.engine.runtime.ExecutionContext.ExecutionCancelledException;
import work.stepweave.engine.shared.DurationParser;
import work.stepweave.engine.validation.OutputValidator;
import work.stepweave.engine.validation.ValidationOutcome;
import work.stepweave.engine.validation.ValidatorRegistry;

/**
 * Runs {@code ai_call} steps: renders the prompt, calls the provider, continues truncated answers and, when a
 * validation block is present, validates and re-asks within the retry budget.
 */
final class GenerativeCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(GenerativeCallExecutor.class);
    static final String CONTINUE_PROMPT = "Please continue writing from where you left off. Keep your continuation brief "
        + "and conclude naturally when you have completed your thought. Do not repeat previous content.";

    private final EngineConfiguration configuration;
    private final ExpressionEvaluator evaluator;
    private final RetryingProvider provider;
    private final ValidatorRegistry validators;

    GenerativeCallExecutor(
        EngineConfiguration configuration,
        ExpressionEvaluator evaluator,
        RetryingProvider provider,
        ValidatorRegistry validators
    ) {
        this.configuration = configuration;
        this.evaluator = evaluator;
        this.provider = provider;
        this.validators = validators;
    }

    Object execute(GenerativeCallStep step, ExecutionContext context) {
        var prompt = evaluator.render(step.prompt(), context.bindings());
        var request = baseRequest(step, prompt);
        var validation = step.validationConfig();
        if (validation.isEmpty()) {
            return complete(request, step, context).text();
        }
        return completeValidated(request, step, validation.get(), context);
    }

    private Object completeValidated(ProviderRequest request, GenerativeCallStep step, ValidationConfig config, ExecutionContext context) {
        OutputValidator validator;
        try {
            validator = new OutputValidator(config, validators);
        } catch (IllegalArgumentException ex) {
            throw new WorkflowDefinitionException("steps." + step.id() + ".validation", ex.getMessage(), ex);
        }
        var firstPrompt = validator.initialPrompt(request.prompt());
        var currentPrompt = firstPrompt;
        int attempts = config.maxRetries() + 1;
        ValidationOutcome outcome = null;
        Completion completion = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            completion = complete(request.withMessages(List.of(ChatMessage.user(currentPrompt))), step, context);
            outcome = validator.validate(completion.text());
            if (outcome.valid()) {
                if (attempt > 1) {
                    log.debug("Step '{}' passed validation on attempt {}", step.id(), attempt);
                }
                return outcome.value();
            }
            log.debug("Step '{}' failed validation on attempt {}/{}: {}", step.id(), attempt, attempts, outcome.errorSummary());
            if (attempt < attempts) {
                currentPrompt = validator.retryPrompt(firstPrompt, outcome);
            }
        }
        if (config.allowPartialSuccess()) {
            log.warn("Step '{}' failed validation after {} attempt(s); returning best-effort output", step.id(), attempts);
            var partial = new LinkedHashMap<String, Object>();
            partial.put("output", validator.bestEffort(completion.text()));
            partial.put("validation_failed", true);
            partial.put("validation_errors", outcome.errors());
            partial.put("raw_output", completion.text());
            partial.put("attempts", attempts);
            return partial;
        }
        throw new ValidationException(
            "Output failed validation after " + attempts + " attempt(s): " + outcome.errorSummary(),
            outcome.errors(), completion.text(), attempts);
    }

    /**
     * One logical completion: the first call plus as many continuation calls as truncation requires and the
     * budget allows. Text is concatenated and usage summed across calls.
     */
    Completion complete(ProviderRequest request, GenerativeCallStep step, ExecutionContext context) {
        int budget = step.maxAutoRetryAttempts() != null ? step.maxAutoRetryAttempts() : configuration.maxAutoRetryAttempts();
        var original = request.prompt();
        var text = new StringBuilder();
        var usage = Usage.ZERO;
        int calls = 0;
        ProviderResponse response;
        var current = request;
        while (true) {
            response = invoke(current, context);
            calls++;
            text.append(response.text());
            usage = usage.plus(response.usage());
            if (response.finishReason() != FinishReason.LENGTH || calls > budget) {
                break;
            }
            log.debug("Step '{}' response truncated, continuation {}/{}", step.id(), calls, budget);
            current = request.withMessages(List.of(
                ChatMessage.user(original),
                ChatMessage.assistant(text.toString()),
                ChatMessage.user(CONTINUE_PROMPT)));
        }
        context.session().usage().record(step.id(), usage, calls);
        switch (response.finishReason()) {
            case LENGTH -> log.warn("Step '{}' still truncated after {} continuation(s); keeping partial text", step.id(), budget);
            case CONTENT_FILTER, OTHER -> log.warn("Step '{}' ended with finish reason {}", step.id(), response.finishReason());
            default -> log.debug("Step '{}' completed in {} provider call(s)", step.id(), calls);
        }
        return new Completion(text.toString(), response.finishReason(), usage, calls);
    }

    /**
     * Calls the provider under a {@code max_parallel_ai_calls} permit. The permit is held per attempt only, so
     * retry backoff does not occupy a slot, and cancellation is checked around every pause.
     */
    private ProviderResponse invoke(ProviderRequest request, ExecutionContext context) {
        context.ensureNotCancelled();
        return provider.invoke(request, (delegate, current) -> attempt(delegate, current, context), context::ensureNotCancelled);
    }

    private static ProviderResponse attempt(GenerativeProvider delegate, ProviderRequest request, ExecutionContext context) {
        var permits = context.session().providerPermits();
        try {
            permits.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted while waiting for a provider slot");
        }
        try {
            context.ensureNotCancelled();
            return delegate.invoke(request);
        } finally {
            permits.release();
        }
    }

    private ProviderRequest baseRequest(GenerativeCallStep step, String prompt) {
        var model = step.model() == null || step.model().isBlank() ? configuration.defaultModel() : step.model();
        Map<String, Object> params = new LinkedHashMap<>(configuration.requestParamsFor(model));
        params.putAll(step.aiParams());
        return new ProviderRequest(
            step.id(),
            List.of(ChatMessage.user(prompt)),
            model,
            step.effectiveTemperature(),
            step.maxTokens(),
            params,
            timeoutFor(step, model));
    }

    private Duration timeoutFor(GenerativeCallStep step, String model) {
        if (step.timeout() != null) {
            return step.timeout();
        }
        var providerTimeout = configuration.settingsFor(model).get("timeout");
        return DurationParser.fromDocument(providerTimeout).orElse(configuration.timeoutPerStep());
    }

    record Completion(String text, FinishReason finishReason, Usage usage, int calls) {}
}
