package work.stepweave.engine.provider;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One provider invocation. The first call of a step carries a single user message; continuation calls
 * replay the prompt and the partial answer before asking for more.
 */
public record ProviderRequest(
    String stepId,
    List<ChatMessage> messages,
    String model,
    Double temperature,
    Integer maxTokens,
    Map<String, Object> params,
    Duration timeout
) {
    public ProviderRequest {
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("at least one message is required");
        }
        messages = List.copyOf(messages);
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Text of the first user turn, i.e. the rendered prompt.
     */
    public String prompt() {
        return messages.get(0).content();
    }

    public boolean isContinuation() {
        return messages.size() > 1;
    }

    public ProviderRequest withMessages(List<ChatMessage> replacement) {
        return new ProviderRequest(stepId, replacement, model, temperature, maxTokens, params, timeout);
    }
}
