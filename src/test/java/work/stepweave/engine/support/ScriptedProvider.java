package work.stepweave.engine.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import work.stepweave.engine.provider.FinishReason;
import work.stepweave.engine.provider.GenerativeProvider;
import work.stepweave.engine.provider.ProviderRequest;
import work.stepweave.engine.provider.ProviderResponse;
import work.stepweave.engine.provider.Usage;

/**
 * Fake provider for engine tests: answers from a fixed script or a function and records every request.
 */
public final class ScriptedProvider implements GenerativeProvider {
    private final Function<ProviderRequest, ProviderResponse> responder;
    private final List<ProviderRequest> requests = new CopyOnWriteArrayList<>();

    private ScriptedProvider(Function<ProviderRequest, ProviderResponse> responder) {
        this.responder = responder;
    }

    public static ScriptedProvider answering(Function<ProviderRequest, ProviderResponse> responder) {
        return new ScriptedProvider(responder);
    }

    /**
     * Replies with the given responses in order; the last one repeats once the script is exhausted.
     */
    public static ScriptedProvider replying(ProviderResponse... responses) {
        Deque<ProviderResponse> script = new ArrayDeque<>(List.of(responses));
        return new ScriptedProvider(request -> {
            synchronized (script) {
                return script.size() > 1 ? script.pollFirst() : script.peekFirst();
            }
        });
    }

    public static ScriptedProvider echoing() {
        return answering(request -> text("echo: " + request.prompt()));
    }

    public static ProviderResponse text(String text) {
        return new ProviderResponse(text, FinishReason.STOP, new Usage(10, 5, 0.001));
    }

    public static ProviderResponse truncated(String text) {
        return new ProviderResponse(text, FinishReason.LENGTH, new Usage(10, 5, 0.001));
    }

    @Override
    public ProviderResponse invoke(ProviderRequest request) {
        requests.add(request);
        return responder.apply(request);
    }

    public List<ProviderRequest> requests() {
        return List.copyOf(requests);
    }

    public int calls() {
        return requests.size();
    }
}
