package work.stepweave.engine.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.ProviderException;

/**
 * Calls an OpenAI-compatible {@code POST /v1/chat/completions} endpoint (OpenAI, LiteLLM, vLLM, Ollama...).
 */
public final class OpenAiCompatibleProvider implements GenerativeProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;

    public OpenAiCompatibleProvider(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    OpenAiCompatibleProvider(String baseUrl, String apiKey, HttpClient httpClient) {
        var base = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        this.httpClient = httpClient;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public ProviderResponse invoke(ProviderRequest request) {
        String body;
        try {
            body = MAPPER.writeValueAsString(requestBody(request));
        } catch (IOException ex) {
            throw new ProviderException("Cannot encode provider request: " + ex.getMessage(), false, -1, ex);
        }
        var builder = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/chat/completions"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (request.timeout() != null && !request.timeout().isZero()) {
            builder.timeout(request.timeout());
        }
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        log.debug("POST {}/v1/chat/completions model={} messages={}", baseUrl, request.model(), request.messages().size());
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            throw new ProviderException("Provider call timed out after " + request.timeout(), true, -1, ex);
        } catch (IOException ex) {
            throw new ProviderException("Provider call failed: " + ex.getMessage(), true, -1, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Provider call interrupted", false, -1, ex);
        }

        int status = response.statusCode();
        if (status != 200) {
            boolean retryable = status == 429 || status >= 500;
            throw new ProviderException("Provider returned HTTP " + status + ": " + abbreviate(response.body()), retryable, status, null);
        }
        return parseResponse(response.body());
    }

    Map<String, Object> requestBody(ProviderRequest request) {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model());
        List<Map<String, Object>> messages = new ArrayList<>();
        for (var message : request.messages()) {
            messages.add(message.toMap());
        }
        body.put("messages", messages);
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        request.params().forEach(body::putIfAbsent);
        return body;
    }

    static ProviderResponse parseResponse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ProviderException("Provider returned malformed JSON: " + ex.getOriginalMessage(), false, 200, ex);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException("Provider response has no choices", false, 200, null);
        }
        JsonNode choice = choices.get(0);
        String text = choice.path("message").path("content").asText("");
        String finish = choice.path("finish_reason").isNull() ? null : choice.path("finish_reason").asText(null);
        JsonNode usageNode = root.path("usage");
        var usage = new Usage(
            usageNode.path("prompt_tokens").asLong(0),
            usageNode.path("completion_tokens").asLong(0),
            usageNode.path("cost").asDouble(0d));
        return new ProviderResponse(text, FinishReason.from(finish), usage);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
