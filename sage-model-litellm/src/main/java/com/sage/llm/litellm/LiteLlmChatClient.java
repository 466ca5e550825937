package com.sage.llm.litellm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.llm.ChatModelClient;
import com.sage.model.ChatMessage;
import com.sage.model.error.ModelException;
import com.sage.model.error.ModelOverloadedException;
import com.sage.model.error.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Cloud-tier chat client for an OpenAI-compatible endpoint (LiteLLM proxy by default).
 * Uses POST /v1/chat/completions; streaming reads server-sent events until {@code data: [DONE]}.
 */
public final class LiteLlmChatClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(LiteLlmChatClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public LiteLlmChatClient(String baseUrl, String apiKey, Duration requestTimeout) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:4000";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(120);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public LiteLlmChatClient(String apiKey) {
        this("http://localhost:4000", apiKey, Duration.ofSeconds(120));
    }

    @Override
    public String complete(String model, List<ChatMessage> messages) throws InterruptedException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(chatRequest(model, messages, false),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ModelUnavailableException(model, "LiteLLM unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
        checkStatus(model, response.statusCode(), response.body());
        return parseCompletion(model, response.body());
    }

    @Override
    public void stream(String model, List<ChatMessage> messages, Consumer<String> onToken, BooleanSupplier cancelled)
            throws InterruptedException {
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(chatRequest(model, messages, true), HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new ModelUnavailableException(model, "LiteLLM unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() != 200) {
                checkStatus(model, response.statusCode(), String.join("\n", (Iterable<String>) lines::iterator));
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (cancelled.getAsBoolean()) {
                    log.debug("LiteLLM stream on {} cancelled", model);
                    return;
                }
                String line = it.next().trim();
                if (!line.startsWith(DATA_PREFIX)) continue;
                String data = line.substring(DATA_PREFIX.length()).trim();
                if (DONE_MARKER.equals(data)) return;
                parseDelta(model, data).ifPresent(onToken);
            }
        }
    }

    /** True when the proxy answers its model list with 200. */
    @Override
    public boolean isAvailable(String model) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/models"))
                .timeout(Duration.ofSeconds(3))
                .GET();
        if (apiKey != null) builder.header("Authorization", "Bearer " + apiKey);
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (IOException e) {
            log.debug("LiteLLM not reachable at {}: {}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest chatRequest(String model, List<ChatMessage> messages, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("stream", stream);
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (IOException e) {
            throw new ModelException(model, "Could not encode LiteLLM request: " + e.getMessage(), e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        if (apiKey != null) builder.header("Authorization", "Bearer " + apiKey);
        return builder.build();
    }

    static void checkStatus(String model, int status, String body) {
        if (status == 200) return;
        String detail = "LiteLLM API error: " + status + (body != null && !body.isBlank() ? " " + body : "");
        if (status == 429 || status == 503) throw new ModelOverloadedException(model, detail);
        if (status == 404 || status >= 500) throw new ModelUnavailableException(model, detail);
        throw new ModelException(model, detail);
    }

    static String parseCompletion(String model, String json) {
        JsonNode root = readTree(model, json);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.size() == 0) {
            throw new ModelException(model, "LiteLLM response has no choices");
        }
        return choices.get(0).path("message").path("content").asText("");
    }

    static Optional<String> parseDelta(String model, String json) {
        JsonNode choices = readTree(model, json).path("choices");
        if (!choices.isArray() || choices.size() == 0) return Optional.empty();
        JsonNode content = choices.get(0).path("delta").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isEmpty()) return Optional.empty();
        return Optional.of(content.asText());
    }

    private static JsonNode readTree(String model, String json) {
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ModelException(model, "Malformed LiteLLM response: " + e.getMessage(), e);
        }
    }
}
