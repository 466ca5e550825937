package com.sage.llm.ollama;

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
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Local-tier chat client for Ollama.
 * <p>
 * Uses {@code POST baseUrl/api/chat}; streaming reads the newline-delimited JSON body line by line.
 * Busy responses (429, 503) are reported as overloaded, a missing model or unreachable server as unavailable.
 */
public final class OllamaChatClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long TAGS_CACHE_MILLIS = 30_000L;

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private volatile Set<String> cachedTags = Set.of();
    private volatile long tagsFetchedAt = Long.MIN_VALUE;

    /**
     * @param baseUrl        e.g. "http://localhost:11434"; null for the default
     * @param requestTimeout per-request timeout for completions
     */
    public OllamaChatClient(String baseUrl, Duration requestTimeout) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:11434";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(120);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public OllamaChatClient() {
        this("http://localhost:11434", Duration.ofSeconds(120));
    }

    @Override
    public String complete(String model, List<ChatMessage> messages) throws InterruptedException {
        HttpRequest request = chatRequest(model, messages, false);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ModelUnavailableException(model, "Ollama unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
        checkStatus(model, response.statusCode(), response.body());
        OllamaChatChunk chunk = parseChunk(model, response.body());
        return chunk.content();
    }

    @Override
    public void stream(String model, List<ChatMessage> messages, Consumer<String> onToken, BooleanSupplier cancelled)
            throws InterruptedException {
        HttpRequest request = chatRequest(model, messages, true);
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new ModelUnavailableException(model, "Ollama unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() != 200) {
                checkStatus(model, response.statusCode(), String.join("\n", (Iterable<String>) lines::iterator));
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (cancelled.getAsBoolean()) {
                    log.debug("Ollama stream on {} cancelled", model);
                    return;
                }
                String line = it.next();
                if (line.isBlank()) continue;
                OllamaChatChunk chunk = parseChunk(model, line);
                String token = chunk.content();
                if (!token.isEmpty()) onToken.accept(token);
                if (chunk.isDone()) return;
            }
        }
    }

    /** True when the server answers and lists the model (tag suffix optional). Cached briefly. */
    @Override
    public boolean isAvailable(String model) {
        long now = System.currentTimeMillis();
        if (now - tagsFetchedAt > TAGS_CACHE_MILLIS) {
            cachedTags = fetchTags();
            tagsFetchedAt = now;
        }
        return cachedTags.contains(model) || (!model.contains(":") && cachedTags.contains(model + ":latest"));
    }

    private Set<String> fetchTags() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/tags"))
                .timeout(Duration.ofSeconds(3))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                log.warn("Ollama tags returned {}", response.statusCode());
                return Set.of();
            }
            return parseTags(response.body());
        } catch (IOException e) {
            log.debug("Ollama not reachable at {}: {}", baseUrl, e.getMessage());
            return Set.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Set.of();
        }
    }

    private HttpRequest chatRequest(String model, List<ChatMessage> messages, boolean stream) {
        String json;
        try {
            json = MAPPER.writeValueAsString(new OllamaChatRequest(model, messages, stream));
        } catch (IOException e) {
            throw new ModelException(model, "Could not encode Ollama request: " + e.getMessage(), e);
        }
        return HttpRequest.newBuilder(URI.create(baseUrl + "/api/chat"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
    }

    static void checkStatus(String model, int status, String body) {
        if (status == 200) return;
        String detail = "Ollama API error: " + status + (body != null && !body.isBlank() ? " " + body : "");
        if (status == 429 || status == 503) throw new ModelOverloadedException(model, detail);
        if (status == 404 || status >= 500) throw new ModelUnavailableException(model, detail);
        throw new ModelException(model, detail);
    }

    static OllamaChatChunk parseChunk(String model, String json) {
        OllamaChatChunk chunk;
        try {
            chunk = MAPPER.readValue(json, OllamaChatChunk.class);
        } catch (IOException e) {
            throw new ModelException(model, "Malformed Ollama response: " + e.getMessage(), e);
        }
        if (chunk.getError() != null && !chunk.getError().isBlank()) {
            throw new ModelUnavailableException(model, "Ollama error: " + chunk.getError());
        }
        return chunk;
    }

    static Set<String> parseTags(String json) throws IOException {
        Set<String> names = new HashSet<>();
        for (JsonNode m : MAPPER.readTree(json).path("models")) {
            String name = m.path("name").asText("");
            if (!name.isEmpty()) names.add(name);
        }
        return names;
    }
}
