package com.sage.provider.tavily;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sage.gate.SearchProvider;
import com.sage.model.SourceResult;
import com.sage.search.ProviderHttp;
import com.sage.search.SourceCredibility;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tavily web search ({@code POST /search}). Unavailable without an API key.
 */
public final class TavilySearchProvider implements SearchProvider {

    public static final String NAME = "tavily";
    private static final String DEFAULT_BASE_URL = "https://api.tavily.com";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;

    public TavilySearchProvider(String baseUrl, String apiKey) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
        this.httpClient = ProviderHttp.newClient();
    }

    public TavilySearchProvider(String apiKey) {
        this(DEFAULT_BASE_URL, apiKey);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double requestsPerSecond() {
        return 1.0;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null;
    }

    /** Filters: {@code depth} ("basic" or "advanced"), {@code domains} (comma-separated include list). */
    @Override
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) throws IOException, InterruptedException {
        String body = buildRequest(apiKey, query, limit, filters);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/search"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(20))
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return parse(ProviderHttp.send(httpClient, request, NAME), System.currentTimeMillis());
    }

    static String buildRequest(String apiKey, String query, int limit, Map<String, String> filters) throws IOException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("api_key", apiKey);
        node.put("query", query);
        node.put("max_results", Math.min(20, limit));
        String depth = filters != null ? filters.get("depth") : null;
        node.put("search_depth", depth != null && !depth.isBlank() ? depth.trim() : "basic");
        String domains = filters != null ? filters.get("domains") : null;
        if (domains != null && !domains.isBlank()) {
            var array = node.putArray("include_domains");
            for (String d : domains.split(",")) {
                if (!d.isBlank()) array.add(d.trim());
            }
        }
        return MAPPER.writeValueAsString(node);
    }

    static List<SourceResult> parse(String json, long now) throws IOException {
        List<SourceResult> out = new ArrayList<>();
        for (JsonNode r : MAPPER.readTree(json).path("results")) {
            String url = r.path("url").asText("");
            if (url.isBlank()) continue;
            out.add(SourceResult.success(NAME, url, r.path("title").asText(""), r.path("content").asText(""),
                    SourceCredibility.of(NAME), now));
        }
        return out;
    }
}
