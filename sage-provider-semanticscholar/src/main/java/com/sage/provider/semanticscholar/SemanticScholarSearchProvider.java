package com.sage.provider.semanticscholar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.gate.SearchProvider;
import com.sage.model.SourceResult;
import com.sage.search.ProviderHttp;
import com.sage.search.SourceCredibility;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Semantic Scholar Graph API paper search. The public API is strict: 1 request per second.
 */
public final class SemanticScholarSearchProvider implements SearchProvider {

    public static final String NAME = "semantic_scholar";
    private static final String DEFAULT_BASE_URL = "https://api.semanticscholar.org/graph/v1";
    private static final String PAPER_URL = "https://www.semanticscholar.org/paper/";
    private static final String FIELDS = "title,abstract,url,year,venue,citationCount";
    private static final int MAX_SNIPPET = 500;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;

    /**
     * @param apiKey optional; sent as {@code x-api-key} when present
     */
    public SemanticScholarSearchProvider(String baseUrl, String apiKey) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
        this.httpClient = ProviderHttp.newClient();
    }

    public SemanticScholarSearchProvider(String apiKey) {
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

    /** Filters: {@code year} (e.g. "2024" or "2020-2024"). */
    @Override
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) throws IOException, InterruptedException {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/paper/search?query=").append(ProviderHttp.encode(query))
                .append("&limit=").append(Math.min(100, limit))
                .append("&fields=").append(FIELDS);
        String year = filters != null ? filters.get("year") : null;
        if (year != null && !year.isBlank()) url.append("&year=").append(ProviderHttp.encode(year.trim()));

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url.toString()))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(15))
                .GET();
        if (apiKey != null) request.header("x-api-key", apiKey);
        return parse(ProviderHttp.send(httpClient, request.build(), NAME), System.currentTimeMillis());
    }

    static List<SourceResult> parse(String json, long now) throws IOException {
        List<SourceResult> out = new ArrayList<>();
        for (JsonNode paper : MAPPER.readTree(json).path("data")) {
            String paperId = paper.path("paperId").asText("");
            String url = paper.path("url").asText("");
            if (url.isBlank() && !paperId.isBlank()) url = PAPER_URL + paperId;
            if (url.isBlank()) continue;
            String snippet = paper.path("abstract").isTextual() ? paper.path("abstract").asText() : "";
            if (snippet.length() > MAX_SNIPPET) snippet = snippet.substring(0, MAX_SNIPPET);
            out.add(SourceResult.success(NAME, url, paper.path("title").asText(""), snippet, SourceCredibility.of(NAME), now));
        }
        return out;
    }
}
