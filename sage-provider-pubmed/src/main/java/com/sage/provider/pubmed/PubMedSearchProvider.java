package com.sage.provider.pubmed;

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
 * PubMed via NCBI E-utilities: {@code esearch} for PMIDs, then {@code esummary} for titles and journals.
 * NCBI allows 3 requests per second without an API key.
 */
public final class PubMedSearchProvider implements SearchProvider {

    public static final String NAME = "pubmed";
    private static final String DEFAULT_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    private static final String ARTICLE_URL = "https://pubmed.ncbi.nlm.nih.gov/";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final HttpClient httpClient;

    public PubMedSearchProvider() {
        this(DEFAULT_BASE_URL);
    }

    public PubMedSearchProvider(String baseUrl) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = ProviderHttp.newClient();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double requestsPerSecond() {
        return 3.0;
    }

    /**
     * Filters: {@code year} restricts to a publication year; {@code type} adds a publication type (e.g. "review").
     */
    @Override
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) throws IOException, InterruptedException {
        String term = buildTerm(query, filters);
        String searchUrl = baseUrl + "/esearch.fcgi?db=pubmed&retmode=json&retmax=" + limit + "&term=" + ProviderHttp.encode(term);
        List<String> ids = parseIds(get(searchUrl));
        if (ids.isEmpty()) {
            return List.of();
        }
        String summaryUrl = baseUrl + "/esummary.fcgi?db=pubmed&retmode=json&id=" + String.join(",", ids);
        return parseSummaries(get(summaryUrl), System.currentTimeMillis());
    }

    static String buildTerm(String query, Map<String, String> filters) {
        StringBuilder term = new StringBuilder(query.trim());
        if (filters != null) {
            String year = filters.get("year");
            if (year != null && !year.isBlank()) term.append(" AND ").append(year.trim()).append("[pdat]");
            String type = filters.get("type");
            if (type != null && !type.isBlank()) term.append(" AND ").append(type.trim()).append("[pt]");
        }
        return term.toString();
    }

    static List<String> parseIds(String json) throws IOException {
        JsonNode idList = MAPPER.readTree(json).path("esearchresult").path("idlist");
        List<String> ids = new ArrayList<>();
        for (JsonNode id : idList) {
            if (!id.asText().isBlank()) ids.add(id.asText());
        }
        return ids;
    }

    /** Builds results in the order of {@code result.uids}, which follows esearch relevance order. */
    static List<SourceResult> parseSummaries(String json, long now) throws IOException {
        JsonNode result = MAPPER.readTree(json).path("result");
        List<SourceResult> out = new ArrayList<>();
        for (JsonNode uidNode : result.path("uids")) {
            String uid = uidNode.asText();
            JsonNode doc = result.path(uid);
            if (doc.isMissingNode() || doc.has("error")) continue;
            String title = doc.path("title").asText("");
            String journal = doc.path("fulljournalname").asText(doc.path("source").asText(""));
            String pubDate = doc.path("pubdate").asText("");
            String snippet = journal.isEmpty() ? pubDate : (pubDate.isEmpty() ? journal : journal + ", " + pubDate);
            out.add(SourceResult.success(NAME, ARTICLE_URL + uid + "/", title, snippet, SourceCredibility.of(NAME), now));
        }
        return out;
    }

    private String get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(15))
                .GET()
                .build();
        return ProviderHttp.send(httpClient, request, NAME);
    }
}
