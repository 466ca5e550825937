package com.sage.provider.unpaywall;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.gate.SearchProvider;
import com.sage.model.SourceResult;
import com.sage.model.error.ProviderTimeoutException;
import com.sage.search.ProviderHttp;
import com.sage.search.SourceCredibility;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unpaywall lookups: finds the open-access copy of known DOIs. It does not do keyword search; DOIs come from the
 * {@code dois} filter (comma-separated) or from a query that is itself a DOI. Unpaywall requires a contact email
 * on every request and allows 10 requests per second.
 */
public final class UnpaywallSearchProvider implements SearchProvider {

    public static final String NAME = "unpaywall";
    private static final String DEFAULT_BASE_URL = "https://api.unpaywall.org/v2";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String email;
    private final HttpClient httpClient;

    /**
     * @param email contact address sent as {@code email}; without it the provider reports itself unavailable
     */
    public UnpaywallSearchProvider(String baseUrl, String email) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.email = email != null && !email.isBlank() ? email.trim() : null;
        this.httpClient = ProviderHttp.newClient();
    }

    public UnpaywallSearchProvider(String email) {
        this(DEFAULT_BASE_URL, email);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double requestsPerSecond() {
        return 10.0;
    }

    @Override
    public boolean isAvailable() {
        return email != null;
    }

    /** Looks up at most {@code limit} DOIs; a DOI Unpaywall does not know, or with no open copy, yields nothing. */
    @Override
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) throws IOException, InterruptedException {
        List<SourceResult> out = new ArrayList<>();
        for (String doi : dois(query, filters)) {
            if (out.size() >= limit) break;
            String body = lookup(doi);
            if (body != null) {
                parse(body, System.currentTimeMillis()).ifPresent(out::add);
            }
        }
        return out;
    }

    static List<String> dois(String query, Map<String, String> filters) {
        Set<String> dois = new LinkedHashSet<>();
        String listed = filters != null ? filters.get("dois") : null;
        if (listed != null) {
            for (String doi : listed.split(",")) {
                String normalized = normalizeDoi(doi);
                if (normalized != null) dois.add(normalized);
            }
        }
        String fromQuery = normalizeDoi(query);
        if (fromQuery != null) dois.add(fromQuery);
        return new ArrayList<>(dois);
    }

    /** Strips a {@code doi:} or resolver prefix; returns null unless the rest looks like a DOI. */
    static String normalizeDoi(String value) {
        if (value == null) return null;
        String doi = value.trim();
        String lower = doi.toLowerCase(Locale.ROOT);
        for (String prefix : List.of("https://doi.org/", "http://doi.org/", "https://dx.doi.org/", "doi:")) {
            if (lower.startsWith(prefix)) {
                doi = doi.substring(prefix.length()).trim();
                break;
            }
        }
        return doi.startsWith("10.") && doi.indexOf('/') > 3 && !doi.contains(" ") ? doi : null;
    }

    /** The open-access location of one DOI record, or empty when the work is closed. */
    static Optional<SourceResult> parse(String json, long now) throws IOException {
        JsonNode record = MAPPER.readTree(json);
        if (!record.path("is_oa").asBoolean(false)) return Optional.empty();
        JsonNode location = record.path("best_oa_location");
        String url = text(location, "url_for_pdf");
        if (url.isEmpty()) url = text(location, "url");
        if (url.isEmpty()) return Optional.empty();
        String doi = text(record, "doi");
        String title = text(record, "title");
        StringBuilder snippet = new StringBuilder("Open access version of DOI: ").append(doi);
        String journal = text(record, "journal_name");
        if (!journal.isEmpty()) snippet.append(" (").append(journal).append(')');
        return Optional.of(SourceResult.success(NAME, url, title.isEmpty() ? doi : title, snippet.toString(),
                SourceCredibility.of(NAME), now));
    }

    /** Body of the DOI record; null on 404, which Unpaywall answers for DOIs it does not index. */
    private String lookup(String doi) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/" + doi + "?email=" + ProviderHttp.encode(email)))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(15))
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException(NAME, "Timed out calling " + NAME + ": " + e.getMessage(), e);
        }
        if (response.statusCode() == 404) return null;
        ProviderHttp.checkStatus(NAME, request.uri().toString(), response.statusCode(),
                response.headers().firstValue("Retry-After"));
        return response.body();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText().trim() : "";
    }
}
