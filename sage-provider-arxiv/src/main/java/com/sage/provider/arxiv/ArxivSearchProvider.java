package com.sage.provider.arxiv;

import com.sage.gate.SearchProvider;
import com.sage.model.SourceResult;
import com.sage.search.ProviderHttp;
import com.sage.search.SourceCredibility;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * arXiv preprint search over the Atom export API. arXiv asks clients to wait three seconds between calls,
 * so the provider runs at 0.33 requests per second.
 */
public final class ArxivSearchProvider implements SearchProvider {

    public static final String NAME = "arxiv";
    private static final String DEFAULT_BASE_URL = "http://export.arxiv.org/api/query";
    private static final String ERROR_ID = "arxiv.org/api/errors";
    private static final int MAX_RESULTS = 100;
    private static final int MAX_SNIPPET = 500;

    private final String baseUrl;
    private final HttpClient httpClient;

    public ArxivSearchProvider() {
        this(DEFAULT_BASE_URL);
    }

    public ArxivSearchProvider(String baseUrl) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = ProviderHttp.newClient();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double requestsPerSecond() {
        return 0.33;
    }

    /** Filters: {@code category} restricts to an arXiv subject class (e.g. "cs.AI"). */
    @Override
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) throws IOException, InterruptedException {
        String url = baseUrl + "?search_query=" + ProviderHttp.encode(buildQuery(query, filters))
                + "&start=0&max_results=" + Math.min(MAX_RESULTS, limit)
                + "&sortBy=relevance&sortOrder=descending";
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/atom+xml")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        return parse(ProviderHttp.send(httpClient, request, NAME), System.currentTimeMillis());
    }

    static String buildQuery(String query, Map<String, String> filters) {
        String term = "all:" + query.trim();
        String category = filters != null ? filters.get("category") : null;
        if (category != null && !category.isBlank()) {
            term = "cat:" + category.trim() + " AND " + term;
        }
        return term;
    }

    /** One result per Atom {@code entry}, in feed order; the API's error entries are dropped. */
    static List<SourceResult> parse(String atom, long now) {
        Document feed = Jsoup.parse(atom, "", Parser.xmlParser());
        List<SourceResult> out = new ArrayList<>();
        for (Element entry : feed.select("entry")) {
            String url = childText(entry, "id");
            if (url.isEmpty() || url.contains(ERROR_ID)) continue;
            String snippet = childText(entry, "summary");
            if (snippet.length() > MAX_SNIPPET) snippet = snippet.substring(0, MAX_SNIPPET);
            out.add(SourceResult.success(NAME, url, childText(entry, "title"), snippet, SourceCredibility.of(NAME), now));
        }
        return out;
    }

    private static String childText(Element entry, String tag) {
        Element child = entry.selectFirst(tag);
        return child != null ? child.text().trim() : "";
    }
}
