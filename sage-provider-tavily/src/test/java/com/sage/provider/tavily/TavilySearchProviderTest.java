package com.sage.provider.tavily;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.model.SourceResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TavilySearchProviderTest {

    @Test
    void unavailableWithoutApiKey() {
        assertFalse(new TavilySearchProvider(" ").isAvailable());
        assertTrue(new TavilySearchProvider("tvly-key").isAvailable());
    }

    @Test
    void buildRequest_includesDomainsAndCapsResults() throws Exception {
        JsonNode body = new ObjectMapper().readTree(
                TavilySearchProvider.buildRequest("k", "acme market share", 50, Map.of("domains", "sec.gov, reuters.com")));

        assertEquals(20, body.path("max_results").asInt());
        assertEquals("basic", body.path("search_depth").asText());
        assertEquals(2, body.path("include_domains").size());
        assertEquals("reuters.com", body.path("include_domains").get(1).asText());
    }

    @Test
    void parse_skipsResultsWithoutUrl() throws Exception {
        String json = """
                {"query": "q", "results": [
                  {"title": "A", "url": "https://a.example", "content": "alpha", "score": 0.9},
                  {"title": "B", "content": "no url"}
                ]}
                """;

        List<SourceResult> results = TavilySearchProvider.parse(json, 3L);

        assertEquals(1, results.size());
        assertEquals("alpha", results.get(0).getSnippet());
        assertEquals("tavily", results.get(0).getProvider());
    }
}
