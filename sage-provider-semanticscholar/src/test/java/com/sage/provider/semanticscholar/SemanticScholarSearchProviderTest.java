package com.sage.provider.semanticscholar;

import com.sage.model.SourceResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticScholarSearchProviderTest {

    @Test
    void parse_fallsBackToPaperIdUrlAndHandlesNullAbstract() throws Exception {
        String json = """
                {"total": 2, "data": [
                  {"paperId": "abc123", "title": "Insulin pumps", "abstract": null, "url": null},
                  {"paperId": "def456", "title": "SGLT2 inhibitors", "abstract": "Renal outcomes.", "url": "https://www.semanticscholar.org/paper/def456"}
                ]}
                """;

        List<SourceResult> results = SemanticScholarSearchProvider.parse(json, 1L);

        assertEquals(2, results.size());
        assertEquals("https://www.semanticscholar.org/paper/abc123", results.get(0).getUrl());
        assertEquals("", results.get(0).getSnippet());
        assertEquals("Renal outcomes.", results.get(1).getSnippet());
        assertEquals(0.85, results.get(1).getQualityScore());
    }

    @Test
    void parse_missingDataIsEmpty() throws Exception {
        assertTrue(SemanticScholarSearchProvider.parse("{\"total\":0}", 1L).isEmpty());
    }
}
