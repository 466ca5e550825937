package com.sage.provider.arxiv;

import com.sage.model.SourceResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArxivSearchProviderTest {

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom" xmlns:arxiv="http://arxiv.org/schemas/atom">
              <title type="html">ArXiv Query: search_query=all:transformers</title>
              <id>http://arxiv.org/api/cHxbiOdZaP56ODnBPIenZhzg5f8</id>
              <entry>
                <id>http://arxiv.org/abs/1706.03762v7</id>
                <published>2017-06-12T17:57:34Z</published>
                <title>Attention Is All
                  You Need</title>
                <summary>  The dominant sequence transduction models are based on complex recurrent
                  or convolutional neural networks.</summary>
                <author><name>Ashish Vaswani</name></author>
                <author><name>Noam Shazeer</name></author>
                <link href="http://arxiv.org/pdf/1706.03762v7" rel="related" type="application/pdf" title="pdf"/>
                <arxiv:primary_category term="cs.CL" scheme="http://arxiv.org/schemas/atom"/>
              </entry>
              <entry>
                <id>http://arxiv.org/abs/2005.14165v4</id>
                <title>Language Models are Few-Shot Learners</title>
                <summary>%s</summary>
              </entry>
            </feed>
            """.formatted("x".repeat(700));

    private static final String ERROR_FEED = """
            <feed xmlns="http://www.w3.org/2005/Atom">
              <entry>
                <id>http://arxiv.org/api/errors#incorrect_id_format_for_1234</id>
                <title>Error</title>
                <summary>incorrect id format for 1234</summary>
              </entry>
            </feed>
            """;

    @Test
    void parsesEntriesInFeedOrder() {
        List<SourceResult> results = ArxivSearchProvider.parse(FEED, 42L);

        assertEquals(2, results.size());
        SourceResult first = results.get(0);
        assertEquals("http://arxiv.org/abs/1706.03762v7", first.getUrl());
        assertEquals("Attention Is All You Need", first.getTitle());
        assertTrue(first.getSnippet().startsWith("The dominant sequence transduction models"));
        assertEquals(0.7, first.getQualityScore());
        assertEquals("arxiv", first.getProvider());
        assertEquals("http://arxiv.org/abs/2005.14165v4", results.get(1).getUrl());
    }

    @Test
    void longSummariesAreCutToFiveHundredCharacters() {
        assertEquals(500, ArxivSearchProvider.parse(FEED, 42L).get(1).getSnippet().length());
    }

    @Test
    void errorEntriesAreDropped() {
        assertTrue(ArxivSearchProvider.parse(ERROR_FEED, 42L).isEmpty());
        assertTrue(ArxivSearchProvider.parse("<feed xmlns=\"http://www.w3.org/2005/Atom\"></feed>", 42L).isEmpty());
    }

    @Test
    void buildQuery_scopesToCategory() {
        assertEquals("all:graph neural networks", ArxivSearchProvider.buildQuery(" graph neural networks ", Map.of()));
        assertEquals("cat:cs.LG AND all:graph neural networks",
                ArxivSearchProvider.buildQuery("graph neural networks", Map.of("category", "cs.LG")));
    }

    @Test
    void runsAtTheArxivRate() {
        assertEquals(0.33, new ArxivSearchProvider().requestsPerSecond());
    }
}
