package com.sage.search;

import java.util.Locale;
import java.util.Map;

/**
 * Base quality score per provider, used as {@code SourceResult.qualityScore} before any learning.
 */
public final class SourceCredibility {

    public static final double DEFAULT = 0.5;

    private static final Map<String, Double> SCORES = Map.of(
            "pubmed", 0.9,
            "semantic_scholar", 0.85,
            "unpaywall", 0.8,
            "arxiv", 0.7,
            "exa", 0.55,
            "tavily", 0.5,
            "brave", 0.5,
            "playwright_crawler", 0.4);

    private SourceCredibility() {
    }

    public static double of(String provider) {
        if (provider == null) return DEFAULT;
        return SCORES.getOrDefault(provider.toLowerCase(Locale.ROOT), DEFAULT);
    }
}
