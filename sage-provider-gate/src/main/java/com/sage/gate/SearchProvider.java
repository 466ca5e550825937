package com.sage.gate;

import com.sage.model.SourceResult;

import java.util.List;
import java.util.Map;

/**
 * Raw adapter for one external search provider. Implementations throw freely (e.g. {@code RateLimitException},
 * {@code AccessDeniedException}, {@code ProviderTimeoutException}); callers never invoke them directly but
 * through a {@link ProviderGate}.
 */
public interface SearchProvider {

    /** Stable provider name (e.g. "pubmed"); used as the key for rate limits, circuits and learning. */
    String name();

    /** Provider-specific request budget. */
    double requestsPerSecond();

    /**
     * Runs one search.
     *
     * @param query   search text
     * @param limit   maximum results wanted
     * @param filters provider-specific filters (e.g. "year" or "type"); never null
     * @return results in the provider's own ranking order
     */
    List<SourceResult> search(String query, int limit, Map<String, String> filters) throws Exception;

    /** False when the provider cannot be used at all (e.g. missing API key). */
    default boolean isAvailable() {
        return true;
    }
}
