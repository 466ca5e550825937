package com.sage.memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Long-lived research memory: stored documents, learned source effectiveness and known access failures.
 * Implementations must be safe for concurrent readers; effectiveness writes are last-writer-wins per
 * (source, domain).
 */
public interface MemoryStore {

    double DEFAULT_EFFECTIVENESS = 0.5;

    /** Stores a document and returns its id. */
    String storeDocument(String content, Map<String, String> metadata, String sessionId);

    /**
     * Documents ranked by similarity to {@code query}, best first. {@code filters} match metadata entries exactly;
     * the key {@code session_id} matches the owning session.
     */
    List<MemoryDocument> searchSimilar(String query, int limit, Map<String, String> filters);

    /** Learned score in [0, 1]; {@link #DEFAULT_EFFECTIVENESS} for an unseen pair. */
    double getSourceEffectiveness(String source, String domain);

    /** Folds one observation into the score with {@link SourceLearning#ema(double, boolean, double)}. */
    void updateSourceEffectiveness(String source, String domain, boolean success, double quality);

    /** Records a URL that refused access. A repeat for the same URL increments its retry count. */
    void recordAccessFailure(String url, String source, String errorType, String message);

    boolean isKnownFailure(String url);

    Optional<AccessFailureRecord> getAccessFailure(String url);
}
