package com.sage.memory;

import com.sage.model.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fail-safe facade over a {@link MemoryStore} and a {@link CheckpointStore}. Any exception from the delegates is
 * caught and logged and a neutral default is returned, so memory problems never fail a research session.
 */
public final class ResilientMemory implements MemoryStore, CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(ResilientMemory.class);

    private final MemoryStore memory;
    private final CheckpointStore checkpoints;

    public ResilientMemory(MemoryStore memory, CheckpointStore checkpoints) {
        InMemoryMemoryStore fallback = memory == null || checkpoints == null ? new InMemoryMemoryStore() : null;
        this.memory = memory != null ? memory : fallback;
        this.checkpoints = checkpoints != null ? checkpoints : fallback;
    }

    /** Wraps a store that provides both concerns (e.g. the in-memory or JDBC store). */
    public static <T extends MemoryStore & CheckpointStore> ResilientMemory of(T store) {
        return new ResilientMemory(store, store);
    }

    @Override
    public String storeDocument(String content, Map<String, String> metadata, String sessionId) {
        try {
            return memory.storeDocument(content, metadata, sessionId);
        } catch (Throwable t) {
            log.warn("Memory storeDocument failed (sessionId={}); execution continues. Error: {}", sessionId, t.getMessage(), t);
            return null;
        }
    }

    @Override
    public List<MemoryDocument> searchSimilar(String query, int limit, Map<String, String> filters) {
        try {
            return memory.searchSimilar(query, limit, filters);
        } catch (Throwable t) {
            log.warn("Memory searchSimilar failed; returning no documents. Error: {}", t.getMessage(), t);
            return List.of();
        }
    }

    @Override
    public double getSourceEffectiveness(String source, String domain) {
        try {
            return memory.getSourceEffectiveness(source, domain);
        } catch (Throwable t) {
            log.warn("Memory getSourceEffectiveness failed ({}/{}); using default {}. Error: {}", source, domain, DEFAULT_EFFECTIVENESS, t.getMessage());
            return DEFAULT_EFFECTIVENESS;
        }
    }

    @Override
    public void updateSourceEffectiveness(String source, String domain, boolean success, double quality) {
        try {
            memory.updateSourceEffectiveness(source, domain, success, quality);
        } catch (Throwable t) {
            log.warn("Memory updateSourceEffectiveness failed ({}/{}); execution continues. Error: {}", source, domain, t.getMessage(), t);
        }
    }

    @Override
    public void recordAccessFailure(String url, String source, String errorType, String message) {
        try {
            memory.recordAccessFailure(url, source, errorType, message);
        } catch (Throwable t) {
            log.warn("Memory recordAccessFailure failed (url={}); execution continues. Error: {}", url, t.getMessage(), t);
        }
    }

    @Override
    public boolean isKnownFailure(String url) {
        try {
            return memory.isKnownFailure(url);
        } catch (Throwable t) {
            log.warn("Memory isKnownFailure failed (url={}); treating as unknown. Error: {}", url, t.getMessage());
            return false;
        }
    }

    @Override
    public Optional<AccessFailureRecord> getAccessFailure(String url) {
        try {
            return memory.getAccessFailure(url);
        } catch (Throwable t) {
            log.warn("Memory getAccessFailure failed (url={}). Error: {}", url, t.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(ResearchState state) {
        try {
            checkpoints.save(state);
        } catch (Throwable t) {
            log.warn("Checkpoint save failed (sessionId={}, phase={}); execution continues. Error: {}",
                    state.getSessionId(), state.getPhase(), t.getMessage(), t);
        }
    }

    @Override
    public Optional<ResearchState> load(String sessionId) {
        try {
            return checkpoints.load(sessionId);
        } catch (Throwable t) {
            log.warn("Checkpoint load failed (sessionId={}). Error: {}", sessionId, t.getMessage(), t);
            return Optional.empty();
        }
    }

    @Override
    public void archive(String sessionId) {
        try {
            checkpoints.archive(sessionId);
        } catch (Throwable t) {
            log.warn("Checkpoint archive failed (sessionId={}); execution continues. Error: {}", sessionId, t.getMessage(), t);
        }
    }
}
