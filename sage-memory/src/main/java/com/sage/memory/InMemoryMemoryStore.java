package com.sage.memory;

import com.sage.model.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Process-local memory and checkpoint store. Checkpoints are kept as JSON so a loaded state is an independent copy.
 */
public final class InMemoryMemoryStore implements MemoryStore, CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final List<MemoryDocument> documents = new CopyOnWriteArrayList<>();
    private final Map<String, Double> effectiveness = new ConcurrentHashMap<>();
    private final Map<String, AccessFailureRecord> failures = new ConcurrentHashMap<>();
    private final Map<String, String> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, Boolean> archived = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public InMemoryMemoryStore() {
        this(System::currentTimeMillis);
    }

    public InMemoryMemoryStore(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public String storeDocument(String content, Map<String, String> metadata, String sessionId) {
        String id = UUID.randomUUID().toString();
        documents.add(new MemoryDocument(id, content, metadata, sessionId, 0.0));
        return id;
    }

    @Override
    public List<MemoryDocument> searchSimilar(String query, int limit, Map<String, String> filters) {
        List<MemoryDocument> scored = new ArrayList<>();
        for (MemoryDocument doc : documents) {
            if (!doc.matches(filters)) continue;
            double score = TextSimilarity.score(query, doc.getContent());
            if (score > 0) scored.add(doc.withScore(score));
        }
        scored.sort(Comparator.comparingDouble(MemoryDocument::getScore).reversed());
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, Math.max(0, limit))) : scored;
    }

    @Override
    public double getSourceEffectiveness(String source, String domain) {
        return effectiveness.getOrDefault(key(source, domain), DEFAULT_EFFECTIVENESS);
    }

    @Override
    public void updateSourceEffectiveness(String source, String domain, boolean success, double quality) {
        double updated = effectiveness.compute(key(source, domain),
                (k, old) -> SourceLearning.ema(old != null ? old : DEFAULT_EFFECTIVENESS, success, quality));
        log.debug("Effectiveness {}/{} -> {}", source, domain, updated);
    }

    @Override
    public void recordAccessFailure(String url, String source, String errorType, String message) {
        long now = clock.getAsLong();
        failures.merge(url, new AccessFailureRecord(url, source, errorType, message, now, now, 1),
                (existing, fresh) -> existing.repeated(message, now));
    }

    @Override
    public boolean isKnownFailure(String url) {
        return url != null && failures.containsKey(url);
    }

    @Override
    public Optional<AccessFailureRecord> getAccessFailure(String url) {
        return url == null ? Optional.empty() : Optional.ofNullable(failures.get(url));
    }

    @Override
    public void save(ResearchState state) {
        checkpoints.put(state.getSessionId(), state.toJson());
    }

    @Override
    public Optional<ResearchState> load(String sessionId) {
        String json = checkpoints.get(sessionId);
        return json == null ? Optional.empty() : Optional.of(ResearchState.fromJson(json));
    }

    @Override
    public void archive(String sessionId) {
        if (checkpoints.containsKey(sessionId)) archived.put(sessionId, Boolean.TRUE);
    }

    public boolean isArchived(String sessionId) {
        return archived.containsKey(sessionId);
    }

    private static String key(String source, String domain) {
        return source + "|" + domain;
    }
}
