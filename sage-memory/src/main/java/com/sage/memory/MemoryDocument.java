package com.sage.memory;

import java.util.Map;
import java.util.Objects;

/** A stored document, with the similarity score it earned in a search (0 when not from a search). */
public final class MemoryDocument {

    private final String id;
    private final String content;
    private final Map<String, String> metadata;
    private final String sessionId;
    private final double score;

    public MemoryDocument(String id, String content, Map<String, String> metadata, String sessionId, double score) {
        this.id = Objects.requireNonNull(id, "id");
        this.content = content != null ? content : "";
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.sessionId = sessionId;
        this.score = score;
    }

    public String getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getSessionId() {
        return sessionId;
    }

    public double getScore() {
        return score;
    }

    MemoryDocument withScore(double newScore) {
        return new MemoryDocument(id, content, metadata, sessionId, newScore);
    }

    /** True when every filter entry matches; {@code session_id} is matched against the owning session. */
    public boolean matches(Map<String, String> filters) {
        if (filters == null) return true;
        for (Map.Entry<String, String> f : filters.entrySet()) {
            String actual = "session_id".equals(f.getKey()) ? sessionId : metadata.get(f.getKey());
            if (!Objects.equals(actual, f.getValue())) return false;
        }
        return true;
    }
}
