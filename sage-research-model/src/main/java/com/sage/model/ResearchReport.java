package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final (or partial) output of a session. Rendering to documents is left to exporters.
 */
public final class ResearchReport {

    private final String sessionId;
    private final String query;
    private final String domain;
    private final PrivacyMode privacyMode;
    private final String summary;
    private final List<Fact> facts;
    private final List<SourceResult> sources;
    private final List<String> notFound;
    private final boolean partial;
    private final String stopReason;
    private final int cycles;
    private final String model;

    @JsonCreator
    public ResearchReport(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("query") String query,
            @JsonProperty("domain") String domain,
            @JsonProperty("privacyMode") PrivacyMode privacyMode,
            @JsonProperty("summary") String summary,
            @JsonProperty("facts") List<Fact> facts,
            @JsonProperty("sources") List<SourceResult> sources,
            @JsonProperty("notFound") List<String> notFound,
            @JsonProperty("partial") boolean partial,
            @JsonProperty("stopReason") String stopReason,
            @JsonProperty("cycles") int cycles,
            @JsonProperty("model") String model) {
        this.sessionId = sessionId;
        this.query = query;
        this.domain = domain;
        this.privacyMode = privacyMode;
        this.summary = summary != null ? summary : "";
        this.facts = facts != null ? List.copyOf(facts) : List.of();
        this.sources = sources != null ? List.copyOf(sources) : List.of();
        this.notFound = notFound != null ? List.copyOf(notFound) : List.of();
        this.partial = partial;
        this.stopReason = stopReason;
        this.cycles = cycles;
        this.model = model;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQuery() {
        return query;
    }

    public String getDomain() {
        return domain;
    }

    public PrivacyMode getPrivacyMode() {
        return privacyMode;
    }

    public String getSummary() {
        return summary;
    }

    public List<Fact> getFacts() {
        return facts;
    }

    public List<SourceResult> getSources() {
        return sources;
    }

    /** Explanations for what could not be found and why. */
    public List<String> getNotFound() {
        return notFound;
    }

    public boolean isPartial() {
        return partial;
    }

    public String getStopReason() {
        return stopReason;
    }

    public int getCycles() {
        return cycles;
    }

    /** Model that wrote the summary, or null when no model was available. */
    public String getModel() {
        return model;
    }
}
