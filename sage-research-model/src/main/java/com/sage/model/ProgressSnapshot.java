package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of a session for status displays. Snapshots are idempotent to display:
 * a consumer seeing the same sequence twice can simply redraw.
 */
public final class ProgressSnapshot {

    private final String sessionId;
    private final long sequence;
    private final Phase phase;
    private final int sourcesQueried;
    private final int entitiesFound;
    private final int factsExtracted;
    private final SaturationMetrics saturationMetrics;
    private final String stopReason;

    @JsonCreator
    public ProgressSnapshot(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("phase") Phase phase,
            @JsonProperty("sourcesQueried") int sourcesQueried,
            @JsonProperty("entitiesFound") int entitiesFound,
            @JsonProperty("factsExtracted") int factsExtracted,
            @JsonProperty("saturationMetrics") SaturationMetrics saturationMetrics,
            @JsonProperty("stopReason") String stopReason) {
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.phase = phase;
        this.sourcesQueried = sourcesQueried;
        this.entitiesFound = entitiesFound;
        this.factsExtracted = factsExtracted;
        this.saturationMetrics = saturationMetrics;
        this.stopReason = stopReason;
    }

    public static ProgressSnapshot of(ResearchState state) {
        return new ProgressSnapshot(state.getSessionId(), 0L, state.getPhase(), state.getSourceResults().size(),
                state.getEntities().size(), state.getFacts().size(), state.getSaturationMetrics(), state.getStopReason());
    }

    public ProgressSnapshot withSequence(long value) {
        return new ProgressSnapshot(sessionId, value, phase, sourcesQueried, entitiesFound, factsExtracted,
                saturationMetrics, stopReason);
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getSequence() {
        return sequence;
    }

    public Phase getPhase() {
        return phase;
    }

    public int getSourcesQueried() {
        return sourcesQueried;
    }

    public int getEntitiesFound() {
        return entitiesFound;
    }

    public int getFactsExtracted() {
        return factsExtracted;
    }

    public SaturationMetrics getSaturationMetrics() {
        return saturationMetrics;
    }

    public String getStopReason() {
        return stopReason;
    }
}
