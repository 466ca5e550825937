package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one completed collection cycle, appended to {@link ResearchState#getCycleHistory()}.
 * {@code saturationConditionMet} is computed once when the record is created and never re-derived.
 */
public final class CycleRecord {

    private final int cycle;
    private final SaturationMetrics metrics;
    private final int newEntities;
    private final int newFacts;
    private final int resultsCollected;
    private final boolean sourceExhausted;
    private final boolean saturationConditionMet;
    private final long recordedAt;

    @JsonCreator
    public CycleRecord(
            @JsonProperty("cycle") int cycle,
            @JsonProperty("metrics") SaturationMetrics metrics,
            @JsonProperty("newEntities") int newEntities,
            @JsonProperty("newFacts") int newFacts,
            @JsonProperty("resultsCollected") int resultsCollected,
            @JsonProperty("sourceExhausted") boolean sourceExhausted,
            @JsonProperty("saturationConditionMet") boolean saturationConditionMet,
            @JsonProperty("recordedAt") long recordedAt) {
        this.cycle = cycle;
        this.metrics = metrics != null ? metrics : SaturationMetrics.INITIAL;
        this.newEntities = newEntities;
        this.newFacts = newFacts;
        this.resultsCollected = resultsCollected;
        this.sourceExhausted = sourceExhausted;
        this.saturationConditionMet = saturationConditionMet;
        this.recordedAt = recordedAt;
    }

    public int getCycle() {
        return cycle;
    }

    public SaturationMetrics getMetrics() {
        return metrics;
    }

    public int getNewEntities() {
        return newEntities;
    }

    public int getNewFacts() {
        return newFacts;
    }

    public int getResultsCollected() {
        return resultsCollected;
    }

    public boolean isSourceExhausted() {
        return sourceExhausted;
    }

    public boolean isSaturationConditionMet() {
        return saturationConditionMet;
    }

    public long getRecordedAt() {
        return recordedAt;
    }
}
