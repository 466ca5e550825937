package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Growth and coverage measurements for one collection cycle.
 */
public final class SaturationMetrics {

    public static final SaturationMetrics INITIAL = new SaturationMetrics(1.0, 1.0, 0.0, 0.0);

    private final double newEntitiesRatio;
    private final double newFactsRatio;
    private final double citationCircularity;
    private final double sourceCoverage;

    @JsonCreator
    public SaturationMetrics(
            @JsonProperty("newEntitiesRatio") double newEntitiesRatio,
            @JsonProperty("newFactsRatio") double newFactsRatio,
            @JsonProperty("citationCircularity") double citationCircularity,
            @JsonProperty("sourceCoverage") double sourceCoverage) {
        this.newEntitiesRatio = newEntitiesRatio;
        this.newFactsRatio = newFactsRatio;
        this.citationCircularity = citationCircularity;
        this.sourceCoverage = sourceCoverage;
    }

    public double getNewEntitiesRatio() {
        return newEntitiesRatio;
    }

    public double getNewFactsRatio() {
        return newFactsRatio;
    }

    public double getCitationCircularity() {
        return citationCircularity;
    }

    public double getSourceCoverage() {
        return sourceCoverage;
    }

    @Override
    public String toString() {
        return String.format("entities=%.3f facts=%.3f circularity=%.3f coverage=%.3f",
                newEntitiesRatio, newFactsRatio, citationCircularity, sourceCoverage);
    }
}
