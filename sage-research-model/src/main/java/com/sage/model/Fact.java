package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A statement with its supporting sources. Immutable; {@link #withSource(String)} and
 * {@link #withContradiction(String)} return updated copies.
 */
public final class Fact {

    private static final double CONTRADICTION_PENALTY = 0.15;
    private static final double MIN_CONFIDENCE = 0.1;

    private final String statement;
    private final List<String> sources;
    private final double confidence;
    private final boolean verified;
    private final List<String> contradictions;

    @JsonCreator
    public Fact(
            @JsonProperty("statement") String statement,
            @JsonProperty("sources") List<String> sources,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("verified") boolean verified,
            @JsonProperty("contradictions") List<String> contradictions) {
        this.statement = Objects.requireNonNull(statement, "statement").trim();
        this.sources = sources != null ? List.copyOf(sources) : List.of();
        this.confidence = clamp(confidence);
        this.verified = verified;
        this.contradictions = contradictions != null ? List.copyOf(contradictions) : List.of();
    }

    public static Fact of(String statement, String source, double confidence) {
        return new Fact(statement, source != null ? List.of(source) : List.of(), confidence, false, List.of());
    }

    public String getStatement() {
        return statement;
    }

    public List<String> getSources() {
        return sources;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isVerified() {
        return verified;
    }

    public List<String> getContradictions() {
        return contradictions;
    }

    /** Normalized statement used to detect duplicates. */
    public String key() {
        return statement.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9 ]", "").replaceAll("\\s+", " ").trim();
    }

    /**
     * Adds a corroborating source. A new source raises confidence by 0.1 divided by the new source count
     * (capped at 1.0); a source already present leaves the fact unchanged.
     */
    public Fact withSource(String source) {
        if (source == null || source.isBlank() || sources.contains(source)) {
            return this;
        }
        List<String> next = new ArrayList<>(sources);
        next.add(source);
        double boosted = Math.min(1.0, confidence + 0.1 / next.size());
        return new Fact(statement, next, boosted, verified, contradictions);
    }

    /** Records a conflicting statement; lowers confidence by 0.15 (floor 0.1) and clears verification. */
    public Fact withContradiction(String contradiction) {
        if (contradiction == null || contradiction.isBlank() || contradictions.contains(contradiction)) {
            return this;
        }
        List<String> next = new ArrayList<>(contradictions);
        next.add(contradiction);
        return new Fact(statement, sources, Math.max(MIN_CONFIDENCE, confidence - CONTRADICTION_PENALTY), false, next);
    }

    public Fact withVerified(boolean value) {
        return value == verified ? this : new Fact(statement, sources, confidence, value, contradictions);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return MIN_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fact)) return false;
        Fact fact = (Fact) o;
        return Double.compare(fact.confidence, confidence) == 0
                && verified == fact.verified
                && statement.equals(fact.statement)
                && sources.equals(fact.sources)
                && contradictions.equals(fact.contradictions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statement, sources, confidence, verified, contradictions);
    }

    @Override
    public String toString() {
        return "Fact{" + statement + ", confidence=" + confidence + ", sources=" + sources.size() + "}";
    }
}
