package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One result returned by a provider. Immutable once recorded.
 */
public final class SourceResult {

    private final String provider;
    private final String url;
    private final String title;
    private final String snippet;
    private final boolean success;
    private final double qualityScore;
    private final long retrievedAt;

    @JsonCreator
    public SourceResult(
            @JsonProperty("provider") String provider,
            @JsonProperty("url") String url,
            @JsonProperty("title") String title,
            @JsonProperty("snippet") String snippet,
            @JsonProperty("success") boolean success,
            @JsonProperty("qualityScore") double qualityScore,
            @JsonProperty("retrievedAt") long retrievedAt) {
        this.provider = provider != null ? provider : "";
        this.url = url != null ? url.trim() : "";
        this.title = title != null ? title : "";
        this.snippet = snippet != null ? snippet : "";
        this.success = success;
        this.qualityScore = Math.max(0.0, Math.min(1.0, qualityScore));
        this.retrievedAt = retrievedAt;
    }

    public static SourceResult success(String provider, String url, String title, String snippet,
                                       double qualityScore, long retrievedAt) {
        return new SourceResult(provider, url, title, snippet, true, qualityScore, retrievedAt);
    }

    public String getProvider() {
        return provider;
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public String getSnippet() {
        return snippet;
    }

    public boolean isSuccess() {
        return success;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    /** Epoch milliseconds. */
    public long getRetrievedAt() {
        return retrievedAt;
    }

    /** Title and snippet joined, for extraction. */
    public String content() {
        if (title.isEmpty()) return snippet;
        if (snippet.isEmpty()) return title;
        return title + ". " + snippet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceResult)) return false;
        SourceResult that = (SourceResult) o;
        return success == that.success
                && Double.compare(that.qualityScore, qualityScore) == 0
                && retrievedAt == that.retrievedAt
                && provider.equals(that.provider)
                && url.equals(that.url)
                && title.equals(that.title)
                && snippet.equals(that.snippet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, url, title, snippet, success, qualityScore, retrievedAt);
    }

    @Override
    public String toString() {
        return "SourceResult{provider=" + provider + ", url=" + url + ", success=" + success
                + ", quality=" + qualityScore + "}";
    }
}
