package com.sage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable state of one research session. Only the step executing the current phase writes to it;
 * the orchestrator checkpoints it after every transition.
 * <p>
 * {@link #getCycleHistory()} is append-only: records are added through {@link #appendCycle(CycleRecord)}
 * and never replaced. {@link #appendStopReason(String)} keeps every stop decision for audit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResearchState {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private String sessionId;
    private Phase phase = Phase.CLARIFY;
    private String query;
    private String domain;
    private PrivacyMode privacyMode = PrivacyMode.LOCAL_ONLY;
    private boolean privacyModeExplicit;
    private final List<Entity> entities = new ArrayList<>();
    private final List<Fact> facts = new ArrayList<>();
    private final List<SourceResult> sourceResults = new ArrayList<>();
    private final List<CycleRecord> cycleHistory = new ArrayList<>();
    private SaturationMetrics saturationMetrics = SaturationMetrics.INITIAL;
    private String stopReason;
    private int cycle;
    private List<String> plannedCategories = new ArrayList<>();
    private Set<String> queriedCategories = new LinkedHashSet<>();
    private List<String> plannedSources = new ArrayList<>();
    private List<String> subQueries = new ArrayList<>();
    private Set<String> executedQueries = new LinkedHashSet<>();
    private List<String> cycleCitations = new ArrayList<>();
    private int cycleEntityBaseline;
    private int cycleFactBaseline;
    private int cycleResultBaseline;
    private boolean cycleExhausted;
    private final List<String> gaps = new ArrayList<>();
    private boolean partial;
    private boolean approved;
    private boolean stopRequested;
    private String model;
    private ResearchReport report;
    private long createdAt;
    private long updatedAt;

    public ResearchState() {
    }

    public static ResearchState start(String sessionId, String query, String domain, PrivacyMode privacyMode, long now) {
        ResearchState state = new ResearchState();
        state.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        state.query = Objects.requireNonNull(query, "query").trim();
        state.domain = domain != null && !domain.isBlank() ? domain.trim() : null;
        state.privacyModeExplicit = privacyMode != null;
        state.privacyMode = privacyMode != null ? privacyMode : PrivacyMode.LOCAL_ONLY;
        state.createdAt = now;
        state.updatedAt = now;
        return state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    /** Detected or user-chosen domain (e.g. "medical"); null until CLARIFY resolves it. */
    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public PrivacyMode getPrivacyMode() {
        return privacyMode;
    }

    public void setPrivacyMode(PrivacyMode privacyMode) {
        this.privacyMode = Objects.requireNonNull(privacyMode, "privacyMode");
    }

    /** True when the user chose the privacy mode; the advisor never overrides it. */
    public boolean isPrivacyModeExplicit() {
        return privacyModeExplicit;
    }

    public void setPrivacyModeExplicit(boolean privacyModeExplicit) {
        this.privacyModeExplicit = privacyModeExplicit;
    }

    public List<Entity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    @JsonSetter("entities")
    private void restoreEntities(List<Entity> values) {
        entities.clear();
        if (values != null) entities.addAll(values);
    }

    /** Adds the entity unless an equal one is already present. Returns true if it was new. */
    public boolean addEntity(Entity entity) {
        if (entity == null || entities.contains(entity)) return false;
        entities.add(entity);
        return true;
    }

    public List<Fact> getFacts() {
        return Collections.unmodifiableList(facts);
    }

    @JsonSetter("facts")
    private void restoreFacts(List<Fact> values) {
        facts.clear();
        if (values != null) facts.addAll(values);
    }

    public void addFact(Fact fact) {
        facts.add(Objects.requireNonNull(fact, "fact"));
    }

    /** Replaces all facts; used by verification after merging duplicates. */
    public void replaceFacts(List<Fact> values) {
        List<Fact> copy = new ArrayList<>(values);
        facts.clear();
        facts.addAll(copy);
    }

    public List<SourceResult> getSourceResults() {
        return Collections.unmodifiableList(sourceResults);
    }

    @JsonSetter("sourceResults")
    private void restoreSourceResults(List<SourceResult> values) {
        sourceResults.clear();
        if (values != null) sourceResults.addAll(values);
    }

    public void addSourceResult(SourceResult result) {
        sourceResults.add(Objects.requireNonNull(result, "result"));
    }

    @JsonIgnore
    public Set<String> getSourceUrls() {
        return sourceResults.stream().map(SourceResult::getUrl).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Results recorded since the current cycle began. */
    @JsonIgnore
    public List<SourceResult> getCycleResults() {
        int from = Math.min(cycleResultBaseline, sourceResults.size());
        return Collections.unmodifiableList(sourceResults.subList(from, sourceResults.size()));
    }

    public List<CycleRecord> getCycleHistory() {
        return Collections.unmodifiableList(cycleHistory);
    }

    @JsonSetter("cycleHistory")
    private void restoreCycleHistory(List<CycleRecord> values) {
        cycleHistory.clear();
        if (values != null) cycleHistory.addAll(values);
    }

    public void appendCycle(CycleRecord record) {
        cycleHistory.add(Objects.requireNonNull(record, "record"));
    }

    public SaturationMetrics getSaturationMetrics() {
        return saturationMetrics;
    }

    public void setSaturationMetrics(SaturationMetrics saturationMetrics) {
        this.saturationMetrics = saturationMetrics;
    }

    public String getStopReason() {
        return stopReason;
    }

    public void setStopReason(String stopReason) {
        this.stopReason = stopReason;
    }

    /** Appends a reason, separated from earlier ones by "; ". */
    public void appendStopReason(String reason) {
        if (reason == null || reason.isBlank()) return;
        stopReason = stopReason == null || stopReason.isBlank() ? reason : stopReason + "; " + reason;
    }

    public int getCycle() {
        return cycle;
    }

    public void setCycle(int cycle) {
        this.cycle = cycle;
    }

    /**
     * Starts a new collection cycle: bumps the counter and records baselines for new-entity,
     * new-fact and new-result counting.
     */
    public void beginCycle() {
        cycle++;
        cycleEntityBaseline = entities.size();
        cycleFactBaseline = facts.size();
        cycleResultBaseline = sourceResults.size();
        cycleCitations = new ArrayList<>();
        cycleExhausted = false;
    }

    public List<String> getPlannedCategories() {
        return Collections.unmodifiableList(plannedCategories);
    }

    public void setPlannedCategories(List<String> plannedCategories) {
        this.plannedCategories = plannedCategories != null ? new ArrayList<>(plannedCategories) : new ArrayList<>();
    }

    public Set<String> getQueriedCategories() {
        return Collections.unmodifiableSet(queriedCategories);
    }

    public void setQueriedCategories(Set<String> queriedCategories) {
        this.queriedCategories = queriedCategories != null ? new LinkedHashSet<>(queriedCategories) : new LinkedHashSet<>();
    }

    public void markCategoryQueried(String category) {
        if (category != null) queriedCategories.add(category);
    }

    /** Provider names chosen by PLAN for the current cycle, best first. */
    public List<String> getPlannedSources() {
        return Collections.unmodifiableList(plannedSources);
    }

    public void setPlannedSources(List<String> plannedSources) {
        this.plannedSources = plannedSources != null ? new ArrayList<>(plannedSources) : new ArrayList<>();
    }

    public List<String> getSubQueries() {
        return Collections.unmodifiableList(subQueries);
    }

    public void setSubQueries(List<String> subQueries) {
        this.subQueries = subQueries != null ? new ArrayList<>(subQueries) : new ArrayList<>();
    }

    /** Every sub-query already sent to providers in this session, in first-run order. */
    public Set<String> getExecutedQueries() {
        return Collections.unmodifiableSet(executedQueries);
    }

    public void setExecutedQueries(Set<String> executedQueries) {
        this.executedQueries = executedQueries != null ? new LinkedHashSet<>(executedQueries) : new LinkedHashSet<>();
    }

    public void markQueryExecuted(String subQuery) {
        if (subQuery != null && !subQuery.isBlank()) executedQueries.add(subQuery);
    }

    /** Every URL returned by providers this cycle, including ones already seen in earlier cycles. */
    public List<String> getCycleCitations() {
        return Collections.unmodifiableList(cycleCitations);
    }

    public void setCycleCitations(List<String> cycleCitations) {
        this.cycleCitations = cycleCitations != null ? new ArrayList<>(cycleCitations) : new ArrayList<>();
    }

    public void addCycleCitation(String url) {
        if (url != null && !url.isBlank()) cycleCitations.add(url);
    }

    public int getCycleEntityBaseline() {
        return cycleEntityBaseline;
    }

    public void setCycleEntityBaseline(int cycleEntityBaseline) {
        this.cycleEntityBaseline = cycleEntityBaseline;
    }

    public int getCycleFactBaseline() {
        return cycleFactBaseline;
    }

    public void setCycleFactBaseline(int cycleFactBaseline) {
        this.cycleFactBaseline = cycleFactBaseline;
    }

    public int getCycleResultBaseline() {
        return cycleResultBaseline;
    }

    public void setCycleResultBaseline(int cycleResultBaseline) {
        this.cycleResultBaseline = cycleResultBaseline;
    }

    /** True when every provider came back empty during this cycle's collection. */
    public boolean isCycleExhausted() {
        return cycleExhausted;
    }

    public void setCycleExhausted(boolean cycleExhausted) {
        this.cycleExhausted = cycleExhausted;
    }

    /** Lines for the report's "not found / why" section. */
    public List<String> getGaps() {
        return Collections.unmodifiableList(gaps);
    }

    @JsonSetter("gaps")
    private void restoreGaps(List<String> values) {
        gaps.clear();
        if (values != null) gaps.addAll(values);
    }

    public void addGap(String gap) {
        if (gap != null && !gap.isBlank() && !gaps.contains(gap)) gaps.add(gap);
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public boolean isApproved() {
        return approved;
    }

    public void setApproved(boolean approved) {
        this.approved = approved;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public void setStopRequested(boolean stopRequested) {
        this.stopRequested = stopRequested;
    }

    /** Last model used for a completion in this session. */
    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public ResearchReport getReport() {
        return report;
    }

    public void setReport(ResearchReport report) {
        this.report = report;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ResearchState fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("ResearchState JSON must not be blank");
        }
        try {
            return MAPPER.readValue(json, ResearchState.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
