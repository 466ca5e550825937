package com.sage.saturation;

import com.sage.model.CycleRecord;
import com.sage.model.ResearchState;
import com.sage.model.SaturationMetrics;
import com.sage.model.SourceResult;
import com.sage.model.error.SaturationNotReachedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Computes per-cycle growth and coverage metrics and decides when collection should stop.
 * <p>
 * Decisions look only at the current metrics and the stored flags of earlier {@link CycleRecord}s;
 * history is append-only, so nothing is recomputed.
 */
public final class SaturationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SaturationEvaluator.class);

    public static final String EXHAUSTED_REASON = "all configured sources exhausted without results";

    private final SaturationPolicy policy;

    public SaturationEvaluator(SaturationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public SaturationPolicy getPolicy() {
        return policy;
    }

    /**
     * @param newEntities    entities added this cycle
     * @param totalEntities  entities known after this cycle
     * @param newFacts       facts added this cycle
     * @param totalFacts     facts known after this cycle
     * @param cycleCitations every URL cited this cycle, repeats included
     * @param seenBefore     URLs already known before this cycle began
     * @param planned        source categories planned for the session
     * @param queried        source categories queried so far
     */
    public SaturationMetrics evaluate(int newEntities, int totalEntities, int newFacts, int totalFacts,
                                      Collection<String> cycleCitations, Set<String> seenBefore,
                                      Collection<String> planned, Collection<String> queried) {
        double entityRatio = Math.max(0, newEntities) / (double) Math.max(1, totalEntities);
        double factRatio = Math.max(0, newFacts) / (double) Math.max(1, totalFacts);
        return new SaturationMetrics(entityRatio, factRatio, circularity(cycleCitations, seenBefore),
                coverage(planned, queried));
    }

    /** Metrics for the cycle the state is currently in, using the baselines recorded when it began. */
    public SaturationMetrics evaluate(ResearchState state) {
        List<SourceResult> results = state.getSourceResults();
        int baseline = Math.min(state.getCycleResultBaseline(), results.size());
        Set<String> seenBefore = new HashSet<>();
        for (SourceResult r : results.subList(0, baseline)) seenBefore.add(r.getUrl());
        return evaluate(
                state.getEntities().size() - state.getCycleEntityBaseline(), state.getEntities().size(),
                state.getFacts().size() - state.getCycleFactBaseline(), state.getFacts().size(),
                state.getCycleCitations(), seenBefore,
                state.getPlannedCategories(), state.getQueriedCategories());
    }

    public boolean isConditionMet(SaturationMetrics m) {
        return m.getNewEntitiesRatio() < policy.entityThreshold()
                && m.getNewFactsRatio() < policy.factThreshold()
                && m.getSourceCoverage() >= policy.coverageThreshold();
    }

    /** Builds the history record for the state's current cycle; the condition flag is fixed here. */
    public CycleRecord record(ResearchState state, SaturationMetrics metrics, long now) {
        return new CycleRecord(state.getCycle(), metrics,
                Math.max(0, state.getEntities().size() - state.getCycleEntityBaseline()),
                Math.max(0, state.getFacts().size() - state.getCycleFactBaseline()),
                state.getCycleResults().size(),
                state.isCycleExhausted(),
                !state.isCycleExhausted() && isConditionMet(metrics),
                now);
    }

    /**
     * Decides whether to stop. {@code cycleHistory} must already contain the current cycle's record as its last
     * element. Checks, in order: source exhaustion over the debounce window, saturation over the debounce window,
     * then the hard cycle cap.
     */
    public StopDecision shouldStop(SaturationMetrics metrics, List<CycleRecord> cycleHistory) {
        int window = policy.debounceWindow();
        int size = cycleHistory.size();
        if (size >= window && lastN(cycleHistory, window).stream().allMatch(CycleRecord::isSourceExhausted)) {
            log.info("Stopping: sources exhausted for {} consecutive cycle(s)", window);
            return StopDecision.stop(EXHAUSTED_REASON);
        }
        boolean current = isConditionMet(metrics);
        if (current && size >= window
                && lastN(cycleHistory.subList(0, size - 1), window - 1).stream().allMatch(CycleRecord::isSaturationConditionMet)) {
            String reason = String.format(Locale.ROOT,
                    "Saturation reached: new entities %.0f%%, new facts %.0f%%, coverage %.0f%% for %d consecutive cycles",
                    metrics.getNewEntitiesRatio() * 100, metrics.getNewFactsRatio() * 100,
                    metrics.getSourceCoverage() * 100, window);
            log.info("Stopping: {}", reason);
            return StopDecision.stop(reason);
        }
        int cycle = size == 0 ? 0 : cycleHistory.get(size - 1).getCycle();
        if (cycle >= policy.maxCycles()) {
            log.info("Stopping at hard cap of {} cycles", policy.maxCycles());
            return StopDecision.stop("Maximum cycles reached (" + policy.maxCycles() + ")");
        }
        String reason = current
                ? "Saturation condition met but not yet for " + window + " consecutive cycles"
                : "Still finding new information (" + metrics + ")";
        log.debug("Continuing after cycle {}: {}", cycle, reason);
        return StopDecision.proceed(reason);
    }

    /**
     * Like {@link #shouldStop} but reports a non-saturated finish as {@link SaturationNotReachedException}:
     * returns normally only when collection should stop because saturation was reached.
     *
     * @throws SaturationNotReachedException with the decision's reason otherwise
     */
    public void checkSaturated(SaturationMetrics metrics, List<CycleRecord> cycleHistory) {
        StopDecision decision = shouldStop(metrics, cycleHistory);
        if (!decision.stop() || !decision.reason().startsWith("Saturation reached")) {
            throw new SaturationNotReachedException(decision.reason());
        }
    }

    static double circularity(Collection<String> cycleCitations, Set<String> seenBefore) {
        if (cycleCitations == null || cycleCitations.isEmpty()) return 0.0;
        long repeats = cycleCitations.stream().filter(seenBefore::contains).count();
        return repeats / (double) cycleCitations.size();
    }

    static double coverage(Collection<String> planned, Collection<String> queried) {
        if (planned == null || planned.isEmpty()) return 1.0;
        Set<String> plannedSet = new HashSet<>(planned);
        long hit = queried == null ? 0 : queried.stream().filter(plannedSet::contains).distinct().count();
        return hit / (double) plannedSet.size();
    }

    private static List<CycleRecord> lastN(List<CycleRecord> history, int n) {
        if (n <= 0) return List.of();
        return history.subList(Math.max(0, history.size() - n), history.size());
    }
}
