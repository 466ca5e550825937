package com.sage.orchestrator;

import com.sage.memory.ResilientMemory;
import com.sage.model.Phase;
import com.sage.model.PrivacyMode;
import com.sage.model.ProgressSnapshot;
import com.sage.model.ResearchReport;
import com.sage.model.ResearchState;
import com.sage.model.SourceResult;
import com.sage.model.error.PrivacyViolationException;
import com.sage.orchestrator.domain.DomainConfiguration;
import com.sage.orchestrator.step.SynthesizeStep;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Drives one research session through its phases.
 * <p>
 * After every transition the state is checkpointed and a progress snapshot is published, so a session can be
 * resumed from its last phase. Stop requests and approvals may arrive from other threads; they take effect at
 * the next transition boundary. When the session completes, source effectiveness is learned from what each
 * provider returned, the checkpoint is archived and the report is exported.
 */
public final class ResearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResearchOrchestrator.class);

    public static final String STOPPED_BY_USER = "stopped by user";

    private final ResearchContext context;
    private final TransitionTable table;
    private final ResilientMemory memory;
    private final MeterRegistry meters;

    private volatile boolean stopRequested;
    private volatile boolean approved;
    private volatile ResearchState state;

    public ResearchOrchestrator(ResearchContext context) {
        this(context, TransitionTable.defaults(context));
    }

    public ResearchOrchestrator(ResearchContext context, TransitionTable table) {
        this.context = Objects.requireNonNull(context, "context");
        this.table = Objects.requireNonNull(table, "table");
        this.memory = context.getMemory();
        this.meters = context.getMeterRegistry();
    }

    /**
     * Creates the session state and checkpoints it in CLARIFY.
     *
     * @param domain      domain name, or null to detect it from the query
     * @param privacyMode explicit mode, or null to let the advisor recommend one
     */
    public ResearchState start(String query, String domain, PrivacyMode privacyMode) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (state != null) {
            throw new IllegalStateException("Session " + state.getSessionId() + " already started");
        }
        ResearchState created = ResearchState.start(UUID.randomUUID().toString(), query, domain, privacyMode,
                context.getClock().nowMillis());
        state = created;
        checkpoint(created);
        log.info("Started session {} for query={} domain={} privacy={}", created.getSessionId(), created.getQuery(),
                domain, privacyMode);
        return created;
    }

    /**
     * Loads the last checkpoint of a session and continues from its stored phase.
     *
     * @throws IllegalArgumentException when no checkpoint exists for the session
     */
    public ResearchState resume(String sessionId) throws InterruptedException {
        ResearchState loaded = memory.load(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("No checkpoint for session " + sessionId));
        state = loaded;
        log.info("Resuming session {} at phase {} (cycle {})", sessionId, loaded.getPhase(), loaded.getCycle());
        return run();
    }

    /**
     * Runs phases until the session is DONE or waits for approval.
     *
     * @throws PrivacyViolationException after checkpointing, when a step tried to use a model the mode forbids
     */
    public ResearchState run() throws InterruptedException {
        ResearchState s = requireState();
        if (s.getPhase().isTerminal()) {
            log.info("Session {} is already complete", s.getSessionId());
            return s;
        }
        while (!s.getPhase().isTerminal()) {
            if (stopRequested && !s.isStopRequested() && s.getPhase() != Phase.SYNTHESIZE) {
                applyStop(s);
                continue;
            }
            if (approved && !s.isApproved()) {
                s.setApproved(true);
            }
            if (s.getPhase() == Phase.AWAIT_APPROVAL && !s.isApproved()) {
                log.info("Session {} waiting for approval of plan {}", s.getSessionId(), s.getPlannedSources());
                checkpoint(s);
                return s;
            }
            Phase current = s.getPhase();
            Transition transition = execute(current, s);
            s.setPhase(transition.next());
            s.setUpdatedAt(context.getClock().nowMillis());
            meters.counter("sage.orchestrator.transitions", "from", current.name(), "to", transition.next().name())
                    .increment();
            log.info("Session {} {} -> {}: {}", s.getSessionId(), current, transition.next(), transition.note());
            checkpoint(s);
        }
        complete(s);
        return s;
    }

    private Transition execute(Phase current, ResearchState s) throws InterruptedException {
        PhaseStep step = table.forPhase(current);
        try {
            return step.apply(s);
        } catch (PrivacyViolationException e) {
            s.addGap("Privacy violation in " + current + ": " + e.getMessage());
            checkpoint(s);
            log.error("Session {} halted in {}: {}", s.getSessionId(), current, e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            checkpoint(s);
            throw e;
        } catch (RuntimeException e) {
            log.warn("Session {} phase {} failed; continuing with partial results. Error: {}",
                    s.getSessionId(), current, e.getMessage(), e);
            s.setPartial(true);
            meters.counter("sage.orchestrator.step.failures", "phase", current.name()).increment();
            if (current == Phase.SYNTHESIZE) {
                s.setReport(SynthesizeStep.minimalReport(s, describe(e)));
                return Transition.to(Phase.DONE, "synthesis failed");
            }
            s.addGap("Phase " + current + " failed: " + describe(e));
            return Transition.to(Phase.SYNTHESIZE, current + " failed");
        }
    }

    private void applyStop(ResearchState s) {
        Phase from = s.getPhase();
        s.setStopRequested(true);
        s.setPartial(true);
        s.appendStopReason(STOPPED_BY_USER);
        s.setPhase(Phase.SYNTHESIZE);
        s.setUpdatedAt(context.getClock().nowMillis());
        log.info("Session {} stop requested in {}; synthesizing partial results", s.getSessionId(), from);
        checkpoint(s);
    }

    private void complete(ResearchState s) {
        if (s.getReport() == null) {
            s.setPartial(true);
            s.setReport(SynthesizeStep.minimalReport(s, "no report was produced"));
        }
        learn(s);
        ResearchReport report = s.getReport();
        memory.storeDocument(report.getSummary().isBlank() ? s.getQuery() : report.getSummary(),
                reportMetadata(s), s.getSessionId());
        checkpoint(s);
        memory.archive(s.getSessionId());
        try {
            String location = context.getExporter().export(report);
            if (location != null) {
                log.info("Session {} report exported to {}", s.getSessionId(), location);
            }
        } catch (IOException e) {
            log.warn("Session {} report export failed. Error: {}", s.getSessionId(), e.getMessage(), e);
        }
        meters.counter("sage.orchestrator.sessions", "partial", String.valueOf(s.isPartial())).increment();
        log.info("Session {} complete after {} cycle(s): {}", s.getSessionId(), s.getCycle(), s.getStopReason());
    }

    /** Updates learned effectiveness for every provider queried in the session. */
    private void learn(ResearchState s) {
        String domain = DomainConfiguration.forDomain(s.getDomain()).name();
        Set<String> providers = new LinkedHashSet<>(s.getQueriedCategories());
        for (SourceResult r : s.getSourceResults()) providers.add(r.getProvider());
        for (String provider : providers) {
            List<SourceResult> mine = s.getSourceResults().stream()
                    .filter(r -> provider.equals(r.getProvider()) && r.isSuccess())
                    .toList();
            boolean success = !mine.isEmpty();
            double quality = mine.stream().mapToDouble(SourceResult::getQualityScore).average().orElse(0.0);
            memory.updateSourceEffectiveness(provider, domain, success, quality);
        }
    }

    private static Map<String, String> reportMetadata(ResearchState s) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("type", "report");
        m.put("query", s.getQuery());
        m.put("domain", DomainConfiguration.forDomain(s.getDomain()).name());
        m.put("partial", String.valueOf(s.isPartial()));
        return m;
    }

    /** Asks the session to stop; it moves to synthesis with what it has at the next transition. */
    public void requestStop() {
        stopRequested = true;
        log.info("Stop requested for session {}", state != null ? state.getSessionId() : "(not started)");
    }

    /** Approves the plan of a session waiting in AWAIT_APPROVAL; call {@link #run()} again to continue. */
    public void approve() {
        approved = true;
    }

    public ProgressSnapshot snapshot() {
        ProgressSnapshot latest = context.getBroadcaster().latest();
        ResearchState s = state;
        if (latest != null && s != null && Objects.equals(latest.getSessionId(), s.getSessionId())) {
            return latest;
        }
        return s != null ? ProgressSnapshot.of(s) : null;
    }

    public ResearchState getState() {
        return state;
    }

    private ResearchState requireState() {
        ResearchState s = state;
        if (s == null) {
            throw new IllegalStateException("No session: call start() or resume() first");
        }
        return s;
    }

    private void checkpoint(ResearchState s) {
        memory.save(s);
        context.getBroadcaster().publish(s);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
