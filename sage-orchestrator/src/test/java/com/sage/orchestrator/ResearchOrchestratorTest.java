package com.sage.orchestrator;

import com.sage.model.ChatMessage;
import com.sage.model.Fact;
import com.sage.model.ModelTier;
import com.sage.model.Phase;
import com.sage.model.PrivacyMode;
import com.sage.model.ProgressSnapshot;
import com.sage.model.ResearchReport;
import com.sage.model.ResearchState;
import com.sage.model.SourceResult;
import com.sage.model.error.PrivacyViolationException;
import com.sage.saturation.SaturationEvaluator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchOrchestratorTest {

    private static final String QUERY = "diabetes treatments 2024";
    private static final String FACT_REPLY =
            "[{\"statement\": \"Metformin remains the first-line therapy for type 2 diabetes\", \"confidence\": 0.85}]";
    private static final String SUMMARY_REPLY = "Metformin is still the first-line therapy for type 2 diabetes.";

    private static final SourceResult PUBMED_RESULT = StubProvider.result("pubmed",
            "https://pubmed.ncbi.nlm.nih.gov/1", "Metformin in Type 2 Diabetes",
            "Metformin remains the first-line therapy for type 2 diabetes in 2024.");
    private static final SourceResult SCHOLAR_RESULT = StubProvider.result("semantic_scholar",
            "https://www.semanticscholar.org/paper/abc", "GLP-1 Agonists Review",
            "GLP-1 receptor agonists reduced HbA1c by 1.2 percent in adults.");

    private static ScriptedChatClient researchModel() {
        return new ScriptedChatClient(prompt -> prompt.contains("fact extraction assistant") ? FACT_REPLY : SUMMARY_REPLY);
    }

    @Test
    void exhaustedSourcesEndInSynthesisWithNotFoundSection() throws Exception {
        ScriptedChatClient model = researchModel();
        StubProvider pubmed = StubProvider.empty("pubmed");
        Sessions sessions = new Sessions()
                .provider(pubmed)
                .provider(StubProvider.empty("semantic_scholar"))
                .localModel(model);
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        ResearchState started = orchestrator.start(QUERY, null, PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        assertEquals(Phase.DONE, state.getPhase());
        assertEquals("medical", state.getDomain());
        assertEquals(PrivacyMode.LOCAL_ONLY, state.getPrivacyMode());
        assertEquals(2, state.getCycle());
        assertEquals(SaturationEvaluator.EXHAUSTED_REASON, state.getStopReason());
        assertEquals(2, state.getCycleHistory().size());
        assertTrue(state.getCycleHistory().stream().allMatch(r -> r.isSourceExhausted()));
        assertEquals(2, pubmed.queries.size());

        ResearchReport report = state.getReport();
        assertNotNull(report);
        assertEquals(SaturationEvaluator.EXHAUSTED_REASON, report.getStopReason());
        assertTrue(report.getNotFound().contains("No results from pubmed, semantic_scholar for \"" + QUERY + "\""),
                report.getNotFound().toString());
        assertTrue(report.getFacts().isEmpty());
        assertTrue(model.calls.isEmpty(), "no model needed without facts");

        assertEquals(0.35, sessions.store.getSourceEffectiveness("pubmed", "medical"), 1e-9);
        assertTrue(sessions.store.isArchived(started.getSessionId()));
    }

    @Test
    void repeatedResultsSaturateAfterTwoQuietCycles() throws Exception {
        ScriptedChatClient model = researchModel();
        Sessions sessions = new Sessions()
                .provider(StubProvider.fixed("pubmed", List.of(PUBMED_RESULT)))
                .provider(StubProvider.fixed("semantic_scholar", List.of(SCHOLAR_RESULT)))
                .localModel(model);
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        assertEquals(3, state.getCycle());
        assertTrue(state.getStopReason().startsWith("Saturation reached"), state.getStopReason());
        assertFalse(state.isPartial());
        assertEquals(2, state.getSourceResults().size());

        ResearchReport report = state.getReport();
        assertEquals(SUMMARY_REPLY, report.getSummary());
        assertEquals(Sessions.LOCAL_MODEL, report.getModel());
        assertEquals(1, report.getFacts().size());
        Fact fact = report.getFacts().get(0);
        assertEquals(2, fact.getSources().size());
        assertTrue(fact.isVerified());

        assertEquals(0.62, sessions.store.getSourceEffectiveness("pubmed", "medical"), 1e-9);
        assertFalse(sessions.store.searchSimilar("metformin", 5, Map.of("type", "source")).isEmpty());
    }

    @Test
    void stopRequestSynthesizesPartialResultsAtNextBoundary() throws Exception {
        AtomicReference<ResearchOrchestrator> ref = new AtomicReference<>();
        StubProvider pubmed = new StubProvider("pubmed", q -> {
            ref.get().requestStop();
            return List.of(PUBMED_RESULT);
        });
        Sessions sessions = new Sessions().provider(pubmed).localModel(researchModel());
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());
        ref.set(orchestrator);

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        assertEquals(Phase.DONE, state.getPhase());
        assertTrue(state.isStopRequested());
        assertTrue(state.isPartial());
        assertEquals(ResearchOrchestrator.STOPPED_BY_USER, state.getStopReason());
        assertEquals(1, state.getCycle());
        assertEquals(1, state.getReport().getSources().size());
        assertTrue(state.getReport().isPartial());
        assertTrue(state.getCycleHistory().isEmpty());
    }

    @Test
    void approvalPausesSessionUntilApproved() throws Exception {
        StubProvider pubmed = StubProvider.empty("pubmed");
        Sessions sessions = new Sessions()
                .provider(pubmed)
                .localModel(researchModel())
                .settings(new OrchestratorSettings(20, true, 3, 3));
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState paused = orchestrator.run();

        assertEquals(Phase.AWAIT_APPROVAL, paused.getPhase());
        assertEquals(List.of("pubmed"), paused.getPlannedSources());
        assertTrue(pubmed.queries.isEmpty());
        assertEquals(Phase.AWAIT_APPROVAL, orchestrator.snapshot().getPhase());

        orchestrator.approve();
        ResearchState done = orchestrator.run();

        assertEquals(Phase.DONE, done.getPhase());
        assertTrue(done.isApproved());
        assertEquals(2, pubmed.queries.size());
    }

    @Test
    void resumeContinuesFromCheckpointedPhase() throws Exception {
        Sessions sessions = new Sessions()
                .provider(StubProvider.fixed("pubmed", List.of(PUBMED_RESULT)))
                .localModel(researchModel())
                .settings(new OrchestratorSettings(20, true, 3, 3));
        ResearchOrchestrator first = new ResearchOrchestrator(sessions.context());
        String sessionId = first.start(QUERY, null, PrivacyMode.LOCAL_ONLY).getSessionId();
        assertEquals(Phase.AWAIT_APPROVAL, first.run().getPhase());

        AtomicInteger clarifyRuns = new AtomicInteger();
        ResearchContext context = sessions.context();
        TransitionTable table = TransitionTable.defaults(context).with(new PhaseStep() {
            @Override
            public Phase phase() {
                return Phase.CLARIFY;
            }

            @Override
            public Transition apply(ResearchState state) {
                clarifyRuns.incrementAndGet();
                return Transition.to(Phase.PLAN, "unexpected");
            }
        });
        ResearchOrchestrator second = new ResearchOrchestrator(context, table);
        second.approve();
        ResearchState resumed = second.resume(sessionId);

        assertEquals(0, clarifyRuns.get());
        assertEquals(sessionId, resumed.getSessionId());
        assertEquals(Phase.DONE, resumed.getPhase());
        assertEquals("medical", resumed.getDomain());
        assertTrue(sessions.store.isArchived(sessionId));
    }

    @Test
    void resumeOfUnknownSessionFails() {
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(new Sessions().localModel(researchModel()).context());

        assertThrows(IllegalArgumentException.class, () -> orchestrator.resume("missing"));
    }

    @Test
    void failingStepDegradesToPartialReport() throws Exception {
        Sessions sessions = new Sessions()
                .provider(StubProvider.fixed("pubmed", List.of(PUBMED_RESULT)))
                .localModel(researchModel());
        ResearchContext context = sessions.context();
        TransitionTable table = TransitionTable.defaults(context).with(new PhaseStep() {
            @Override
            public Phase phase() {
                return Phase.ANALYZE;
            }

            @Override
            public Transition apply(ResearchState state) {
                throw new IllegalStateException("verifier crashed");
            }
        });
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(context, table);

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        assertEquals(Phase.DONE, state.getPhase());
        assertTrue(state.getReport().isPartial());
        assertTrue(state.getReport().getNotFound().contains("Phase ANALYZE failed: verifier crashed"));
        assertEquals(SUMMARY_REPLY, state.getReport().getSummary());
        assertEquals(1.0, context.getMeterRegistry().counter("sage.orchestrator.step.failures", "phase", "ANALYZE").count());
    }

    @Test
    void failingSynthesisStillEndsWithMinimalReport() throws Exception {
        Sessions sessions = new Sessions().provider(StubProvider.empty("pubmed")).localModel(researchModel());
        ResearchContext context = sessions.context();
        TransitionTable table = TransitionTable.defaults(context).with(new PhaseStep() {
            @Override
            public Phase phase() {
                return Phase.SYNTHESIZE;
            }

            @Override
            public Transition apply(ResearchState state) {
                throw new IllegalStateException("renderer broke");
            }
        });
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(context, table);

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        assertEquals(Phase.DONE, state.getPhase());
        assertTrue(state.getReport().isPartial());
        assertTrue(state.getReport().getNotFound().contains("Report synthesis failed: renderer broke"));
    }

    @Test
    void privacyViolationIsCheckpointedAndRethrown() {
        ScriptedChatClient cloud = new ScriptedChatClient(prompt -> "leaked");
        Sessions sessions = new Sessions()
                .provider(StubProvider.fixed("pubmed", List.of(PUBMED_RESULT)))
                .localModel(researchModel())
                .model("gpt-4o", ModelTier.CLOUD_BEST, cloud);
        ResearchContext context = sessions.context();
        TransitionTable table = TransitionTable.defaults(context).with(new PhaseStep() {
            @Override
            public Phase phase() {
                return Phase.PROCESS;
            }

            @Override
            public Transition apply(ResearchState state) throws InterruptedException {
                context.getRouter().complete(List.of(ChatMessage.user(state.getQuery())), "gpt-4o", state.getPrivacyMode());
                return Transition.to(Phase.ANALYZE, "unreachable");
            }
        });
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(context, table);
        String sessionId = orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY).getSessionId();

        assertThrows(PrivacyViolationException.class, orchestrator::run);

        ResearchState saved = sessions.store.load(sessionId).orElseThrow();
        assertEquals(Phase.PROCESS, saved.getPhase());
        assertTrue(saved.getGaps().stream().anyMatch(g -> g.startsWith("Privacy violation in PROCESS")), saved.getGaps().toString());
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void missingModelProducesPartialReportWithHeuristicFacts() throws Exception {
        ScriptedChatClient model = researchModel();
        model.available = false;
        SourceResult trial = StubProvider.result("pubmed", "https://pubmed.ncbi.nlm.nih.gov/2", "Metformin Trial",
                "Metformin lowered HbA1c by 1.1 percent in a 2023 trial of 400 adults.");
        Sessions sessions = new Sessions()
                .provider(StubProvider.fixed("pubmed", List.of(trial)))
                .localModel(model);
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        ResearchState state = orchestrator.run();

        ResearchReport report = state.getReport();
        assertTrue(report.isPartial());
        assertNull(report.getModel());
        assertTrue(report.getSummary().startsWith("Research on '" + QUERY + "' found"), report.getSummary());
        assertTrue(report.getNotFound().stream().anyMatch(g -> g.startsWith("Executive summary not generated")));
        assertFalse(report.getFacts().isEmpty());
        assertTrue(model.calls.isEmpty());
    }

    @Test
    void progressIsPublishedAfterEveryTransition() throws Exception {
        Sessions sessions = new Sessions().provider(StubProvider.empty("pubmed")).localModel(researchModel());
        List<ProgressSnapshot> seen = new ArrayList<>();
        sessions.broadcaster.subscribe(seen::add);
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        orchestrator.start(QUERY, "medical", PrivacyMode.LOCAL_ONLY);
        orchestrator.run();

        assertEquals(Phase.CLARIFY, seen.get(0).getPhase());
        assertEquals(Phase.DONE, seen.get(seen.size() - 1).getPhase());
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i).getSequence() > seen.get(i - 1).getSequence());
        }
        assertEquals(seen.get(seen.size() - 1).getSequence(), orchestrator.snapshot().getSequence());
    }

    @Test
    void advisorChoosesModeWhenNoneGiven() throws Exception {
        Sessions sessions = new Sessions()
                .provider(StubProvider.empty("tavily"))
                .localModel(new ScriptedChatClient(prompt -> "PUBLIC"));
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(sessions.context());

        orchestrator.start("open source vector databases", "general", null);
        ResearchState state = orchestrator.run();

        assertEquals(PrivacyMode.CLOUD_ALLOWED, state.getPrivacyMode());

        ResearchOrchestrator sensitive = new ResearchOrchestrator(sessions.context());
        sensitive.start("patient records retention for our clinic", "general", null);
        assertEquals(PrivacyMode.LOCAL_ONLY, sensitive.run().getPrivacyMode());
    }
}
