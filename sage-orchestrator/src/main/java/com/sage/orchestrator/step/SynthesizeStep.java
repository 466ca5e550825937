package com.sage.orchestrator.step;

import com.sage.llm.Completion;
import com.sage.llm.PrivacyRouter;
import com.sage.model.ChatMessage;
import com.sage.model.Fact;
import com.sage.model.Phase;
import com.sage.model.ResearchReport;
import com.sage.model.ResearchState;
import com.sage.model.TaskComplexity;
import com.sage.model.error.ModelUnavailableException;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Builds the report: facts by confidence, every source, an executive summary written by the best model the
 * privacy mode allows, and the gaps as the "not found" section. Without a usable model the report is partial.
 */
public final class SynthesizeStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(SynthesizeStep.class);

    static final int MAX_FINDINGS = 10;
    static final String NO_FACTS_SUMMARY = "No facts were extracted from the sources. "
            + "The research query may need refinement or additional sources.";

    private static final String PROMPT = "You are a research analyst writing an executive summary.\n"
            + "Research Question: %s\n"
            + "Domain: %s\n"
            + "Key Findings:\n%s\n"
            + "Write a concise executive summary (2-3 paragraphs) that directly answers the research question, "
            + "highlights the most important findings and notes the confidence level based on source agreement, "
            + "in a professional, objective tone.\n"
            + "Write ONLY the summary, no headers or labels.";

    private final PrivacyRouter router;

    public SynthesizeStep(ResearchContext context) {
        this(context.getRouter());
    }

    SynthesizeStep(PrivacyRouter router) {
        this.router = router;
    }

    @Override
    public Phase phase() {
        return Phase.SYNTHESIZE;
    }

    @Override
    public Transition apply(ResearchState state) throws InterruptedException {
        List<Fact> ranked = new ArrayList<>(state.getFacts());
        ranked.sort(Comparator.comparingDouble(Fact::getConfidence).reversed());

        String summary;
        String model = null;
        if (ranked.isEmpty()) {
            summary = NO_FACTS_SUMMARY;
        } else {
            try {
                Completion completion = router.complete(List.of(ChatMessage.user(prompt(state, ranked))),
                        TaskComplexity.HIGH, state.getPrivacyMode());
                summary = completion.text().trim();
                model = completion.model();
                state.setModel(model);
            } catch (ModelUnavailableException e) {
                log.warn("Session {} summary not generated; no model available. Error: {}",
                        state.getSessionId(), e.getMessage());
                state.setPartial(true);
                state.addGap("Executive summary not generated: no model available under "
                        + state.getPrivacyMode() + " (" + e.getMessage() + ")");
                summary = fallbackSummary(state.getQuery(), ranked);
            }
        }

        ResearchReport report = new ResearchReport(state.getSessionId(), state.getQuery(), state.getDomain(),
                state.getPrivacyMode(), summary, ranked, state.getSourceResults(), state.getGaps(),
                state.isPartial(), state.getStopReason(), state.getCycle(), model);
        state.setReport(report);
        return Transition.to(Phase.DONE, ranked.size() + " fact(s), " + state.getSourceResults().size()
                + " source(s)" + (state.isPartial() ? ", partial" : ""));
    }

    private static String prompt(ResearchState state, List<Fact> ranked) {
        StringBuilder findings = new StringBuilder();
        for (Fact f : ranked.subList(0, Math.min(MAX_FINDINGS, ranked.size()))) {
            findings.append(String.format(Locale.ROOT, "- %s (confidence: %.0f%%, sources: %d)%n",
                    f.getStatement(), f.getConfidence() * 100, f.getSources().size()));
        }
        return String.format(PROMPT, state.getQuery(), state.getDomain(), findings);
    }

    static String fallbackSummary(String query, List<Fact> ranked) {
        return "Research on '" + query + "' found " + ranked.size() + " key finding(s). "
                + "The highest confidence finding: " + ranked.get(0).getStatement();
    }

    /** Bare report used when synthesis itself fails. */
    public static ResearchReport minimalReport(ResearchState state, String failure) {
        List<String> notFound = new ArrayList<>(state.getGaps());
        notFound.add("Report synthesis failed: " + failure);
        return new ResearchReport(state.getSessionId(), state.getQuery(), state.getDomain(), state.getPrivacyMode(),
                "", state.getFacts(), state.getSourceResults(), notFound, true, state.getStopReason(),
                state.getCycle(), null);
    }
}
