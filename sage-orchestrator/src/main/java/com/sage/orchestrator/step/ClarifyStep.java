package com.sage.orchestrator.step;

import com.sage.llm.PrivacyAdvice;
import com.sage.llm.PrivacyRouter;
import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.orchestrator.domain.DomainDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves the domain and privacy mode and seeds the first sub-query. A domain or mode the user supplied is kept.
 */
public final class ClarifyStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(ClarifyStep.class);

    private final PrivacyRouter router;
    private final DomainDetector detector;

    public ClarifyStep(ResearchContext context) {
        this(context.getRouter(), new DomainDetector());
    }

    ClarifyStep(PrivacyRouter router, DomainDetector detector) {
        this.router = router;
        this.detector = detector;
    }

    @Override
    public Phase phase() {
        return Phase.CLARIFY;
    }

    @Override
    public Transition apply(ResearchState state) {
        if (state.getDomain() == null || state.getDomain().isBlank()) {
            state.setDomain(detector.detect(state.getQuery()).domain());
        }
        if (!state.isPrivacyModeExplicit()) {
            PrivacyAdvice advice = router.recommendPrivacyMode(state.getQuery(), null);
            state.setPrivacyMode(advice.mode());
            log.info("Session {} privacy mode {}: {}", state.getSessionId(), advice.mode(), advice.reasoning());
        }
        state.setSubQueries(List.of(state.getQuery()));
        return Transition.to(Phase.PLAN, "domain=" + state.getDomain() + " privacy=" + state.getPrivacyMode());
    }
}
