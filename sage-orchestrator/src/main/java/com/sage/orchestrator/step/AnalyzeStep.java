package com.sage.orchestrator.step;

import com.sage.model.Fact;
import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.orchestrator.domain.DomainConfiguration;
import com.sage.orchestrator.verify.Verifier;

import java.util.List;

/** Cross-verifies all facts gathered so far against the domain's verification threshold. */
public final class AnalyzeStep implements PhaseStep {

    private final Verifier verifier;

    public AnalyzeStep(ResearchContext context) {
        this.verifier = context.getVerifier();
    }

    @Override
    public Phase phase() {
        return Phase.ANALYZE;
    }

    @Override
    public Transition apply(ResearchState state) {
        double threshold = DomainConfiguration.forDomain(state.getDomain()).verificationThreshold();
        List<Fact> verified = verifier.verify(state.getFacts(), threshold);
        state.replaceFacts(verified);
        long count = verified.stream().filter(Fact::isVerified).count();
        return Transition.to(Phase.EVALUATE, count + " of " + verified.size() + " fact(s) verified");
    }
}
