package com.sage.orchestrator.step;

import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.Transition;

/** Holds the session until the plan is approved. */
public final class AwaitApprovalStep implements PhaseStep {

    @Override
    public Phase phase() {
        return Phase.AWAIT_APPROVAL;
    }

    @Override
    public Transition apply(ResearchState state) {
        if (state.isApproved()) {
            return Transition.to(Phase.COLLECT, "plan approved");
        }
        return Transition.to(Phase.AWAIT_APPROVAL, "waiting for approval of " + state.getPlannedSources());
    }
}
