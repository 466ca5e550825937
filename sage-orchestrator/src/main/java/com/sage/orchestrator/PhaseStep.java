package com.sage.orchestrator;

import com.sage.model.Phase;
import com.sage.model.ResearchState;

/**
 * Executes one research phase. The step mutates the state it is given and names the phase to run next;
 * checkpointing and progress publishing are left to the orchestrator.
 */
public interface PhaseStep {

    Phase phase();

    Transition apply(ResearchState state) throws InterruptedException;
}
