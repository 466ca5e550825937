package com.sage.orchestrator;

import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.orchestrator.step.AnalyzeStep;
import com.sage.orchestrator.step.AwaitApprovalStep;
import com.sage.orchestrator.step.ClarifyStep;
import com.sage.orchestrator.step.CollectStep;
import com.sage.orchestrator.step.EvaluateStep;
import com.sage.orchestrator.step.PlanStep;
import com.sage.orchestrator.step.ProcessStep;
import com.sage.orchestrator.step.SynthesizeStep;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each phase to the step that executes it. Phases without a step (DONE) resolve to a terminal no-op.
 */
public final class TransitionTable {

    private final Map<Phase, PhaseStep> steps = new EnumMap<>(Phase.class);
    private final PhaseStep terminal = new TerminalStep();

    public TransitionTable(List<PhaseStep> stepList) {
        for (PhaseStep step : stepList) {
            steps.put(step.phase(), step);
        }
    }

    /** The standard research pipeline wired against the given context. */
    public static TransitionTable defaults(ResearchContext context) {
        return new TransitionTable(List.of(
                new ClarifyStep(context),
                new PlanStep(context),
                new AwaitApprovalStep(),
                new CollectStep(context),
                new ProcessStep(context),
                new AnalyzeStep(context),
                new EvaluateStep(context),
                new SynthesizeStep(context)));
    }

    public PhaseStep forPhase(Phase phase) {
        if (phase == null) {
            return terminal;
        }
        return steps.getOrDefault(phase, terminal);
    }

    /** Returns a copy of this table with one step replaced. */
    public TransitionTable with(PhaseStep step) {
        TransitionTable copy = new TransitionTable(List.copyOf(steps.values()));
        copy.steps.put(step.phase(), step);
        return copy;
    }

    private static final class TerminalStep implements PhaseStep {
        @Override
        public Phase phase() {
            return Phase.DONE;
        }

        @Override
        public Transition apply(ResearchState state) {
            return Transition.to(Phase.DONE, "terminal");
        }
    }
}
