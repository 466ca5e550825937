package com.sage.orchestrator.step;

import com.sage.gate.GateClock;
import com.sage.model.CycleRecord;
import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.model.SaturationMetrics;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.saturation.SaturationEvaluator;
import com.sage.saturation.StopDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the cycle's saturation metrics and decides between another cycle and synthesis.
 */
public final class EvaluateStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(EvaluateStep.class);

    static final String SATURATED_PREFIX = "Saturation reached";

    private final SaturationEvaluator evaluator;
    private final GateClock clock;

    public EvaluateStep(ResearchContext context) {
        this(context.getEvaluator(), context.getClock());
    }

    EvaluateStep(SaturationEvaluator evaluator, GateClock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    @Override
    public Phase phase() {
        return Phase.EVALUATE;
    }

    @Override
    public Transition apply(ResearchState state) {
        SaturationMetrics metrics = evaluator.evaluate(state);
        state.setSaturationMetrics(metrics);
        CycleRecord record = evaluator.record(state, metrics, clock.nowMillis());
        state.appendCycle(record);

        StopDecision decision = evaluator.shouldStop(metrics, state.getCycleHistory());
        log.info("Session {} cycle {} metrics [{}] stop={} reason={}",
                state.getSessionId(), state.getCycle(), metrics, decision.stop(), decision.reason());
        if (!decision.stop()) {
            return Transition.to(Phase.PLAN, decision.reason());
        }
        state.appendStopReason(decision.reason());
        if (!decision.reason().startsWith(SATURATED_PREFIX)) {
            state.addGap("Collection stopped before saturation: " + decision.reason());
        }
        return Transition.to(Phase.SYNTHESIZE, decision.reason());
    }
}
