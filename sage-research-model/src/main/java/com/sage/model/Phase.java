package com.sage.model;

/**
 * Research session phases, in execution order. EVALUATE either loops back to PLAN or moves on to SYNTHESIZE.
 */
public enum Phase {
    CLARIFY,
    PLAN,
    AWAIT_APPROVAL,
    COLLECT,
    PROCESS,
    ANALYZE,
    EVALUATE,
    SYNTHESIZE,
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }
}
