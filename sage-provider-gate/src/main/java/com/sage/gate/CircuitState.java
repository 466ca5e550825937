package com.sage.gate;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static CircuitState of(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }
}
