package com.sage.orchestrator;

import com.sage.model.Phase;

import java.util.Objects;

/**
 * Outcome of a {@link PhaseStep}: the next phase plus a short note for the log.
 */
public record Transition(Phase next, String note) {

    public Transition {
        Objects.requireNonNull(next, "next");
        note = note != null ? note : "";
    }

    public static Transition to(Phase next, String note) {
        return new Transition(next, note);
    }
}
