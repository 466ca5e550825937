package com.sage.memory;

import com.sage.model.ResearchState;

import java.util.Optional;

/** Durable snapshots of a session's {@link ResearchState}, written after every phase transition. */
public interface CheckpointStore {

    void save(ResearchState state);

    Optional<ResearchState> load(String sessionId);

    /** Marks the session's checkpoint as finished; it stays loadable. */
    void archive(String sessionId);
}
