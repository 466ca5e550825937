package com.sage.progress;

import com.sage.model.ProgressSnapshot;
import com.sage.model.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans progress snapshots out to listeners.
 * <p>
 * Each published snapshot gets the next sequence number. A new subscriber immediately receives the latest
 * snapshot, so a client that reconnects catches up without polling. A failing listener is logged and skipped.
 */
public final class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final CopyOnWriteArrayList<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<ProgressSnapshot> latest = new AtomicReference<>();

    /** Registers a listener and replays the latest snapshot to it. Returns a handle that unsubscribes. */
    public Runnable subscribe(ProgressListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        ProgressSnapshot current = latest.get();
        if (current != null) deliver(listener, current);
        return () -> listeners.remove(listener);
    }

    public ProgressSnapshot publish(ResearchState state) {
        return publish(ProgressSnapshot.of(state));
    }

    /** Numbers the snapshot, keeps it as the latest and delivers it to every listener. */
    public ProgressSnapshot publish(ProgressSnapshot snapshot) {
        ProgressSnapshot numbered;
        synchronized (this) {
            numbered = snapshot.withSequence(sequence.incrementAndGet());
            latest.set(numbered);
        }
        for (ProgressListener listener : listeners) {
            deliver(listener, numbered);
        }
        return numbered;
    }

    /** Latest snapshot, or null before the first publish. */
    public ProgressSnapshot latest() {
        return latest.get();
    }

    public int listenerCount() {
        return listeners.size();
    }

    private static void deliver(ProgressListener listener, ProgressSnapshot snapshot) {
        try {
            listener.onProgress(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener {} failed on sequence {}; continuing. Error: {}",
                    listener.getClass().getSimpleName(), snapshot.getSequence(), e.getMessage(), e);
        }
    }
}
