package com.sage.llm;

import com.sage.model.StreamEvent;
import com.sage.model.error.ModelException;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered channel of {@link StreamEvent}s from the router to one consumer.
 * <p>
 * The producer writes MODEL_INFO, then TOKENs, then exactly one terminal DONE or ERROR; anything written after the
 * terminal event is dropped. {@link #cancel()} closes the channel with DONE, so a consumer never blocks forever.
 */
public final class TokenStream {

    private final BlockingQueue<StreamEvent> queue = new LinkedBlockingQueue<>();
    private final Object lock = new Object();
    private boolean terminated;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    void modelInfo(String model) {
        offer(StreamEvent.modelInfo(model));
    }

    void token(String token) {
        if (token != null && !token.isEmpty()) offer(StreamEvent.token(token));
    }

    void done() {
        terminate(StreamEvent.done());
    }

    void error(String message) {
        terminate(StreamEvent.error(message));
    }

    /** Stops the stream; the consumer sees DONE (unless a terminal event was already queued). */
    public void cancel() {
        cancelled.set(true);
        terminate(StreamEvent.done());
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isTerminated() {
        synchronized (lock) {
            return terminated;
        }
    }

    /** Blocks until the next event. */
    public StreamEvent next() throws InterruptedException {
        return queue.take();
    }

    /** Next event, or null if none arrives within the timeout. */
    public StreamEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Drains the stream into text.
     *
     * @throws ModelException if the stream ends with ERROR
     */
    public String collect() throws InterruptedException {
        StringBuilder sb = new StringBuilder();
        while (true) {
            StreamEvent event = next();
            switch (event.getType()) {
                case TOKEN -> sb.append(event.getToken());
                case DONE -> {
                    return sb.toString();
                }
                case ERROR -> throw new ModelException(null, "Stream failed: " + event.getError());
                default -> {
                }
            }
        }
    }

    // the terminated check and the enqueue are one step, so nothing lands behind the terminal event
    private void offer(StreamEvent event) {
        synchronized (lock) {
            if (!terminated) queue.add(event);
        }
    }

    private void terminate(StreamEvent event) {
        synchronized (lock) {
            if (!terminated) {
                terminated = true;
                queue.add(event);
            }
        }
    }
}
