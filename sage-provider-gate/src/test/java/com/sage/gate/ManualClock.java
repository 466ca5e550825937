package com.sage.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Clock whose sleep advances time instantly; records every requested sleep. */
final class ManualClock implements GateClock {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    final List<Long> sleeps = new ArrayList<>();

    @Override
    public long nowMillis() {
        return now.get();
    }

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
        now.addAndGet(Math.max(0, millis));
    }

    void advance(long millis) {
        now.addAndGet(millis);
    }
}
