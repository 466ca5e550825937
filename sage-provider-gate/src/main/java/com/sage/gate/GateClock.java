package com.sage.gate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Time source for circuit cooldowns, model backoff and session timestamps. Tests substitute a manual clock.
 */
public interface GateClock {

    GateClock SYSTEM = new GateClock() {
        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            if (millis > 0) Thread.sleep(millis);
        }
    };

    long nowMillis();

    void sleep(long millis) throws InterruptedException;

    /** This clock as a UTC {@link Clock}, for libraries that take one. */
    default Clock asJavaClock() {
        GateClock source = this;
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public long millis() {
                return source.nowMillis();
            }

            @Override
            public Instant instant() {
                return Instant.ofEpochMilli(source.nowMillis());
            }
        };
    }
}
