package com.sage.gate;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GateSettingsTest {

    @Test
    void halfOpen_admitsSingleCallerAmongConcurrentCallers() throws Exception {
        ManualClock clock = new ManualClock();
        GateSettings settings = new GateSettings(1, 1_000L, 8_000L, 1, 1L, 1L);
        CircuitBreaker breaker = CircuitBreaker.of("p", settings.circuitBreakerConfig(clock));
        assertTrue(breaker.tryAcquirePermission());
        breaker.onError(1, TimeUnit.MILLISECONDS, new IOException("reset"));
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        clock.advance(1_001L);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return breaker.tryAcquirePermission();
                }));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(5, TimeUnit.SECONDS)) admitted++;
            }
            assertEquals(1, admitted);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void circuitStaysClosedUntilThresholdFailuresInARow() {
        CircuitBreaker breaker = CircuitBreaker.of("p", GateSettings.defaults().circuitBreakerConfig(new ManualClock()));
        for (int i = 0; i < 4; i++) fail(breaker);
        breaker.acquirePermission();
        breaker.onSuccess(1, TimeUnit.MILLISECONDS);
        for (int i = 0; i < 4; i++) fail(breaker);
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());

        fail(breaker);
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.tryAcquirePermission());
    }

    @Test
    void cooldownsDoubleToTheCap() {
        GateSettings settings = GateSettings.defaults();
        assertEquals(30_000L, (long) settings.cooldowns().apply(1));
        assertEquals(60_000L, (long) settings.cooldowns().apply(2));
        assertEquals(600_000L, (long) settings.cooldowns().apply(10));
    }

    @Test
    void rateLimiterPeriodFollowsRequestsPerSecond() {
        assertEquals(3_030L, GateSettings.rateLimiterConfig(0.33).getLimitRefreshPeriod().toMillis());
        assertEquals(1, GateSettings.rateLimiterConfig(3.0).getLimitForPeriod());
        assertThrows(IllegalArgumentException.class, () -> GateSettings.rateLimiterConfig(0.0));
    }

    private static void fail(CircuitBreaker breaker) {
        breaker.acquirePermission();
        breaker.onError(1, TimeUnit.MILLISECONDS, new IOException("reset"));
    }
}
