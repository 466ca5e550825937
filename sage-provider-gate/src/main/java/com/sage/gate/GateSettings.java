package com.sage.gate;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;

/**
 * Resilience settings applied to every provider gate in a registry.
 */
public record GateSettings(
        int failureThreshold,
        long cooldownMillis,
        long maxCooldownMillis,
        int retryMaxAttempts,
        long retryBaseMillis,
        long retryMaxMillis
) {

    private static final Duration RATE_LIMIT_MAX_WAIT = Duration.ofMinutes(2);
    private static final Duration SLOW_CALL_THRESHOLD = Duration.ofDays(1);

    /** Breaker: 5 failures, 30 s cooldown doubling to 10 min. Retry: 5 attempts, 4 s doubling to 60 s. */
    public static GateSettings defaults() {
        return new GateSettings(5, 30_000L, 600_000L, 5, 4_000L, 60_000L);
    }

    /** Cooldown before the n-th consecutive opening (1-based) ends. */
    public IntervalFunction cooldowns() {
        long base = Math.max(1, cooldownMillis);
        return IntervalFunction.ofExponentialBackoff(Duration.ofMillis(base), 2.0,
                Duration.ofMillis(Math.max(base, maxCooldownMillis)));
    }

    /**
     * A window of {@code failureThreshold} calls that opens only when all of them failed, so the circuit opens on
     * that many consecutive failures. Half-open admits one trial call.
     */
    public CircuitBreakerConfig circuitBreakerConfig(GateClock clock) {
        int window = Math.max(1, failureThreshold);
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(window)
                .minimumNumberOfCalls(window)
                .failureRateThreshold(100.0f)
                .slowCallDurationThreshold(SLOW_CALL_THRESHOLD)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitIntervalFunctionInOpenState(cooldowns())
                .clock(clock.asJavaClock())
                .build();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, retryBaseMillis, retryMaxMillis);
    }

    /** One permit per {@code 1 / requestsPerSecond}; callers wait up to two minutes for it. */
    public static RateLimiterConfig rateLimiterConfig(double requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        long periodNanos = Math.max(1L, Math.round(1_000_000_000L / requestsPerSecond));
        return RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofNanos(periodNanos))
                .timeoutDuration(RATE_LIMIT_MAX_WAIT)
                .build();
    }
}
