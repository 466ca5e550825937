package com.sage.gate;

import com.sage.model.error.ModelOverloadedException;
import com.sage.model.error.ProviderTimeoutException;
import com.sage.model.error.RateLimitException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff as a Resilience4j {@link RetryConfig}: wait {@code base * 2^(attempt-1)} capped at
 * {@code maxDelay}, with +/-25% jitter. Only transient errors are retried: rate limits, timeouts and overloaded
 * models. A provider's retry-after hint is a lower bound on the wait, still subject to the cap.
 */
public final class RetryPolicy {

    private static final double JITTER = 0.25;
    private static final double MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final long maxDelayMillis;
    private final IntervalFunction backoff;
    private final RetryConfig config;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        long base = Math.max(1, baseDelayMillis);
        this.maxDelayMillis = Math.max(base, maxDelayMillis);
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(Duration.ofMillis(base), MULTIPLIER, JITTER,
                Duration.ofMillis(this.maxDelayMillis));
        this.config = RetryConfig.custom()
                .maxAttempts(this.maxAttempts)
                .retryOnException(RetryPolicy::isRetryable)
                .intervalBiFunction((attempt, outcome) ->
                        delayMillis(attempt, outcome.isLeft() ? outcome.getLeft() : null))
                .build();
    }

    /** 5 attempts, 4 s doubling to a 60 s cap. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(5, 4_000L, 60_000L);
    }

    /** A fresh retry for one caller; its events carry the given name. */
    public Retry newRetry(String name) {
        return Retry.of(name, config);
    }

    public RetryConfig getConfig() {
        return config;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof RateLimitException
                || error instanceof ProviderTimeoutException
                || error instanceof ModelOverloadedException;
    }

    /** Wait before the attempt following the given (1-based) failed attempt. */
    public long delayMillis(int attempt, Throwable error) {
        long delay = Math.min(maxDelayMillis, backoff.apply(Math.max(1, attempt)));
        if (error instanceof RateLimitException) {
            Duration hint = ((RateLimitException) error).getRetryAfter();
            if (hint != null) {
                delay = Math.min(maxDelayMillis, Math.max(delay, hint.toMillis()));
            }
        }
        return delay;
    }
}
