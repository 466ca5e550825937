package com.sage.gate;

import com.sage.model.SourceResult;
import com.sage.model.error.AccessDeniedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps one provider's raw search with a {@link RateLimiter}, a {@link Retry} and a {@link CircuitBreaker}.
 * Each attempt waits for the rate limiter; the attempts of one call run inside a single breaker permission.
 * <p>
 * {@link #search(String, int, Map)} never throws for provider failures: it logs and returns an empty list.
 * The breaker records exactly one outcome per completed outer call; retries inside the call do not touch it.
 * A call that ends without an outcome (interrupted, or an {@link Error}) gives its permission back.
 */
public final class ProviderGate {

    private static final Logger log = LoggerFactory.getLogger(ProviderGate.class);

    private final SearchProvider provider;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final CircuitBreaker breaker;
    private final IntervalFunction cooldowns;
    private final GateClock clock;
    private final GateMetrics metrics;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile AccessFailureListener accessFailureListener;

    private int openings;
    private long cooldownUntil;
    private long currentCooldownMillis;

    public ProviderGate(SearchProvider provider, RateLimiter rateLimiter, Retry retry, CircuitBreaker breaker,
                        IntervalFunction cooldowns, GateClock clock, GateMetrics metrics,
                        AccessFailureListener accessFailureListener) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns");
        this.clock = clock != null ? clock : GateClock.SYSTEM;
        this.metrics = metrics != null ? metrics : new GateMetrics(null);
        this.accessFailureListener = accessFailureListener != null ? accessFailureListener : AccessFailureListener.NONE;
        this.currentCooldownMillis = cooldowns.apply(1);
        breaker.getEventPublisher().onStateTransition(this::onStateTransition);
        retry.getEventPublisher().onRetry(event -> {
            long wait = event.getWaitInterval().toMillis();
            String error = event.getLastThrowable() != null ? event.getLastThrowable().getClass().getSimpleName() : "unknown";
            this.metrics.retried(provider.name(), error, wait);
            log.debug("Retrying {} after {} (attempt {}, wait {} ms)", provider.name(), error,
                    event.getNumberOfRetryAttempts(), wait);
        });
    }

    public String name() {
        return provider.name();
    }

    public SearchProvider getProvider() {
        return provider;
    }

    public boolean isAvailable() {
        return provider.isAvailable();
    }

    public synchronized CircuitSnapshot circuit() {
        return new CircuitSnapshot(CircuitState.of(breaker.getState()), consecutiveFailures.get(),
                cooldownUntil, currentCooldownMillis);
    }

    void setAccessFailureListener(AccessFailureListener listener) {
        this.accessFailureListener = listener != null ? listener : AccessFailureListener.NONE;
    }

    /**
     * Searches through the gate.
     *
     * @return the provider's results in its own order, or an empty list when the circuit is open,
     * the provider is unavailable, or the call failed after retries
     */
    public List<SourceResult> search(String query, int limit, Map<String, String> filters) {
        if (limit <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        if (!provider.isAvailable()) {
            log.debug("Provider {} unavailable; skipping", provider.name());
            return List.of();
        }
        if (!breaker.tryAcquirePermission()) {
            metrics.rejected(provider.name());
            log.debug("Circuit for {} is open; returning no results for query={}", provider.name(), query);
            return List.of();
        }
        Map<String, String> safeFilters = filters != null ? filters : Map.of();
        long startNanos = System.nanoTime();
        boolean recorded = false;
        try {
            List<SourceResult> results = callWithRetry(query, limit, safeFilters);
            consecutiveFailures.set(0);
            breaker.onSuccess(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            recorded = true;
            metrics.callCompleted(provider.name(), true, results.size(), elapsedMillis(startNanos));
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Search on {} interrupted; returning no results", provider.name());
            return List.of();
        } catch (RequestNotPermitted e) {
            log.warn("Rate limit for {} not granted in time; returning no results for query={}", provider.name(), query);
            return List.of();
        } catch (AccessDeniedException e) {
            recordFailure(startNanos, e);
            recorded = true;
            log.warn("Access denied by {} for {}: {}", provider.name(), e.getUrl(), e.getMessage());
            notifyAccessFailure(e);
            return List.of();
        } catch (Exception e) {
            recordFailure(startNanos, e);
            recorded = true;
            log.warn("Search on {} failed after retries (query={}): {} {}", provider.name(), query,
                    e.getClass().getSimpleName(), e.getMessage());
            return List.of();
        } finally {
            if (!recorded) {
                breaker.releasePermission();
            }
        }
    }

    private List<SourceResult> callWithRetry(String query, int limit, Map<String, String> filters) throws Exception {
        Retry.Context<List<SourceResult>> attempts = retry.context();
        while (true) {
            awaitRateLimit();
            try {
                List<SourceResult> results = provider.search(query, limit, filters);
                attempts.onComplete();
                if (results == null) return List.of();
                return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                // rethrows once the error is terminal or attempts are used up; otherwise waits out the backoff
                attempts.onError(e);
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted during backoff for " + provider.name());
                }
            }
        }
    }

    private void awaitRateLimit() throws InterruptedException {
        if (!rateLimiter.acquirePermission()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted waiting for " + provider.name() + " rate limit");
            }
            throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
        }
    }

    private void recordFailure(long startNanos, Exception e) {
        consecutiveFailures.incrementAndGet();
        breaker.onError(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS, e);
        metrics.callCompleted(provider.name(), false, 0, elapsedMillis(startNanos));
    }

    private synchronized void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        switch (event.getStateTransition().getToState()) {
            case OPEN:
                openings++;
                currentCooldownMillis = cooldowns.apply(openings);
                cooldownUntil = clock.nowMillis() + currentCooldownMillis;
                log.warn("Circuit {} opened after {} consecutive failure(s); cooldown {} ms",
                        provider.name(), consecutiveFailures.get(), currentCooldownMillis);
                break;
            case HALF_OPEN:
                log.info("Circuit {} half-open; admitting one trial call", provider.name());
                break;
            case CLOSED:
                openings = 0;
                currentCooldownMillis = cooldowns.apply(1);
                log.info("Circuit {} closed after successful trial call", provider.name());
                break;
            default:
                break;
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void notifyAccessFailure(AccessDeniedException e) {
        try {
            accessFailureListener.onAccessFailure(e.getUrl(), provider.name(), "ACCESS_DENIED", e.getMessage());
        } catch (RuntimeException listenerError) {
            log.warn("Recording access failure for {} failed; execution continues. Error: {}",
                    e.getUrl(), listenerError.getMessage(), listenerError);
        }
    }
}
