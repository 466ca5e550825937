package com.sage.gate;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Owns one {@link ProviderGate} per provider name. Created by whoever assembles a session (worker or tests)
 * and passed by reference, so circuit and rate-limit state is shared per provider without process-global state.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderGate> gates = new ConcurrentHashMap<>();
    private final List<String> order = Collections.synchronizedList(new ArrayList<>());
    private final GateSettings settings;
    private final GateClock clock;
    private final GateMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final ToDoubleFunction<SearchProvider> rpsOverride;
    private volatile AccessFailureListener accessFailureListener = AccessFailureListener.NONE;

    public ProviderRegistry(GateSettings settings, GateClock clock, GateMetrics metrics) {
        this(settings, clock, metrics, SearchProvider::requestsPerSecond);
    }

    /**
     * @param rpsOverride requests-per-second to use for a provider (e.g. from configuration); defaults to the
     *                    provider's own value when null
     */
    public ProviderRegistry(GateSettings settings, GateClock clock, GateMetrics metrics,
                            ToDoubleFunction<SearchProvider> rpsOverride) {
        this.settings = settings != null ? settings : GateSettings.defaults();
        this.clock = clock != null ? clock : GateClock.SYSTEM;
        this.metrics = metrics != null ? metrics : new GateMetrics(null);
        this.retryPolicy = this.settings.retryPolicy();
        this.rpsOverride = rpsOverride != null ? rpsOverride : SearchProvider::requestsPerSecond;
    }

    /** Registers the provider with a fresh rate limiter, retry and circuit, replacing any gate with the same name. */
    public ProviderGate register(SearchProvider provider) {
        double rps = rpsOverride.applyAsDouble(provider);
        if (rps <= 0) rps = provider.requestsPerSecond() > 0 ? provider.requestsPerSecond() : 1.0;
        ProviderGate gate = new ProviderGate(
                provider,
                RateLimiter.of(provider.name(), GateSettings.rateLimiterConfig(rps)),
                retryPolicy.newRetry(provider.name()),
                CircuitBreaker.of(provider.name(), settings.circuitBreakerConfig(clock)),
                settings.cooldowns(),
                clock,
                metrics,
                accessFailureListener);
        if (gates.put(provider.name(), gate) == null) {
            order.add(provider.name());
        }
        log.info("Registered provider {} at {} req/s", provider.name(), rps);
        return gate;
    }

    public Optional<ProviderGate> gate(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(gates.get(name));
    }

    /** Registered provider names in registration order. */
    public List<String> names() {
        synchronized (order) {
            return List.copyOf(order);
        }
    }

    public Collection<ProviderGate> gates() {
        List<ProviderGate> list = new ArrayList<>();
        for (String name : names()) {
            ProviderGate g = gates.get(name);
            if (g != null) list.add(g);
        }
        return list;
    }

    public boolean isAvailable(String name) {
        ProviderGate g = gates.get(name);
        return g != null && g.isAvailable();
    }

    /** Applies to every registered and future gate. */
    public void setAccessFailureListener(AccessFailureListener listener) {
        this.accessFailureListener = listener != null ? listener : AccessFailureListener.NONE;
        for (ProviderGate g : gates.values()) {
            g.setAccessFailureListener(this.accessFailureListener);
        }
    }

    public GateMetrics getMetrics() {
        return metrics;
    }
}
