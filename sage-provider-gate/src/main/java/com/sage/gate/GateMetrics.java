package com.sage.gate;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for provider gates, tagged by provider.
 */
public final class GateMetrics {

    private final MeterRegistry registry;

    public GateMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void callCompleted(String provider, boolean success, int results, long durationMs) {
        registry.counter("sage.gate.calls", "provider", provider, "success", String.valueOf(success)).increment();
        if (!success) {
            registry.counter("sage.gate.failures", "provider", provider).increment();
        }
        registry.summary("sage.gate.results", "provider", provider).record(results);
        Timer.builder("sage.gate.call")
                .tag("provider", provider)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    void rejected(String provider) {
        registry.counter("sage.gate.rejected", "provider", provider).increment();
    }

    void retried(String provider, String errorType, long waitMillis) {
        registry.counter("sage.gate.retries", "provider", provider, "error", errorType).increment();
        registry.summary("sage.gate.retry.wait", "provider", provider).record(waitMillis);
    }

    /** Longest backoff waited before a retry of this provider, in milliseconds. */
    public double maxRetryWait(String provider) {
        return registry.find("sage.gate.retry.wait").tag("provider", provider).summaries().stream()
                .mapToDouble(s -> s.max())
                .max()
                .orElse(0.0);
    }

    public double count(String name, String provider) {
        return registry.find(name).tag("provider", provider).counters().stream()
                .mapToDouble(c -> c.count())
                .sum();
    }
}
