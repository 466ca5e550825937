/**
 * Per-provider resilience on Resilience4j: a rate limiter, a bounded {@link com.sage.gate.RetryPolicy} and a
 * circuit breaker, composed by {@link com.sage.gate.ProviderGate} and owned per provider by
 * {@link com.sage.gate.ProviderRegistry}.
 */
package com.sage.gate;
