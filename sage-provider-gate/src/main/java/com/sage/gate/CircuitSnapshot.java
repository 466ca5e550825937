package com.sage.gate;

/**
 * Read-only view of a provider circuit at one instant.
 */
public record CircuitSnapshot(
        CircuitState state,
        int consecutiveFailures,
        long cooldownUntil,
        long currentCooldownMillis
) {
}
