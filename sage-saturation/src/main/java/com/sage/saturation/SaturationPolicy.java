package com.sage.saturation;

/**
 * Stopping thresholds. The saturation condition is
 * {@code newEntitiesRatio < entityThreshold && newFactsRatio < factThreshold && sourceCoverage >= coverageThreshold},
 * and it must hold for {@code debounceWindow} consecutive cycles.
 */
public record SaturationPolicy(double entityThreshold, double factThreshold, double coverageThreshold,
                               int debounceWindow, int maxCycles) {

    public SaturationPolicy {
        if (debounceWindow < 1) throw new IllegalArgumentException("debounceWindow must be >= 1: " + debounceWindow);
        if (maxCycles < 1) throw new IllegalArgumentException("maxCycles must be >= 1: " + maxCycles);
    }

    public static SaturationPolicy defaults() {
        return new SaturationPolicy(0.10, 0.10, 0.85, 2, 5);
    }

    public SaturationPolicy withDebounceWindow(int window) {
        return new SaturationPolicy(entityThreshold, factThreshold, coverageThreshold, window, maxCycles);
    }
}
