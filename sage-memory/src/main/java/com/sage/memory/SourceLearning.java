package com.sage.memory;

/** Exponential moving average for learned source effectiveness. */
public final class SourceLearning {

    public static final double ALPHA = 0.3;

    private SourceLearning() {
    }

    /**
     * {@code ALPHA * observation + (1 - ALPHA) * old}, where the observation is the quality on success and 0 on
     * failure. The result is clamped to [0, 1].
     */
    public static double ema(double old, boolean success, double quality) {
        double observation = success ? clamp(quality) : 0.0;
        return clamp(ALPHA * observation + (1 - ALPHA) * clamp(old));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
