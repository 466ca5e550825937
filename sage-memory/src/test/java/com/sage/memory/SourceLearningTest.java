package com.sage.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceLearningTest {

    @Test
    void emaWeighsNewObservationByAlpha() {
        assertEquals(0.62, SourceLearning.ema(0.5, true, 0.9), 1e-9);
        assertEquals(0.35, SourceLearning.ema(0.5, false, 0.9), 1e-9);
    }

    @Test
    void emaStaysWithinUnitInterval() {
        assertEquals(1.0, SourceLearning.ema(1.0, true, 7.0), 1e-9);
        assertEquals(0.0, SourceLearning.ema(-3.0, false, 0.0), 1e-9);
        assertEquals(0.0, SourceLearning.ema(Double.NaN, true, Double.NaN), 1e-9);
    }
}
