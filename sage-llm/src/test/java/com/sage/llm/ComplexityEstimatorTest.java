package com.sage.llm;

import com.sage.model.TaskComplexity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityEstimatorTest {

    @Test
    void estimatesByLengthAndKeywords() {
        assertEquals(TaskComplexity.LOW, ComplexityEstimator.estimate("list sources"));
        assertEquals(TaskComplexity.LOW, ComplexityEstimator.estimate(null));
        assertEquals(TaskComplexity.MEDIUM, ComplexityEstimator.estimate("x".repeat(600)));
        assertEquals(TaskComplexity.HIGH, ComplexityEstimator.estimate("x".repeat(2001)));
        assertEquals(TaskComplexity.HIGH, ComplexityEstimator.estimate("Compare these two trials"));
    }
}
