package com.sage.llm;

import com.sage.model.TaskComplexity;

import java.util.List;
import java.util.Locale;

/** Rough task complexity from prompt length and wording. */
public final class ComplexityEstimator {

    private static final List<String> COMPLEX_KEYWORDS = List.of(
            "analyze", "analyse", "compare", "synthesize", "synthesise", "evaluate",
            "comprehensive", "systematic review", "meta-analysis");

    private ComplexityEstimator() {
    }

    public static TaskComplexity estimate(String text) {
        if (text == null || text.isBlank()) return TaskComplexity.LOW;
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.length() > 2000 || COMPLEX_KEYWORDS.stream().anyMatch(lower::contains)) {
            return TaskComplexity.HIGH;
        }
        if (text.length() > 500) {
            return TaskComplexity.MEDIUM;
        }
        return TaskComplexity.LOW;
    }
}
