package com.sage.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactTest {

    @Test
    void withSource_boostsConfidenceByTenthOverSourceCount() {
        Fact fact = Fact.of("Metformin lowers HbA1c", "https://a.example", 0.5);

        Fact corroborated = fact.withSource("https://b.example");

        assertEquals(List.of("https://a.example", "https://b.example"), corroborated.getSources());
        assertEquals(0.55, corroborated.getConfidence(), 1e-9);
    }

    @Test
    void withSource_ignoresDuplicateSource() {
        Fact fact = Fact.of("Metformin lowers HbA1c", "https://a.example", 0.5);
        assertSame(fact, fact.withSource("https://a.example"));
    }

    @Test
    void withSource_capsAtOne() {
        Fact fact = Fact.of("x", "s1", 0.98).withSource("s2");
        assertEquals(1.0, fact.getConfidence(), 1e-9);
    }

    @Test
    void withContradiction_lowersConfidenceAndClearsVerified() {
        Fact fact = Fact.of("Approved in 2019", "s1", 0.2).withVerified(true);

        Fact contradicted = fact.withContradiction("Approved in 2021");

        assertFalse(contradicted.isVerified());
        assertEquals(0.1, contradicted.getConfidence(), 1e-9);
        assertEquals(List.of("Approved in 2021"), contradicted.getContradictions());
        assertTrue(fact.isVerified());
    }

    @Test
    void key_normalizesPunctuationAndCase() {
        assertEquals(Fact.of("Insulin,  works!", null, 0.5).key(), Fact.of("insulin works", null, 0.5).key());
    }
}
