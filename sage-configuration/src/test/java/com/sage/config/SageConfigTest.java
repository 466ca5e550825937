package com.sage.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SageConfigTest {

    @Test
    void fromEnvironment_emptyUsesDefaults() {
        SageConfig config = SageConfig.fromEnvironment(key -> null);

        assertEquals(List.of("pubmed", "semantic_scholar", "tavily"), config.getProviders());
        assertEquals(3.0, config.getRequestsPerSecond("pubmed"));
        assertEquals(1.0, config.getRequestsPerSecond("semantic_scholar"));
        assertEquals(1.0, config.getRequestsPerSecond("unknown"));
        assertEquals(4_000L, config.getRetryBaseMillis());
        assertEquals(60_000L, config.getRetryMaxMillis());
        assertEquals(5, config.getBreakerFailureThreshold());
        assertEquals(30_000L, config.getBreakerCooldownMillis());
        assertEquals(5, config.getMaxConcurrentCalls());
        assertEquals(2, config.getDebounceWindow());
        assertEquals(5, config.getMaxCycles());
        assertEquals(0.85, config.getCoverageThreshold());
        assertFalse(config.isJdbcMemoryEnabled());
        assertNull(config.getLiteLlmApiKey());
    }

    @Test
    void fromEnvironment_readsOverridesAndIgnoresMalformed() {
        Map<String, String> env = Map.of(
                "SAGE_PROVIDERS", " PubMed , arxiv ,",
                "SAGE_RPS_ARXIV", "0.5",
                "SAGE_SATURATION_DEBOUNCE", "3",
                "SAGE_MAX_CYCLES", "not-a-number",
                "SAGE_MEMORY_JDBC", "1",
                "SAGE_LITELLM_API_KEY", "  sk-test  ",
                "SAGE_UNPAYWALL_EMAIL", "research@example.org");

        SageConfig config = SageConfig.fromEnvironment(env::get);

        assertEquals(List.of("pubmed", "arxiv"), config.getProviders());
        assertEquals(0.5, config.getRequestsPerSecond("arxiv"));
        assertEquals(3, config.getDebounceWindow());
        assertEquals(5, config.getMaxCycles());
        assertTrue(config.isJdbcMemoryEnabled());
        assertEquals("sk-test", config.getLiteLlmApiKey());
        assertEquals("research@example.org", config.getUnpaywallEmail());
    }

    @Test
    void builder_clampsInvalidValues() {
        SageConfig config = SageConfig.builder()
                .debounceWindow(0)
                .maxConcurrentCalls(-2)
                .breakerCooldownMillis(10_000)
                .breakerMaxCooldownMillis(1_000)
                .build();

        assertEquals(1, config.getDebounceWindow());
        assertEquals(1, config.getMaxConcurrentCalls());
        assertEquals(10_000L, config.getBreakerMaxCooldownMillis());
    }
}
