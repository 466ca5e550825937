package com.sage.memory;

import com.sage.model.Phase;
import com.sage.model.PrivacyMode;
import com.sage.model.ResearchState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryStoreTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private final InMemoryMemoryStore store = new InMemoryMemoryStore(now::get);

    @Test
    void repeatedAccessFailureKeepsOneRecordAndCountsRetries() {
        store.recordAccessFailure("https://journal.example/paywalled", "unpaywall", "ACCESS_DENIED", "403");
        now.set(5_000L);
        store.recordAccessFailure("https://journal.example/paywalled", "unpaywall", "ACCESS_DENIED", "403 again");

        AccessFailureRecord record = store.getAccessFailure("https://journal.example/paywalled").orElseThrow();
        assertEquals(2, record.retryCount());
        assertEquals(1_000L, record.firstSeenAt());
        assertEquals(5_000L, record.lastSeenAt());
        assertEquals("403 again", record.message());
        assertTrue(store.isKnownFailure("https://journal.example/paywalled"));
        assertFalse(store.isKnownFailure("https://journal.example/open"));
    }

    @Test
    void effectivenessStartsNeutralAndFollowsEma() {
        assertEquals(0.5, store.getSourceEffectiveness("pubmed", "medical"), 1e-9);
        store.updateSourceEffectiveness("pubmed", "medical", true, 0.9);
        assertEquals(0.62, store.getSourceEffectiveness("pubmed", "medical"), 1e-9);
        store.updateSourceEffectiveness("pubmed", "medical", false, 0.9);
        assertEquals(0.434, store.getSourceEffectiveness("pubmed", "medical"), 1e-9);
        assertEquals(0.5, store.getSourceEffectiveness("pubmed", "academic"), 1e-9);
    }

    @Test
    void searchRanksBySimilarityAndAppliesFilters() {
        store.storeDocument("Metformin remains first-line treatment for type 2 diabetes", Map.of("provider", "pubmed"), "s1");
        store.storeDocument("GLP-1 agonists reduce weight in diabetes patients", Map.of("provider", "semantic_scholar"), "s1");
        store.storeDocument("Quarterly revenue of a cloud vendor", Map.of("provider", "tavily"), "s2");

        List<MemoryDocument> hits = store.searchSimilar("metformin diabetes treatment", 5, null);
        assertEquals(2, hits.size());
        assertTrue(hits.get(0).getContent().startsWith("Metformin"));
        assertTrue(hits.get(0).getScore() > hits.get(1).getScore());

        List<MemoryDocument> filtered = store.searchSimilar("diabetes", 5, Map.of("provider", "semantic_scholar"));
        assertEquals(1, filtered.size());
        assertTrue(store.searchSimilar("diabetes", 5, Map.of("session_id", "s2")).isEmpty());
        assertEquals(1, store.searchSimilar("diabetes", 1, null).size());
    }

    @Test
    void checkpointsRoundTripAsIndependentCopies() {
        ResearchState state = ResearchState.start("s1", "diabetes treatments 2024", "medical", PrivacyMode.LOCAL_ONLY, 0L);
        state.setPhase(Phase.COLLECT);
        store.save(state);
        state.setPhase(Phase.PROCESS);

        ResearchState loaded = store.load("s1").orElseThrow();
        assertEquals(Phase.COLLECT, loaded.getPhase());
        assertEquals("diabetes treatments 2024", loaded.getQuery());
        assertTrue(store.load("missing").isEmpty());

        store.archive("s1");
        assertTrue(store.isArchived("s1"));
        assertTrue(store.load("s1").isPresent());
    }
}
