package com.sage.llm;

import com.sage.gate.RetryPolicy;
import com.sage.model.ChatMessage;
import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;
import com.sage.model.StreamEvent;
import com.sage.model.TaskComplexity;
import com.sage.model.error.ModelOverloadedException;
import com.sage.model.error.ModelUnavailableException;
import com.sage.model.error.PrivacyViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyRouterTest {

    private static final List<ChatMessage> PROMPT = List.of(ChatMessage.user("summarize"));

    private final FakeChatClient local = new FakeChatClient("local answer");
    private final FakeChatClient cloud = new FakeChatClient("cloud answer");
    private final ModelCatalog catalog = new ModelCatalog()
            .register(new ModelSpec("fast", ModelTier.LOCAL_FAST, local))
            .register(new ModelSpec("powerful", ModelTier.LOCAL_POWERFUL, local))
            .register(new ModelSpec("gpt-4o", ModelTier.CLOUD_BEST, cloud));
    private final PrivacyRouter router = new PrivacyRouter(catalog, ModelPreferenceTable.loadDefault(),
            FallbackGraph.defaults(), new RetryPolicy(3, 100, 1_000));

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    void cloudModelUnderLocalOnlyFailsClosedWithoutCallingIt() {
        PrivacyViolationException e = assertThrows(PrivacyViolationException.class,
                () -> router.complete(PROMPT, "gpt-4o", PrivacyMode.LOCAL_ONLY));
        assertEquals(PrivacyMode.LOCAL_ONLY, e.getPrivacyMode());
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void localOnlyFailuresNeverReachTheCloud() {
        ModelUnavailableException down = new ModelUnavailableException("x", "connection refused");
        local.thenFail(down).thenFail(down).thenFail(down);
        assertThrows(ModelUnavailableException.class,
                () -> router.complete(PROMPT, "powerful", PrivacyMode.LOCAL_ONLY));
        assertEquals(List.of("powerful", "fast"), local.calls);
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void unavailableCloudFallsBackToLocalPowerfulWhenAllowed() throws Exception {
        cloud.thenFail(new ModelUnavailableException("gpt-4o", "503 from gateway"));
        Completion completion = router.complete(PROMPT, "gpt-4o", PrivacyMode.CLOUD_ALLOWED);
        assertEquals("local answer", completion.text());
        assertEquals("powerful", completion.model());
        assertEquals(ModelTier.LOCAL_POWERFUL, completion.tier());
    }

    @Test
    void overloadedModelIsRetriedWithBackoff() throws Exception {
        List<Long> waits = waitsOf("fast");
        local.thenFail(new ModelOverloadedException("fast", "busy")).thenReply("finally");
        Completion completion = router.complete(PROMPT, "fast", PrivacyMode.LOCAL_ONLY);
        assertEquals("finally", completion.text());
        assertEquals(1, waits.size());
        assertTrue(waits.get(0) >= 75 && waits.get(0) <= 125, "wait " + waits);
    }

    @Test
    void persistentOverloadFallsThroughToTheNextTier() throws Exception {
        List<Long> waits = waitsOf("powerful");
        ModelOverloadedException busy = new ModelOverloadedException("powerful", "busy");
        local.thenFail(busy).thenFail(busy).thenFail(busy).thenReply("fast answer");
        Completion completion = router.complete(PROMPT, "powerful", PrivacyMode.HYBRID);
        assertEquals("fast", completion.model());
        assertEquals(2, waits.size());
    }

    @Test
    void selectsByComplexity() throws Exception {
        Completion completion = router.complete(PROMPT, TaskComplexity.HIGH, PrivacyMode.CLOUD_ALLOWED);
        assertEquals("gpt-4o", completion.model());
        assertEquals(List.of("gpt-4o"), cloud.calls);
    }

    @Test
    void streamEmitsModelInfoTokensAndDone() throws Exception {
        local.thenReply("hello streaming world");
        TokenStream stream = router.stream(PROMPT, "fast", PrivacyMode.LOCAL_ONLY);
        StreamEvent first = stream.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertEquals(StreamEvent.Type.MODEL_INFO, first.getType());
        assertEquals("fast", first.getModel());
        assertEquals("hello streaming world ", stream.collect());
        assertTrue(stream.isTerminated());
    }

    @Test
    void streamReportsExhaustedFallbackAsErrorEvent() throws Exception {
        ModelUnavailableException down = new ModelUnavailableException("x", "down");
        local.thenFail(down).thenFail(down);
        TokenStream stream = router.stream(PROMPT, "powerful", PrivacyMode.LOCAL_ONLY);
        StreamEvent last = null;
        for (int i = 0; i < 10; i++) {
            StreamEvent event = stream.poll(5, TimeUnit.SECONDS);
            assertNotNull(event);
            last = event;
            if (event.isTerminal()) break;
        }
        assertEquals(StreamEvent.Type.ERROR, last.getType());
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void streamingACloudModelUnderLocalOnlyIsRefusedUpFront() {
        assertThrows(PrivacyViolationException.class, () -> router.stream(PROMPT, "gpt-4o", PrivacyMode.LOCAL_ONLY));
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void privacyRecommendationUsesOnlyLocalModels() {
        local.thenReply("SENSITIVE");
        PrivacyAdvice advice = router.recommendPrivacyMode("acme quarterly churn numbers", null);
        assertEquals(PrivacyMode.LOCAL_ONLY, advice.mode());
        assertEquals(List.of("fast"), local.calls);
        assertTrue(cloud.calls.isEmpty());
    }

    private List<Long> waitsOf(String model) {
        List<Long> waits = new CopyOnWriteArrayList<>();
        router.retryFor(model).getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval().toMillis()));
        return waits;
    }
}
