package com.sage.orchestrator.extract;

import com.sage.model.Fact;
import com.sage.model.PrivacyMode;
import com.sage.model.SourceResult;
import com.sage.orchestrator.ScriptedChatClient;
import com.sage.orchestrator.Sessions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactExtractorTest {

    private static final String URL = "https://example.org/a";
    private static final SourceResult RESULT = SourceResult.success("pubmed", URL, "Metformin in 2024",
            "Metformin remains first-line therapy for type 2 diabetes in 2024. It works. "
                    + "Lifestyle change is also strongly recommended by most guidelines.", 0.9, 1L);

    @Test
    void parsesArrayInsideCodeFence() {
        String reply = "```json\n[{\"statement\": \"GLP-1 use grew 40% in 2023\", \"confidence\": 0.9},"
                + " {\"statement\": \"No confidence given\"}, {\"confidence\": 0.7}]\n```";

        Optional<List<Fact>> facts = FactExtractor.parse(reply, URL);

        assertTrue(facts.isPresent());
        assertEquals(2, facts.get().size());
        assertEquals(0.9, facts.get().get(0).getConfidence(), 1e-9);
        assertEquals(0.5, facts.get().get(1).getConfidence(), 1e-9);
        assertEquals(List.of(URL), facts.get().get(0).getSources());
    }

    @Test
    void nonArrayReplyIsNotParsed() {
        assertTrue(FactExtractor.parse("{\"statement\": \"x\"}", URL).isEmpty());
        assertTrue(FactExtractor.parse("Sure! Here are the facts.", URL).isEmpty());
        assertTrue(FactExtractor.parse(null, URL).isEmpty());
    }

    @Test
    void longContentIsTruncated() {
        String content = "x".repeat(FactExtractor.MAX_CONTENT_LENGTH + 10);

        String truncated = FactExtractor.truncate(content);

        assertEquals(FactExtractor.MAX_CONTENT_LENGTH + 3, truncated.length());
        assertTrue(truncated.endsWith("..."));
        assertEquals("short", FactExtractor.truncate("short"));
    }

    @Test
    void heuristicKeepsNumericOrRelevantSentences() {
        List<Fact> facts = FactExtractor.heuristic(RESULT.getSnippet(), URL, "diabetes therapy");

        assertEquals(1, facts.size());
        assertTrue(facts.get(0).getStatement().startsWith("Metformin remains"));
        assertEquals(FactExtractor.HEURISTIC_CONFIDENCE, facts.get(0).getConfidence(), 1e-9);
    }

    @Test
    void dedupeKeepsFirstOfNormalizedDuplicates() {
        List<Fact> facts = FactExtractor.dedupe(List.of(
                Fact.of("Sales rose 10%.", "a", 0.8),
                Fact.of("sales rose 10%", "b", 0.4)));

        assertEquals(1, facts.size());
        assertEquals(List.of("a"), facts.get(0).getSources());
    }

    @Test
    void usesModelReplyWhenLocalModelAvailable() throws InterruptedException {
        ScriptedChatClient model = new ScriptedChatClient(
                prompt -> "[{\"statement\": \"Metformin is first-line therapy\", \"confidence\": 0.85}]");
        Sessions sessions = new Sessions().localModel(model);
        FactExtractor extractor = new FactExtractor(sessions.context().getRouter());

        List<Fact> facts = extractor.extract(RESULT, "diabetes therapy", PrivacyMode.LOCAL_ONLY);

        assertEquals(1, facts.size());
        assertEquals("Metformin is first-line therapy", facts.get(0).getStatement());
        assertEquals(List.of(Sessions.LOCAL_MODEL), model.calls);
    }

    @Test
    void fallsBackToHeuristicOnUnparseableReply() throws InterruptedException {
        Sessions sessions = new Sessions().localModel(new ScriptedChatClient(prompt -> "I cannot help with that"));
        FactExtractor extractor = new FactExtractor(sessions.context().getRouter());

        List<Fact> facts = extractor.extract(RESULT, "diabetes therapy", PrivacyMode.LOCAL_ONLY);

        assertEquals(1, facts.size());
        assertEquals(FactExtractor.HEURISTIC_CONFIDENCE, facts.get(0).getConfidence(), 1e-9);
    }

    @Test
    void fallsBackToHeuristicWithoutAnyModel() throws InterruptedException {
        FactExtractor extractor = new FactExtractor(new Sessions().context().getRouter());

        List<Fact> facts = extractor.extract(RESULT, "diabetes therapy", PrivacyMode.LOCAL_ONLY);

        assertEquals(1, facts.size());
    }

    @Test
    void blankContentYieldsNothing() throws InterruptedException {
        SourceResult empty = SourceResult.success("pubmed", URL, "", "", 0.5, 1L);

        assertTrue(new FactExtractor(null).extract(empty, "q", PrivacyMode.LOCAL_ONLY).isEmpty());
    }
}
