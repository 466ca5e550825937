package com.sage.orchestrator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.llm.Completion;
import com.sage.llm.PrivacyRouter;
import com.sage.model.ChatMessage;
import com.sage.model.Fact;
import com.sage.model.PrivacyMode;
import com.sage.model.SourceResult;
import com.sage.model.TaskComplexity;
import com.sage.model.error.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pulls factual statements out of a source result. Asks a fast model through the {@link PrivacyRouter} for a
 * JSON array of {@code {statement, confidence}}; when no model is usable or the reply cannot be parsed, falls back
 * to picking informative sentences.
 * <p>
 * {@code PrivacyViolationException} is never absorbed here.
 */
public final class FactExtractor {

    private static final Logger log = LoggerFactory.getLogger(FactExtractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int MAX_CONTENT_LENGTH = 8000;
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double HEURISTIC_CONFIDENCE = 0.5;
    static final int MAX_HEURISTIC_FACTS = 5;
    private static final int MIN_SENTENCE_WORDS = 5;

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final String PROMPT = "You are a fact extraction assistant. Extract factual statements from the provided content.\n"
            + "Rules:\n"
            + "1. Extract ONLY factual claims (not opinions or speculation)\n"
            + "2. Each fact should be a standalone statement\n"
            + "3. Include numerical data when present (percentages, dates, amounts)\n"
            + "4. Prioritize facts relevant to the query context\n"
            + "5. Rate confidence 0.0-1.0 based on how explicitly stated the fact is\n"
            + "Query context: %s\n"
            + "Content to analyze:\n%s\n"
            + "Return JSON array of facts:\n"
            + "[{\"statement\": \"Factual statement here\", \"confidence\": 0.8}]\n"
            + "Return ONLY the JSON array, no other text.";

    private final PrivacyRouter router;

    /**
     * @param router router for model calls; null means heuristic extraction only
     */
    public FactExtractor(PrivacyRouter router) {
        this.router = router;
    }

    /**
     * Extracts facts from one result, each attributed to the result's URL. Facts with the same normalized statement
     * are returned once.
     */
    public List<Fact> extract(SourceResult result, String queryContext, PrivacyMode privacyMode) throws InterruptedException {
        String content = result.content();
        if (content == null || content.isBlank()) return List.of();
        Optional<List<Fact>> fromModel = router != null
                ? extractWithModel(truncate(content), result.getUrl(), queryContext, privacyMode)
                : Optional.empty();
        return dedupe(fromModel.orElseGet(() -> heuristic(content, result.getUrl(), queryContext)));
    }

    private Optional<List<Fact>> extractWithModel(String content, String url, String queryContext,
                                                  PrivacyMode privacyMode) throws InterruptedException {
        String prompt = String.format(PROMPT, queryContext != null ? queryContext : "", content);
        Completion completion;
        try {
            completion = router.complete(List.of(ChatMessage.user(prompt)), TaskComplexity.LOW, privacyMode);
        } catch (ModelUnavailableException e) {
            log.warn("No model for fact extraction from {}; using sentence heuristic. Error: {}", url, e.getMessage());
            return Optional.empty();
        }
        Optional<List<Fact>> parsed = parse(completion.text(), url);
        if (parsed.isEmpty()) {
            log.warn("Unparseable fact extraction reply from {} for {}; using sentence heuristic", completion.model(), url);
        } else {
            log.debug("Model {} extracted {} fact(s) from {}", completion.model(), parsed.get().size(), url);
        }
        return parsed;
    }

    /** Parses a JSON array of facts, tolerating a surrounding markdown code fence. Empty when not a JSON array. */
    static Optional<List<Fact>> parse(String reply, String url) {
        if (reply == null) return Optional.empty();
        String text = stripCodeFence(reply.trim());
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (root == null || !root.isArray()) return Optional.empty();
        List<Fact> facts = new ArrayList<>();
        for (JsonNode item : root) {
            JsonNode statement = item.get("statement");
            if (statement == null || !statement.isTextual() || statement.asText().isBlank()) continue;
            double confidence = item.path("confidence").asDouble(DEFAULT_CONFIDENCE);
            facts.add(Fact.of(statement.asText(), url, confidence));
        }
        return Optional.of(facts);
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) return text;
        String[] lines = text.split("\n");
        int end = lines.length;
        if (end > 1 && lines[end - 1].trim().startsWith("```")) end--;
        return String.join("\n", Arrays.asList(lines).subList(Math.min(1, end), end));
    }

    static String truncate(String content) {
        return content.length() > MAX_CONTENT_LENGTH ? content.substring(0, MAX_CONTENT_LENGTH) + "..." : content;
    }

    /**
     * Keeps sentences of at least five words that carry a number or mention a query term, best candidates first.
     */
    static List<Fact> heuristic(String content, String url, String queryContext) {
        List<String> terms = queryTerms(queryContext);
        List<Fact> facts = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(content.trim())) {
            String s = sentence.trim();
            if (s.split("\\s+").length < MIN_SENTENCE_WORDS) continue;
            String lower = s.toLowerCase(Locale.ROOT);
            boolean numeric = DIGIT.matcher(s).find();
            boolean relevant = terms.stream().anyMatch(lower::contains);
            if (!numeric && !relevant) continue;
            facts.add(Fact.of(s, url, HEURISTIC_CONFIDENCE));
            if (facts.size() >= MAX_HEURISTIC_FACTS) break;
        }
        return facts;
    }

    private static List<String> queryTerms(String queryContext) {
        List<String> terms = new ArrayList<>();
        if (queryContext == null) return terms;
        for (String word : queryContext.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (word.length() > 3) terms.add(word);
        }
        return terms;
    }

    static List<Fact> dedupe(List<Fact> facts) {
        Map<String, Fact> unique = new LinkedHashMap<>();
        for (Fact f : facts) unique.putIfAbsent(f.key(), f);
        return new ArrayList<>(unique.values());
    }
}
