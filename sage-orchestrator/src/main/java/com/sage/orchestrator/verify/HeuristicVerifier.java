package com.sage.orchestrator.verify;

import com.sage.model.Fact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based verification.
 * <ul>
 *   <li>Facts with the same normalized statement are merged and their sources combined.</li>
 *   <li>Two facts from different sources about the same subject (Jaccard word overlap above 0.3, stopwords
 *   removed) contradict when they name different years or dollar amounts more than 20% apart.</li>
 *   <li>A fact is verified when it has at least two sources, no contradictions and enough confidence.</li>
 * </ul>
 */
public final class HeuristicVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(HeuristicVerifier.class);

    static final double SAME_SUBJECT_OVERLAP = 0.3;
    static final double AMOUNT_TOLERANCE = 0.2;

    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final Pattern DOLLARS = Pattern.compile("\\$(\\d+(?:,\\d{3})*(?:\\.\\d+)?)");
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "in", "on", "at", "to", "for", "of", "and", "or", "but",
            "with", "by", "from");

    @Override
    public List<Fact> verify(List<Fact> facts, double verificationThreshold) {
        List<Fact> merged = merge(facts);
        int contradictions = flagContradictions(merged);
        List<Fact> result = new ArrayList<>(merged.size());
        int verified = 0;
        for (Fact f : merged) {
            boolean ok = f.getSources().size() >= 2 && f.getContradictions().isEmpty()
                    && f.getConfidence() >= verificationThreshold;
            if (ok) verified++;
            result.add(f.withVerified(ok));
        }
        log.info("Verified {} of {} fact(s) ({} merged away, {} contradiction pair(s))",
                verified, result.size(), facts.size() - merged.size(), contradictions);
        return result;
    }

    static List<Fact> merge(List<Fact> facts) {
        Map<String, Fact> byKey = new LinkedHashMap<>();
        for (Fact f : facts) {
            Fact existing = byKey.get(f.key());
            if (existing == null) {
                byKey.put(f.key(), f);
                continue;
            }
            Fact combined = existing;
            for (String source : f.getSources()) combined = combined.withSource(source);
            for (String c : f.getContradictions()) combined = combined.withContradiction(c);
            byKey.put(f.key(), combined);
        }
        return new ArrayList<>(byKey.values());
    }

    /** Marks contradicting pairs in place; returns the number of new pairs found. */
    private static int flagContradictions(List<Fact> facts) {
        int pairs = 0;
        for (int i = 0; i < facts.size(); i++) {
            for (int j = i + 1; j < facts.size(); j++) {
                Fact a = facts.get(i);
                Fact b = facts.get(j);
                if (new HashSet<>(a.getSources()).equals(new HashSet<>(b.getSources()))) continue;
                if (!contradicts(a.getStatement(), b.getStatement())) continue;
                if (a.getContradictions().contains(b.getStatement())) continue;
                facts.set(i, a.withContradiction(b.getStatement()));
                facts.set(j, b.withContradiction(a.getStatement()));
                pairs++;
            }
        }
        return pairs;
    }

    static boolean contradicts(String first, String second) {
        if (!sameSubject(first, second)) return false;
        Set<String> years1 = findAll(YEAR, first, 0);
        Set<String> years2 = findAll(YEAR, second, 0);
        if (!years1.isEmpty() && !years2.isEmpty() && !years1.equals(years2)) return true;
        Set<String> dollars1 = findAll(DOLLARS, first, 1);
        Set<String> dollars2 = findAll(DOLLARS, second, 1);
        if (dollars1.isEmpty() || dollars2.isEmpty()) return false;
        double d1 = parseAmount(dollars1.iterator().next());
        double d2 = parseAmount(dollars2.iterator().next());
        return d1 > 0 && d2 > 0 && Math.abs(d1 - d2) / Math.max(d1, d2) > AMOUNT_TOLERANCE;
    }

    static boolean sameSubject(String first, String second) {
        Set<String> w1 = significantWords(first);
        Set<String> w2 = significantWords(second);
        if (w1.isEmpty() || w2.isEmpty()) return false;
        Set<String> union = new HashSet<>(w1);
        union.addAll(w2);
        Set<String> intersection = new HashSet<>(w1);
        intersection.retainAll(w2);
        return intersection.size() / (double) union.size() > SAME_SUBJECT_OVERLAP;
    }

    private static Set<String> significantWords(String text) {
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String w = m.group();
            if (w.length() > 2 && !STOPWORDS.contains(w)) words.add(w);
        }
        return words;
    }

    private static Set<String> findAll(Pattern pattern, String text, int group) {
        Set<String> values = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) values.add(m.group(group));
        return values;
    }

    private static double parseAmount(String raw) {
        try {
            return Double.parseDouble(raw.replace(",", ""));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
