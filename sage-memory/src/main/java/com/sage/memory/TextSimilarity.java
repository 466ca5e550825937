package com.sage.memory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid text score used for memory search: {@code 0.6 * cosine(term frequencies) + 0.4 * keyword overlap}.
 * Keyword overlap is the share of query terms present in the document.
 */
public final class TextSimilarity {

    static final double COSINE_WEIGHT = 0.6;
    static final double KEYWORD_WEIGHT = 0.4;

    private TextSimilarity() {
    }

    public static double score(String query, String document) {
        Map<String, Integer> q = termFrequencies(query);
        Map<String, Integer> d = termFrequencies(document);
        if (q.isEmpty() || d.isEmpty()) return 0.0;
        return COSINE_WEIGHT * cosine(q, d) + KEYWORD_WEIGHT * keywordOverlap(q.keySet(), d.keySet());
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> tf = new HashMap<>();
        if (text == null) return tf;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1) tf.merge(token, 1, Integer::sum);
        }
        return tf;
    }

    static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        double dot = 0;
        for (Map.Entry<String, Integer> e : a.entrySet()) {
            Integer other = b.get(e.getKey());
            if (other != null) dot += e.getValue() * (double) other;
        }
        return dot == 0 ? 0.0 : dot / (norm(a) * norm(b));
    }

    static double keywordOverlap(Set<String> queryTerms, Set<String> docTerms) {
        Set<String> hit = new HashSet<>(queryTerms);
        hit.retainAll(docTerms);
        return hit.size() / (double) queryTerms.size();
    }

    private static double norm(Map<String, Integer> v) {
        double sum = 0;
        for (int x : v.values()) sum += (double) x * x;
        return Math.sqrt(sum);
    }
}
