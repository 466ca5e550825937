package com.sage.orchestrator.extract;

import com.sage.model.Entity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic named-entity extraction: runs of capitalised words become entities, four-digit years become DATE.
 */
public final class EntityExtractor {

    private static final Pattern CAPITALISED_RUN =
            Pattern.compile("\\b[A-Z][A-Za-z0-9&'-]*(?:\\s+(?:of\\s+)?[A-Z][A-Za-z0-9&'-]*)*");
    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");

    private static final Set<String> LEADING_WORDS = Set.of(
            "The", "A", "An", "In", "On", "At", "This", "These", "That", "Those", "It", "Its", "We", "Our",
            "For", "From", "With", "By", "And", "But", "Or", "As", "If", "When", "While", "After", "Before",
            "Results", "Conclusions", "Background", "Methods", "However", "Here", "There");
    private static final List<String> ORGANIZATION_SUFFIXES = List.of(
            "Inc", "Inc.", "Corp", "Corporation", "Ltd", "LLC", "University", "Institute", "Association",
            "Agency", "Administration", "Foundation", "Organization", "Society", "Company", "Group");

    public List<Entity> extract(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<Entity> found = new LinkedHashSet<>();
        Matcher m = CAPITALISED_RUN.matcher(text);
        while (m.find()) {
            String phrase = trimLeading(m.group().trim());
            if (phrase.length() < 3 || YEAR.matcher(phrase).matches()) continue;
            found.add(new Entity(phrase, typeOf(phrase)));
        }
        Matcher years = YEAR.matcher(text);
        while (years.find()) {
            found.add(new Entity(years.group(), "DATE"));
        }
        return new ArrayList<>(found);
    }

    private static String trimLeading(String phrase) {
        String[] words = phrase.split("\\s+");
        int start = 0;
        while (start < words.length && LEADING_WORDS.contains(words[start])) start++;
        if (start == 0) return phrase;
        return String.join(" ", List.of(words).subList(start, words.length));
    }

    static String typeOf(String phrase) {
        for (String suffix : ORGANIZATION_SUFFIXES) {
            if (phrase.endsWith(" " + suffix) || phrase.startsWith(suffix + " ")) return "ORGANIZATION";
        }
        if (phrase.length() <= 6 && phrase.equals(phrase.toUpperCase())) return "ACRONYM";
        return "CONCEPT";
    }
}
