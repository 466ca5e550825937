package com.sage.llm;

import com.sage.model.PrivacyMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Advises a privacy mode for a query. An explicit user choice is always returned unchanged.
 * Otherwise sensitive keywords force LOCAL_ONLY; failing that, an optional classifier (which must itself run on a
 * local model) may flag the query; anything else is CLOUD_ALLOWED.
 */
public final class PrivacyAdvisor {

    private static final Logger log = LoggerFactory.getLogger(PrivacyAdvisor.class);

    static final List<String> SENSITIVE_KEYWORDS = List.of(
            "confidential", "private", "internal", "secret", "proprietary", "nda", "personal",
            "medical", "financial", "patient", "salary", "ssn", "password", "credentials",
            "hipaa", "gdpr", "pii");

    /** Local-model classification hook: returns true when the query looks sensitive. */
    @FunctionalInterface
    public interface LocalClassifier {
        Optional<Boolean> isSensitive(String query);
    }

    private final LocalClassifier classifier;

    public PrivacyAdvisor() {
        this(null);
    }

    public PrivacyAdvisor(LocalClassifier classifier) {
        this.classifier = classifier;
    }

    public PrivacyAdvice recommend(String query, PrivacyMode explicitMode) {
        if (explicitMode != null) {
            return new PrivacyAdvice(explicitMode, "Privacy mode " + explicitMode + " chosen by the user");
        }
        List<String> hits = matchKeywords(query);
        if (!hits.isEmpty()) {
            return new PrivacyAdvice(PrivacyMode.LOCAL_ONLY, "Query mentions sensitive terms " + hits + "; keeping data on local models");
        }
        if (classifier != null && query != null && !query.isBlank()) {
            try {
                Optional<Boolean> sensitive = classifier.isSensitive(query);
                if (sensitive.isPresent() && sensitive.get()) {
                    return new PrivacyAdvice(PrivacyMode.LOCAL_ONLY, "Local classifier flagged the query as sensitive");
                }
            } catch (RuntimeException e) {
                log.warn("Privacy classifier failed; defaulting to LOCAL_ONLY. Error: {}", e.getMessage());
                return new PrivacyAdvice(PrivacyMode.LOCAL_ONLY, "Privacy classification unavailable; defaulting to local models");
            }
        }
        return new PrivacyAdvice(PrivacyMode.CLOUD_ALLOWED, "No sensitive content detected; cloud models permitted");
    }

    static List<String> matchKeywords(String query) {
        List<String> hits = new ArrayList<>();
        if (query == null) return hits;
        String lower = query.toLowerCase(Locale.ROOT);
        for (String keyword : SENSITIVE_KEYWORDS) {
            if (Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lower).find()) hits.add(keyword);
        }
        return hits;
    }
}
