package com.sage.orchestrator.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword-based domain detection. The domain with the highest match density wins; no match means "general".
 */
public final class DomainDetector {

    private static final Logger log = LoggerFactory.getLogger(DomainDetector.class);

    private static final double MAX_CONFIDENCE = 0.95;
    private static final double GENERAL_CONFIDENCE = 0.3;

    public Detection detect(String query) {
        String text = query != null ? query.toLowerCase(Locale.ROOT) : "";
        Detection best = null;
        for (DomainConfiguration config : DomainConfiguration.presets()) {
            if (config.keywords().isEmpty()) continue;
            List<String> matched = new ArrayList<>();
            for (String keyword : config.keywords()) {
                if (text.contains(keyword)) matched.add(keyword);
            }
            if (matched.isEmpty()) continue;
            double density = matched.size() / (double) config.keywords().size();
            double confidence = Math.min(MAX_CONFIDENCE, density + (matched.size() - 1) * 0.1);
            Detection candidate = new Detection(config.name(), confidence, matched);
            if (best == null || candidate.confidence() > best.confidence()
                    || (candidate.confidence() == best.confidence() && matched.size() > best.matchedKeywords().size())) {
                best = candidate;
            }
        }
        if (best == null) {
            log.debug("No domain keywords matched; using {}", DomainConfiguration.GENERAL);
            return new Detection(DomainConfiguration.GENERAL, GENERAL_CONFIDENCE, List.of());
        }
        log.info("Detected domain {} (confidence={}, keywords={})", best.domain(), best.confidence(), best.matchedKeywords());
        return best;
    }

    public record Detection(String domain, double confidence, List<String> matchedKeywords) {
        public Detection {
            matchedKeywords = List.copyOf(matchedKeywords);
        }
    }
}
