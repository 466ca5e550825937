package com.sage.orchestrator.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source preferences and verification strictness for one research domain.
 *
 * @param verificationThreshold minimum confidence for a multi-source fact to count as verified
 * @param keywords              lower-case terms that point a query at this domain
 */
public record DomainConfiguration(
        String name,
        List<String> primarySources,
        List<String> secondarySources,
        double verificationThreshold,
        List<String> excludedSources,
        List<String> keywords
) {

    public static final String GENERAL = "general";

    private static final Map<String, DomainConfiguration> PRESETS = new LinkedHashMap<>();

    static {
        register(new DomainConfiguration("medical",
                List.of("pubmed", "semantic_scholar"),
                List.of("arxiv", "unpaywall", "playwright_crawler"),
                0.8,
                List.of("wikipedia"),
                List.of("clinical", "patient", "treatment", "diagnosis", "therapy", "medical", "disease", "drug",
                        "pharmaceutical", "healthcare", "symptom", "hospital", "doctor", "medicine", "health",
                        "disorder", "syndrome", "pathology", "oncology", "cardiology")));
        register(new DomainConfiguration("competitive_intelligence",
                List.of("tavily", "exa", "brave"),
                List.of("playwright_crawler"),
                0.6,
                List.of(),
                List.of("company", "market", "competitor", "funding", "product", "revenue", "startup",
                        "acquisition", "valuation", "business", "industry", "investment", "stock", "profit",
                        "sales", "enterprise", "corporation", "shareholder")));
        register(new DomainConfiguration("academic",
                List.of("semantic_scholar", "arxiv"),
                List.of("unpaywall", "pubmed"),
                0.7,
                List.of(),
                List.of("research", "study", "paper", "journal", "peer-reviewed", "publication", "citation",
                        "methodology", "hypothesis", "thesis", "dissertation", "scholar", "academic", "university",
                        "professor", "experiment", "analysis")));
        register(new DomainConfiguration("regulatory",
                List.of("tavily", "brave"),
                List.of("playwright_crawler"),
                0.8,
                List.of(),
                List.of("regulation", "compliance", "fda", "policy", "law", "requirement", "standard", "guideline",
                        "legal", "legislation", "government", "rule", "mandate", "authority", "approval", "license",
                        "permit", "audit")));
        register(new DomainConfiguration(GENERAL,
                List.of("tavily", "brave", "semantic_scholar"),
                List.of("arxiv"),
                0.6,
                List.of(),
                List.of()));
    }

    public DomainConfiguration {
        Objects.requireNonNull(name, "name");
        primarySources = primarySources != null ? List.copyOf(primarySources) : List.of();
        secondarySources = secondarySources != null ? List.copyOf(secondarySources) : List.of();
        excludedSources = excludedSources != null ? List.copyOf(excludedSources) : List.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    private static void register(DomainConfiguration config) {
        PRESETS.put(config.name(), config);
    }

    public static Optional<DomainConfiguration> find(String domain) {
        if (domain == null) return Optional.empty();
        return Optional.ofNullable(PRESETS.get(domain.trim().toLowerCase(Locale.ROOT)));
    }

    /** Preset for the domain, or the general preset for unknown names. */
    public static DomainConfiguration forDomain(String domain) {
        return find(domain).orElse(PRESETS.get(GENERAL));
    }

    public static List<DomainConfiguration> presets() {
        return List.copyOf(PRESETS.values());
    }

    public boolean isExcluded(String source) {
        return excludedSources.contains(source);
    }
}
