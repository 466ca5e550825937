package com.sage.orchestrator.domain;

import com.sage.search.ProviderRanking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Picks the providers for a domain: primary then secondary sources, minus excluded ones and ones the
 * registry cannot serve, ranked by learned effectiveness with static priority as the tie-breaker.
 */
public final class SourceSelector {

    static final double PRIMARY_PRIORITY = 1.0;
    static final double SECONDARY_PRIORITY = 0.5;

    private final ProviderRanking ranking;
    private final Predicate<String> available;

    /**
     * @param available answers whether a provider is registered and usable
     */
    public SourceSelector(ProviderRanking ranking, Predicate<String> available) {
        this.ranking = Objects.requireNonNull(ranking, "ranking");
        this.available = available != null ? available : name -> true;
    }

    public List<String> select(DomainConfiguration domain) {
        Map<String, Double> priority = new LinkedHashMap<>();
        for (String source : domain.primarySources()) {
            if (usable(domain, source)) priority.putIfAbsent(source, PRIMARY_PRIORITY);
        }
        for (String source : domain.secondarySources()) {
            if (usable(domain, source)) priority.putIfAbsent(source, SECONDARY_PRIORITY);
        }
        return ranking.rank(domain.name(), new ArrayList<>(priority.keySet()), priority);
    }

    private boolean usable(DomainConfiguration domain, String source) {
        return !domain.isExcluded(source) && available.test(source);
    }
}
