package com.sage.orchestrator.step;

import com.sage.gate.ProviderRegistry;
import com.sage.memory.MemoryDocument;
import com.sage.memory.ResilientMemory;
import com.sage.model.Entity;
import com.sage.model.Fact;
import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.orchestrator.OrchestratorSettings;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.orchestrator.domain.DomainConfiguration;
import com.sage.orchestrator.domain.SourceSelector;
import com.sage.search.ProviderRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Chooses the providers and sub-queries for the next cycle, then opens it.
 * <p>
 * Later cycles widen the search with sub-queries for contradicted facts and for entities that have not been
 * queried yet; a sub-query already run in this session is never repeated, apart from the original query.
 */
public final class PlanStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(PlanStep.class);

    static final String REPORT_TYPE = "report";
    private static final int MAX_FACT_QUERY_WORDS = 12;

    private final OrchestratorSettings settings;
    private final ResilientMemory memory;
    private final SourceSelector selector;

    public PlanStep(ResearchContext context) {
        this(context.getSettings(), context.getMemory(), context.getRegistry());
    }

    PlanStep(OrchestratorSettings settings, ResilientMemory memory, ProviderRegistry registry) {
        this.settings = settings;
        this.memory = memory;
        this.selector = new SourceSelector(new ProviderRanking(memory::getSourceEffectiveness), registry::isAvailable);
    }

    @Override
    public Phase phase() {
        return Phase.PLAN;
    }

    @Override
    public Transition apply(ResearchState state) {
        DomainConfiguration domain = DomainConfiguration.forDomain(state.getDomain());
        List<String> sources = selector.select(domain);
        if (sources.isEmpty()) {
            state.addGap("No search provider is available for domain " + domain.name());
        }
        state.setPlannedSources(sources);
        state.setPlannedCategories(sources);

        if (state.getCycle() == 0) {
            lookUpPastResearch(state, domain.name());
        } else {
            state.setSubQueries(followUpQueries(state, settings.maxSubQueries()));
        }
        state.beginCycle();
        log.info("Session {} cycle {} plan: sources={} subQueries={}",
                state.getSessionId(), state.getCycle(), sources, state.getSubQueries());

        Phase next = settings.approvalRequired() && !state.isApproved() ? Phase.AWAIT_APPROVAL : Phase.COLLECT;
        return Transition.to(next, "cycle " + state.getCycle() + " with " + sources.size() + " source(s)");
    }

    private void lookUpPastResearch(ResearchState state, String domain) {
        if (settings.pastResearchLimit() == 0) return;
        List<MemoryDocument> past = memory.searchSimilar(state.getQuery(), settings.pastResearchLimit(),
                Map.of("type", REPORT_TYPE, "domain", domain));
        for (MemoryDocument doc : past) {
            log.info("Related past research {} (score={}): {}", doc.getSessionId(), doc.getScore(),
                    doc.getMetadata().getOrDefault("query", ""));
        }
    }

    /** The original query followed by new sub-queries, capped at {@code limit} in total. */
    static List<String> followUpQueries(ResearchState state, int limit) {
        Set<String> executed = state.getExecutedQueries();
        Set<String> queries = new LinkedHashSet<>();
        queries.add(state.getQuery());
        for (Fact fact : state.getFacts()) {
            if (queries.size() >= limit) break;
            if (fact.getContradictions().isEmpty()) continue;
            String q = firstWords(fact.getStatement(), MAX_FACT_QUERY_WORDS);
            if (!executed.contains(q)) queries.add(q);
        }
        List<Entity> entities = new ArrayList<>(state.getEntities());
        for (int i = entities.size() - 1; i >= 0 && queries.size() < limit; i--) {
            Entity e = entities.get(i);
            if ("DATE".equals(e.getType())) continue;
            if (state.getQuery().toLowerCase(Locale.ROOT).contains(e.getName().toLowerCase(Locale.ROOT))) continue;
            String q = state.getQuery() + " " + e.getName();
            if (!executed.contains(q)) queries.add(q);
        }
        return new ArrayList<>(queries);
    }

    private static String firstWords(String text, int n) {
        String[] words = text.trim().split("\\s+");
        if (words.length <= n) return text.trim();
        return String.join(" ", List.of(words).subList(0, n));
    }
}
