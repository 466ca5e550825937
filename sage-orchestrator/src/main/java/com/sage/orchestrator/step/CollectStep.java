package com.sage.orchestrator.step;

import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.model.SourceResult;
import com.sage.model.error.SourceExhaustedException;
import com.sage.orchestrator.OrchestratorSettings;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.search.CollectionReport;
import com.sage.search.SearchAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every planned sub-query against the planned providers and records what came back.
 * <p>
 * URLs already held from earlier cycles are cited but not stored again. When every sub-query comes back empty the
 * cycle is marked exhausted and processing is skipped.
 */
public final class CollectStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(CollectStep.class);

    private final OrchestratorSettings settings;
    private final SearchAggregator aggregator;

    public CollectStep(ResearchContext context) {
        this(context.getSettings(), context.getAggregator());
    }

    CollectStep(OrchestratorSettings settings, SearchAggregator aggregator) {
        this.settings = settings;
        this.aggregator = aggregator;
    }

    @Override
    public Phase phase() {
        return Phase.COLLECT;
    }

    @Override
    public Transition apply(ResearchState state) {
        List<String> providers = state.getPlannedSources();
        List<String> subQueries = state.getSubQueries().isEmpty() ? List.of(state.getQuery()) : state.getSubQueries();
        int exhausted = 0;
        int added = 0;
        for (String subQuery : subQueries) {
            state.markQueryExecuted(subQuery);
            try {
                CollectionReport report = aggregator.collectDetailed(subQuery, providers,
                        settings.maxResultsPerQuery(), Map.of());
                report.providersQueried().forEach(state::markCategoryQueried);
                report.citations().forEach(state::addCycleCitation);
                Set<String> known = state.getSourceUrls();
                for (SourceResult r : report.results()) {
                    if (known.add(r.getUrl())) {
                        state.addSourceResult(r);
                        added++;
                    }
                }
                if (!report.providersTimedOut().isEmpty()) {
                    state.addGap("Timed out: " + String.join(", ", report.providersTimedOut()) + " for \"" + subQuery + "\"");
                }
            } catch (SourceExhaustedException e) {
                e.getProviders().forEach(state::markCategoryQueried);
                exhausted++;
                log.info("Session {} sub-query \"{}\" exhausted: {}", state.getSessionId(), subQuery, e.getProviders());
            }
        }
        if (exhausted == subQueries.size()) {
            state.setCycleExhausted(true);
            state.addGap("No results from " + (providers.isEmpty() ? "any provider" : String.join(", ", providers))
                    + " for \"" + state.getQuery() + "\"");
            return Transition.to(Phase.EVALUATE, "sources exhausted in cycle " + state.getCycle());
        }
        return Transition.to(Phase.PROCESS, added + " new result(s) from " + subQueries.size() + " sub-query(ies)");
    }
}
