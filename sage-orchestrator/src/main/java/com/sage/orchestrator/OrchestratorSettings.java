package com.sage.orchestrator;

import com.sage.config.SageConfig;

/**
 * Orchestrator knobs taken from {@link SageConfig}.
 *
 * @param maxResultsPerQuery per-provider result limit for each sub-query
 * @param maxSubQueries      sub-queries run per cycle, the original query included
 * @param pastResearchLimit  related past reports looked up while planning the first cycle
 */
public record OrchestratorSettings(int maxResultsPerQuery, boolean approvalRequired, int maxSubQueries,
                                   int pastResearchLimit) {

    public static final int DEFAULT_MAX_SUB_QUERIES = 3;
    public static final int DEFAULT_PAST_RESEARCH_LIMIT = 3;

    public OrchestratorSettings {
        maxResultsPerQuery = Math.max(1, maxResultsPerQuery);
        maxSubQueries = Math.max(1, maxSubQueries);
        pastResearchLimit = Math.max(0, pastResearchLimit);
    }

    public static OrchestratorSettings from(SageConfig config) {
        return new OrchestratorSettings(config.getMaxResultsPerQuery(), config.isApprovalRequired(),
                DEFAULT_MAX_SUB_QUERIES, DEFAULT_PAST_RESEARCH_LIMIT);
    }

    public static OrchestratorSettings defaults() {
        return from(SageConfig.builder().build());
    }
}
