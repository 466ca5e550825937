package com.sage.model.error;

import java.util.List;

/**
 * Every provider returned nothing for the cycle. Terminal for the current cycle; the orchestrator moves
 * straight to EVALUATE.
 */
public final class SourceExhaustedException extends ResearchException {

    private final List<String> providers;

    public SourceExhaustedException(List<String> providers) {
        super("All providers returned no results: " + providers);
        this.providers = providers != null ? List.copyOf(providers) : List.of();
    }

    public List<String> getProviders() {
        return providers;
    }
}
