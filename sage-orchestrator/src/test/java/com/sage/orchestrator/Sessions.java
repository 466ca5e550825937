package com.sage.orchestrator;

import com.sage.gate.GateMetrics;
import com.sage.gate.GateSettings;
import com.sage.gate.ProviderRegistry;
import com.sage.gate.RetryPolicy;
import com.sage.gate.SearchProvider;
import com.sage.llm.ChatModelClient;
import com.sage.llm.ModelCatalog;
import com.sage.llm.ModelPreferenceTable;
import com.sage.llm.ModelSpec;
import com.sage.llm.PrivacyRouter;
import com.sage.memory.InMemoryMemoryStore;
import com.sage.memory.ResilientMemory;
import com.sage.model.ModelTier;
import com.sage.progress.ProgressBroadcaster;
import com.sage.search.SearchAggregator;

/** Wires a research context against stub providers, a scripted local model and an in-memory store. */
public final class Sessions {

    public static final String LOCAL_MODEL = "llama3.2:3b";
    public static final GateSettings GATE = new GateSettings(5, 30_000L, 600_000L, 3, 2L, 10L);

    public final TestClock clock = new TestClock();
    public final InMemoryMemoryStore store = new InMemoryMemoryStore(clock::nowMillis);
    public final ProgressBroadcaster broadcaster = new ProgressBroadcaster();
    public final ProviderRegistry registry = new ProviderRegistry(GATE, clock, new GateMetrics(null));
    public final ModelCatalog catalog = new ModelCatalog();
    public OrchestratorSettings settings = new OrchestratorSettings(20, false, 3, 3);

    public Sessions provider(SearchProvider provider) {
        registry.register(provider);
        return this;
    }

    public Sessions model(String name, ModelTier tier, ChatModelClient client) {
        catalog.register(new ModelSpec(name, tier, client));
        return this;
    }

    public Sessions localModel(ChatModelClient client) {
        return model(LOCAL_MODEL, ModelTier.LOCAL_FAST, client);
    }

    public Sessions settings(OrchestratorSettings value) {
        this.settings = value;
        return this;
    }

    public ResearchContext context() {
        PrivacyRouter router = new PrivacyRouter(catalog, ModelPreferenceTable.loadDefault(), null,
                new RetryPolicy(2, 10, 100));
        return ResearchContext.builder()
                .settings(settings)
                .registry(registry)
                .aggregator(new SearchAggregator(registry, store::isKnownFailure, 5, 5_000))
                .router(router)
                .memory(ResilientMemory.of(store))
                .broadcaster(broadcaster)
                .clock(clock)
                .build();
    }
}
