package com.sage.orchestrator;

import com.sage.gate.GateClock;
import com.sage.gate.ProviderRegistry;
import com.sage.llm.PrivacyRouter;
import com.sage.memory.InMemoryMemoryStore;
import com.sage.memory.ResilientMemory;
import com.sage.orchestrator.export.ReportExporter;
import com.sage.orchestrator.verify.HeuristicVerifier;
import com.sage.orchestrator.verify.Verifier;
import com.sage.progress.ProgressBroadcaster;
import com.sage.saturation.SaturationEvaluator;
import com.sage.saturation.SaturationPolicy;
import com.sage.search.SearchAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Collaborators shared by the phase steps of a session: search, models, saturation policy, memory, verification,
 * export, progress, clock and metrics.
 */
public final class ResearchContext {

    private final OrchestratorSettings settings;
    private final ProviderRegistry registry;
    private final SearchAggregator aggregator;
    private final PrivacyRouter router;
    private final SaturationEvaluator evaluator;
    private final ResilientMemory memory;
    private final Verifier verifier;
    private final ReportExporter exporter;
    private final ProgressBroadcaster broadcaster;
    private final GateClock clock;
    private final MeterRegistry meterRegistry;

    private ResearchContext(Builder b) {
        this.settings = b.settings != null ? b.settings : OrchestratorSettings.defaults();
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.aggregator = Objects.requireNonNull(b.aggregator, "aggregator");
        this.router = Objects.requireNonNull(b.router, "router");
        this.evaluator = b.evaluator != null ? b.evaluator : new SaturationEvaluator(SaturationPolicy.defaults());
        this.memory = b.memory != null ? b.memory : ResilientMemory.of(new InMemoryMemoryStore());
        this.verifier = b.verifier != null ? b.verifier : new HeuristicVerifier();
        this.exporter = b.exporter != null ? b.exporter : ReportExporter.NONE;
        this.broadcaster = b.broadcaster != null ? b.broadcaster : new ProgressBroadcaster();
        this.clock = b.clock != null ? b.clock : GateClock.SYSTEM;
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
    }

    public static Builder builder() {
        return new Builder();
    }

    public OrchestratorSettings getSettings() { return settings; }
    public ProviderRegistry getRegistry() { return registry; }
    public SearchAggregator getAggregator() { return aggregator; }
    public PrivacyRouter getRouter() { return router; }
    public SaturationEvaluator getEvaluator() { return evaluator; }
    public ResilientMemory getMemory() { return memory; }
    public Verifier getVerifier() { return verifier; }
    public ReportExporter getExporter() { return exporter; }
    public ProgressBroadcaster getBroadcaster() { return broadcaster; }
    public GateClock getClock() { return clock; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }

    public static final class Builder {
        private OrchestratorSettings settings;
        private ProviderRegistry registry;
        private SearchAggregator aggregator;
        private PrivacyRouter router;
        private SaturationEvaluator evaluator;
        private ResilientMemory memory;
        private Verifier verifier;
        private ReportExporter exporter;
        private ProgressBroadcaster broadcaster;
        private GateClock clock;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        public Builder settings(OrchestratorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder aggregator(SearchAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder router(PrivacyRouter router) {
            this.router = router;
            return this;
        }

        public Builder evaluator(SaturationEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder memory(ResilientMemory memory) {
            this.memory = memory;
            return this;
        }

        public Builder verifier(Verifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder exporter(ReportExporter exporter) {
            this.exporter = exporter;
            return this;
        }

        public Builder broadcaster(ProgressBroadcaster broadcaster) {
            this.broadcaster = broadcaster;
            return this;
        }

        public Builder clock(GateClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public ResearchContext build() {
            return new ResearchContext(this);
        }
    }
}
