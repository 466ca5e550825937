package com.sage.worker;

import com.sage.config.SageConfig;
import com.sage.gate.GateClock;
import com.sage.gate.GateMetrics;
import com.sage.gate.GateSettings;
import com.sage.gate.ProviderRegistry;
import com.sage.gate.SearchProvider;
import com.sage.llm.ModelCatalog;
import com.sage.llm.ModelPreferenceTable;
import com.sage.llm.ModelSpec;
import com.sage.llm.PrivacyRouter;
import com.sage.llm.litellm.LiteLlmChatClient;
import com.sage.llm.ollama.OllamaChatClient;
import com.sage.memory.InMemoryMemoryStore;
import com.sage.memory.ResilientMemory;
import com.sage.memory.jdbc.JdbcConnectionProvider;
import com.sage.memory.jdbc.JdbcMemoryStore;
import com.sage.memory.jdbc.MemorySchemaBootstrapper;
import com.sage.model.ModelTier;
import com.sage.orchestrator.OrchestratorSettings;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.export.JsonReportExporter;
import com.sage.progress.ProgressBroadcaster;
import com.sage.progress.RedisProgressSink;
import com.sage.provider.arxiv.ArxivSearchProvider;
import com.sage.provider.pubmed.PubMedSearchProvider;
import com.sage.provider.semanticscholar.SemanticScholarSearchProvider;
import com.sage.provider.tavily.TavilySearchProvider;
import com.sage.provider.unpaywall.UnpaywallSearchProvider;
import com.sage.saturation.SaturationEvaluator;
import com.sage.saturation.SaturationPolicy;
import com.sage.search.SearchAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one process needs to run research sessions, wired from {@link SageConfig}. Owns the executors and
 * connections it creates; {@link #close()} releases them.
 */
public final class SageRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SageRuntime.class);
    private static final Duration MODEL_TIMEOUT = Duration.ofSeconds(120);

    private final ProviderRegistry registry;
    private final ModelCatalog catalog;
    private final ResilientMemory memory;
    private final ResearchContext context;
    private final List<AutoCloseable> resources = new ArrayList<>();

    private SageRuntime(SageConfig config, Path reportDirectory, MeterRegistry meterRegistry) {
        GateSettings gateSettings = new GateSettings(
                config.getBreakerFailureThreshold(),
                config.getBreakerCooldownMillis(),
                config.getBreakerMaxCooldownMillis(),
                config.getRetryMaxAttempts(),
                config.getRetryBaseMillis(),
                config.getRetryMaxMillis());
        this.registry = new ProviderRegistry(gateSettings, GateClock.SYSTEM, new GateMetrics(meterRegistry),
                provider -> config.getRequestsPerSecond(provider.name()));
        for (String name : config.getProviders()) {
            Optional<SearchProvider> provider = createProvider(name, config);
            if (provider.isPresent()) {
                registry.register(provider.get());
            } else {
                log.warn("Unknown search provider {} in configuration; skipping", name);
            }
        }

        this.catalog = createCatalog(config);
        this.memory = createMemory(config);
        registry.setAccessFailureListener(memory::recordAccessFailure);

        ProgressBroadcaster broadcaster = new ProgressBroadcaster();
        if (config.isRedisProgressEnabled()) {
            RedisProgressSink sink = new RedisProgressSink(config.getCacheHost(), config.getCachePort());
            broadcaster.subscribe(sink);
            resources.add(sink);
            log.info("Publishing progress to Redis at {}:{}", config.getCacheHost(), config.getCachePort());
        }

        SearchAggregator aggregator = new SearchAggregator(registry, memory::isKnownFailure,
                config.getMaxConcurrentCalls(), config.getProviderTimeoutMillis());
        PrivacyRouter router = new PrivacyRouter(catalog, ModelPreferenceTable.loadDefault(), null,
                gateSettings.retryPolicy());
        resources.add(aggregator);
        resources.add(router);

        this.context = ResearchContext.builder()
                .settings(OrchestratorSettings.from(config))
                .registry(registry)
                .aggregator(aggregator)
                .router(router)
                .evaluator(new SaturationEvaluator(new SaturationPolicy(config.getEntityThreshold(),
                        config.getFactThreshold(), config.getCoverageThreshold(), config.getDebounceWindow(),
                        config.getMaxCycles())))
                .memory(memory)
                .exporter(new JsonReportExporter(reportDirectory))
                .broadcaster(broadcaster)
                .clock(GateClock.SYSTEM)
                .meterRegistry(meterRegistry)
                .build();
    }

    public static SageRuntime create(SageConfig config, Path reportDirectory) {
        return create(config, reportDirectory, new SimpleMeterRegistry());
    }

    public static SageRuntime create(SageConfig config, Path reportDirectory, MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(reportDirectory, "reportDirectory");
        return new SageRuntime(config, reportDirectory, meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
    }

    static Optional<SearchProvider> createProvider(String name, SageConfig config) {
        switch (name) {
            case PubMedSearchProvider.NAME:
                return Optional.of(new PubMedSearchProvider());
            case SemanticScholarSearchProvider.NAME:
                return Optional.of(new SemanticScholarSearchProvider(config.getSemanticScholarApiKey()));
            case TavilySearchProvider.NAME:
                return Optional.of(new TavilySearchProvider(config.getTavilyApiKey()));
            case ArxivSearchProvider.NAME:
                return Optional.of(new ArxivSearchProvider());
            case UnpaywallSearchProvider.NAME:
                return Optional.of(new UnpaywallSearchProvider(config.getUnpaywallEmail()));
            default:
                return Optional.empty();
        }
    }

    /** Fast and powerful local models always; the cloud model only when an API key is configured. */
    static ModelCatalog createCatalog(SageConfig config) {
        ModelCatalog catalog = new ModelCatalog();
        OllamaChatClient ollama = new OllamaChatClient(config.getOllamaBaseUrl(), MODEL_TIMEOUT);
        catalog.register(new ModelSpec(config.getOllamaFastModel(), ModelTier.LOCAL_FAST, ollama));
        catalog.register(new ModelSpec(config.getOllamaPowerfulModel(), ModelTier.LOCAL_POWERFUL, ollama));
        String apiKey = config.getLiteLlmApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            catalog.register(new ModelSpec(config.getLiteLlmModel(), ModelTier.CLOUD_BEST,
                    new LiteLlmChatClient(config.getLiteLlmBaseUrl(), apiKey, MODEL_TIMEOUT)));
        } else {
            log.info("No LiteLLM API key configured; cloud models disabled");
        }
        return catalog;
    }

    private static ResilientMemory createMemory(SageConfig config) {
        if (!config.isJdbcMemoryEnabled()) {
            return ResilientMemory.of(new InMemoryMemoryStore());
        }
        try {
            JdbcConnectionProvider connections = new JdbcConnectionProvider(config);
            new MemorySchemaBootstrapper().ensureSchema(connections);
            log.info("Research memory on PostgreSQL at {}:{}/{}", config.getDbHost(), config.getDbPort(), config.getDbName());
            return ResilientMemory.of(new JdbcMemoryStore(connections));
        } catch (RuntimeException e) {
            log.warn("Research memory using in-process store: could not initialise JDBC store ({}). Execution continues.",
                    e.getMessage());
            return ResilientMemory.of(new InMemoryMemoryStore());
        }
    }

    public ResearchContext context() {
        return context;
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    public ResilientMemory memory() {
        return memory;
    }

    @Override
    public void close() {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
        resources.clear();
    }
}
