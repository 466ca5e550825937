package com.sage.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for a research session.
 * <p>
 * Gate: SAGE_RETRY_*, SAGE_BREAKER_*, SAGE_RPS_&lt;PROVIDER&gt;. Search: SAGE_PROVIDERS, SAGE_MAX_CONCURRENT,
 * SAGE_PROVIDER_TIMEOUT_MS, SAGE_MAX_RESULTS. Saturation: SAGE_SATURATION_*, SAGE_MAX_CYCLES.
 * Models: SAGE_OLLAMA_*, SAGE_LITELLM_*. Providers: SAGE_TAVILY_API_KEY, SAGE_SEMANTIC_SCHOLAR_API_KEY,
 * SAGE_UNPAYWALL_EMAIL. Storage: SAGE_DB_*, SAGE_CACHE_*.
 */
public final class SageConfig {

    private static final String ENV_PROVIDERS = "SAGE_PROVIDERS";
    private static final String ENV_RPS_PREFIX = "SAGE_RPS_";
    private static final String ENV_RETRY_BASE_MS = "SAGE_RETRY_BASE_MS";
    private static final String ENV_RETRY_MAX_MS = "SAGE_RETRY_MAX_MS";
    private static final String ENV_RETRY_MAX_ATTEMPTS = "SAGE_RETRY_MAX_ATTEMPTS";
    private static final String ENV_BREAKER_THRESHOLD = "SAGE_BREAKER_THRESHOLD";
    private static final String ENV_BREAKER_COOLDOWN_MS = "SAGE_BREAKER_COOLDOWN_MS";
    private static final String ENV_BREAKER_MAX_COOLDOWN_MS = "SAGE_BREAKER_MAX_COOLDOWN_MS";
    private static final String ENV_MAX_CONCURRENT = "SAGE_MAX_CONCURRENT";
    private static final String ENV_PROVIDER_TIMEOUT_MS = "SAGE_PROVIDER_TIMEOUT_MS";
    private static final String ENV_MAX_RESULTS = "SAGE_MAX_RESULTS";
    private static final String ENV_ENTITY_THRESHOLD = "SAGE_SATURATION_ENTITY_THRESHOLD";
    private static final String ENV_FACT_THRESHOLD = "SAGE_SATURATION_FACT_THRESHOLD";
    private static final String ENV_COVERAGE_THRESHOLD = "SAGE_SATURATION_COVERAGE_THRESHOLD";
    private static final String ENV_DEBOUNCE = "SAGE_SATURATION_DEBOUNCE";
    private static final String ENV_MAX_CYCLES = "SAGE_MAX_CYCLES";
    private static final String ENV_REQUIRE_APPROVAL = "SAGE_REQUIRE_APPROVAL";
    private static final String ENV_OLLAMA_URL = "SAGE_OLLAMA_URL";
    private static final String ENV_OLLAMA_FAST_MODEL = "SAGE_OLLAMA_FAST_MODEL";
    private static final String ENV_OLLAMA_POWERFUL_MODEL = "SAGE_OLLAMA_POWERFUL_MODEL";
    private static final String ENV_LITELLM_URL = "SAGE_LITELLM_URL";
    private static final String ENV_LITELLM_MODEL = "SAGE_LITELLM_MODEL";
    private static final String ENV_LITELLM_API_KEY = "SAGE_LITELLM_API_KEY";
    private static final String ENV_TAVILY_API_KEY = "SAGE_TAVILY_API_KEY";
    private static final String ENV_SEMANTIC_SCHOLAR_API_KEY = "SAGE_SEMANTIC_SCHOLAR_API_KEY";
    private static final String ENV_UNPAYWALL_EMAIL = "SAGE_UNPAYWALL_EMAIL";
    private static final String ENV_DB_HOST = "SAGE_DB_HOST";
    private static final String ENV_DB_PORT = "SAGE_DB_PORT";
    private static final String ENV_DB_NAME = "SAGE_DB_NAME";
    private static final String ENV_DB_USER = "SAGE_DB_USER";
    private static final String ENV_DB_PASSWORD = "SAGE_DB_PASSWORD";
    private static final String ENV_MEMORY_JDBC = "SAGE_MEMORY_JDBC";
    private static final String ENV_CACHE_HOST = "SAGE_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "SAGE_CACHE_PORT";
    private static final String ENV_PROGRESS_REDIS = "SAGE_PROGRESS_REDIS";

    private static final List<String> DEFAULT_PROVIDERS = List.of("pubmed", "semantic_scholar", "tavily");
    /** Built-in requests-per-second per provider; strict APIs get 1 RPS. */
    private static final Map<String, Double> DEFAULT_RPS = Map.of(
            "pubmed", 3.0,
            "semantic_scholar", 1.0,
            "tavily", 1.0,
            "arxiv", 0.33,
            "unpaywall", 10.0);
    private static final double FALLBACK_RPS = 1.0;

    private final List<String> providers;
    private final Map<String, Double> providerRps;
    private final long retryBaseMillis;
    private final long retryMaxMillis;
    private final int retryMaxAttempts;
    private final int breakerFailureThreshold;
    private final long breakerCooldownMillis;
    private final long breakerMaxCooldownMillis;
    private final int maxConcurrentCalls;
    private final long providerTimeoutMillis;
    private final int maxResultsPerQuery;
    private final double entityThreshold;
    private final double factThreshold;
    private final double coverageThreshold;
    private final int debounceWindow;
    private final int maxCycles;
    private final boolean approvalRequired;
    private final String ollamaBaseUrl;
    private final String ollamaFastModel;
    private final String ollamaPowerfulModel;
    private final String liteLlmBaseUrl;
    private final String liteLlmModel;
    private final String liteLlmApiKey;
    private final String tavilyApiKey;
    private final String semanticScholarApiKey;
    private final String unpaywallEmail;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final boolean jdbcMemoryEnabled;
    private final String cacheHost;
    private final int cachePort;
    private final boolean redisProgressEnabled;

    private SageConfig(Builder b) {
        this.providers = Collections.unmodifiableList(new ArrayList<>(b.providers));
        this.providerRps = Collections.unmodifiableMap(new LinkedHashMap<>(b.providerRps));
        this.retryBaseMillis = b.retryBaseMillis;
        this.retryMaxMillis = b.retryMaxMillis;
        this.retryMaxAttempts = b.retryMaxAttempts;
        this.breakerFailureThreshold = b.breakerFailureThreshold;
        this.breakerCooldownMillis = b.breakerCooldownMillis;
        this.breakerMaxCooldownMillis = Math.max(b.breakerCooldownMillis, b.breakerMaxCooldownMillis);
        this.maxConcurrentCalls = b.maxConcurrentCalls;
        this.providerTimeoutMillis = b.providerTimeoutMillis;
        this.maxResultsPerQuery = b.maxResultsPerQuery;
        this.entityThreshold = b.entityThreshold;
        this.factThreshold = b.factThreshold;
        this.coverageThreshold = b.coverageThreshold;
        this.debounceWindow = b.debounceWindow;
        this.maxCycles = b.maxCycles;
        this.approvalRequired = b.approvalRequired;
        this.ollamaBaseUrl = b.ollamaBaseUrl;
        this.ollamaFastModel = b.ollamaFastModel;
        this.ollamaPowerfulModel = b.ollamaPowerfulModel;
        this.liteLlmBaseUrl = b.liteLlmBaseUrl;
        this.liteLlmModel = b.liteLlmModel;
        this.liteLlmApiKey = b.liteLlmApiKey;
        this.tavilyApiKey = b.tavilyApiKey;
        this.semanticScholarApiKey = b.semanticScholarApiKey;
        this.unpaywallEmail = b.unpaywallEmail;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.jdbcMemoryEnabled = b.jdbcMemoryEnabled;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.redisProgressEnabled = b.redisProgressEnabled;
    }

    /** Provider names enabled for this worker (SAGE_PROVIDERS). Default pubmed, semantic_scholar, tavily. */
    public List<String> getProviders() {
        return providers;
    }

    /**
     * Requests per second for the provider: SAGE_RPS_&lt;NAME&gt; if set, else the built-in default, else 1.0.
     */
    public double getRequestsPerSecond(String provider) {
        if (provider == null) return FALLBACK_RPS;
        Double rps = providerRps.get(provider.toLowerCase(Locale.ROOT));
        return rps != null && rps > 0 ? rps : FALLBACK_RPS;
    }

    public Map<String, Double> getProviderRps() {
        return providerRps;
    }

    /** First retry wait in milliseconds. Default 4000. */
    public long getRetryBaseMillis() {
        return retryBaseMillis;
    }

    /** Upper bound for a single retry wait. Default 60000. */
    public long getRetryMaxMillis() {
        return retryMaxMillis;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    /** Consecutive failed calls that open a provider circuit. Default 5. */
    public int getBreakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public long getBreakerCooldownMillis() {
        return breakerCooldownMillis;
    }

    public long getBreakerMaxCooldownMillis() {
        return breakerMaxCooldownMillis;
    }

    /** Global cap on simultaneous outbound provider calls. Default 5. */
    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public long getProviderTimeoutMillis() {
        return providerTimeoutMillis;
    }

    public int getMaxResultsPerQuery() {
        return maxResultsPerQuery;
    }

    public double getEntityThreshold() {
        return entityThreshold;
    }

    public double getFactThreshold() {
        return factThreshold;
    }

    public double getCoverageThreshold() {
        return coverageThreshold;
    }

    /** Consecutive cycles the saturation condition must hold before stopping. Default 2. */
    public int getDebounceWindow() {
        return debounceWindow;
    }

    public int getMaxCycles() {
        return maxCycles;
    }

    /** When true, the plan is held at AWAIT_APPROVAL until approved. Default false. */
    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getOllamaFastModel() {
        return ollamaFastModel;
    }

    public String getOllamaPowerfulModel() {
        return ollamaPowerfulModel;
    }

    public String getLiteLlmBaseUrl() {
        return liteLlmBaseUrl;
    }

    public String getLiteLlmModel() {
        return liteLlmModel;
    }

    /** API key for LiteLLM; null when the cloud tier is not configured. */
    public String getLiteLlmApiKey() {
        return liteLlmApiKey;
    }

    public String getTavilyApiKey() {
        return tavilyApiKey;
    }

    public String getSemanticScholarApiKey() {
        return semanticScholarApiKey;
    }

    /** Contact email Unpaywall requires on every request; null leaves the provider unavailable. */
    public String getUnpaywallEmail() {
        return unpaywallEmail;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** Whether memory and checkpoints are persisted to PostgreSQL (SAGE_MEMORY_JDBC). Default false. */
    public boolean isJdbcMemoryEnabled() {
        return jdbcMemoryEnabled;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Whether progress snapshots are pushed to Redis (SAGE_PROGRESS_REDIS). Default false. */
    public boolean isRedisProgressEnabled() {
        return redisProgressEnabled;
    }

    public static SageConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Reads configuration through the given lookup (e.g. {@code System::getenv} or a map's {@code get}).
     * Missing, blank or malformed values fall back to defaults.
     */
    public static SageConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> providers = parseCommaSeparated(env.apply(ENV_PROVIDERS));
        if (providers.isEmpty()) providers = DEFAULT_PROVIDERS;

        Map<String, Double> rps = new LinkedHashMap<>(DEFAULT_RPS);
        for (String p : providers) {
            String key = ENV_RPS_PREFIX + p.toUpperCase(Locale.ROOT);
            double value = parseDouble(env.apply(key), rps.getOrDefault(p, FALLBACK_RPS));
            rps.put(p, value);
        }

        return builder()
                .providers(providers)
                .providerRps(rps)
                .retryBaseMillis(parseLong(env.apply(ENV_RETRY_BASE_MS), 4_000L))
                .retryMaxMillis(parseLong(env.apply(ENV_RETRY_MAX_MS), 60_000L))
                .retryMaxAttempts(parseInt(env.apply(ENV_RETRY_MAX_ATTEMPTS), 5))
                .breakerFailureThreshold(parseInt(env.apply(ENV_BREAKER_THRESHOLD), 5))
                .breakerCooldownMillis(parseLong(env.apply(ENV_BREAKER_COOLDOWN_MS), 30_000L))
                .breakerMaxCooldownMillis(parseLong(env.apply(ENV_BREAKER_MAX_COOLDOWN_MS), 600_000L))
                .maxConcurrentCalls(parseInt(env.apply(ENV_MAX_CONCURRENT), 5))
                .providerTimeoutMillis(parseLong(env.apply(ENV_PROVIDER_TIMEOUT_MS), 20_000L))
                .maxResultsPerQuery(parseInt(env.apply(ENV_MAX_RESULTS), 20))
                .entityThreshold(parseDouble(env.apply(ENV_ENTITY_THRESHOLD), 0.10))
                .factThreshold(parseDouble(env.apply(ENV_FACT_THRESHOLD), 0.10))
                .coverageThreshold(parseDouble(env.apply(ENV_COVERAGE_THRESHOLD), 0.85))
                .debounceWindow(parseInt(env.apply(ENV_DEBOUNCE), 2))
                .maxCycles(parseInt(env.apply(ENV_MAX_CYCLES), 5))
                .approvalRequired(parseBoolean(env.apply(ENV_REQUIRE_APPROVAL), false))
                .ollamaBaseUrl(getEnv(env, ENV_OLLAMA_URL, "http://localhost:11434"))
                .ollamaFastModel(getEnv(env, ENV_OLLAMA_FAST_MODEL, "llama3.2"))
                .ollamaPowerfulModel(getEnv(env, ENV_OLLAMA_POWERFUL_MODEL, "llama3.1:70b"))
                .liteLlmBaseUrl(getEnv(env, ENV_LITELLM_URL, "http://localhost:4000"))
                .liteLlmModel(getEnv(env, ENV_LITELLM_MODEL, "gpt-4o"))
                .liteLlmApiKey(getEnv(env, ENV_LITELLM_API_KEY, null))
                .tavilyApiKey(getEnv(env, ENV_TAVILY_API_KEY, null))
                .semanticScholarApiKey(getEnv(env, ENV_SEMANTIC_SCHOLAR_API_KEY, null))
                .unpaywallEmail(getEnv(env, ENV_UNPAYWALL_EMAIL, null))
                .dbHost(getEnv(env, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(env.apply(ENV_DB_PORT), 5432))
                .dbName(getEnv(env, ENV_DB_NAME, "sage"))
                .dbUser(getEnv(env, ENV_DB_USER, "sage"))
                .dbPassword(getEnv(env, ENV_DB_PASSWORD, ""))
                .jdbcMemoryEnabled(parseBoolean(env.apply(ENV_MEMORY_JDBC), false))
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.apply(ENV_CACHE_PORT), 6379))
                .redisProgressEnabled(parseBoolean(env.apply(ENV_PROGRESS_REDIS), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> providers = DEFAULT_PROVIDERS;
        private Map<String, Double> providerRps = new LinkedHashMap<>(DEFAULT_RPS);
        private long retryBaseMillis = 4_000L;
        private long retryMaxMillis = 60_000L;
        private int retryMaxAttempts = 5;
        private int breakerFailureThreshold = 5;
        private long breakerCooldownMillis = 30_000L;
        private long breakerMaxCooldownMillis = 600_000L;
        private int maxConcurrentCalls = 5;
        private long providerTimeoutMillis = 20_000L;
        private int maxResultsPerQuery = 20;
        private double entityThreshold = 0.10;
        private double factThreshold = 0.10;
        private double coverageThreshold = 0.85;
        private int debounceWindow = 2;
        private int maxCycles = 5;
        private boolean approvalRequired;
        private String ollamaBaseUrl = "http://localhost:11434";
        private String ollamaFastModel = "llama3.2";
        private String ollamaPowerfulModel = "llama3.1:70b";
        private String liteLlmBaseUrl = "http://localhost:4000";
        private String liteLlmModel = "gpt-4o";
        private String liteLlmApiKey;
        private String tavilyApiKey;
        private String semanticScholarApiKey;
        private String unpaywallEmail;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = "sage";
        private String dbUser = "sage";
        private String dbPassword = "";
        private boolean jdbcMemoryEnabled;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private boolean redisProgressEnabled;

        public Builder providers(List<String> providers) {
            this.providers = Objects.requireNonNull(providers, "providers");
            return this;
        }

        public Builder providerRps(Map<String, Double> providerRps) {
            this.providerRps = new LinkedHashMap<>(Objects.requireNonNull(providerRps, "providerRps"));
            return this;
        }

        public Builder requestsPerSecond(String provider, double rps) {
            this.providerRps.put(provider.toLowerCase(Locale.ROOT), rps);
            return this;
        }

        public Builder retryBaseMillis(long retryBaseMillis) {
            this.retryBaseMillis = Math.max(0, retryBaseMillis);
            return this;
        }

        public Builder retryMaxMillis(long retryMaxMillis) {
            this.retryMaxMillis = Math.max(0, retryMaxMillis);
            return this;
        }

        public Builder retryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = Math.max(1, retryMaxAttempts);
            return this;
        }

        public Builder breakerFailureThreshold(int breakerFailureThreshold) {
            this.breakerFailureThreshold = Math.max(1, breakerFailureThreshold);
            return this;
        }

        public Builder breakerCooldownMillis(long breakerCooldownMillis) {
            this.breakerCooldownMillis = Math.max(0, breakerCooldownMillis);
            return this;
        }

        public Builder breakerMaxCooldownMillis(long breakerMaxCooldownMillis) {
            this.breakerMaxCooldownMillis = Math.max(0, breakerMaxCooldownMillis);
            return this;
        }

        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = Math.max(1, maxConcurrentCalls);
            return this;
        }

        public Builder providerTimeoutMillis(long providerTimeoutMillis) {
            this.providerTimeoutMillis = Math.max(1, providerTimeoutMillis);
            return this;
        }

        public Builder maxResultsPerQuery(int maxResultsPerQuery) {
            this.maxResultsPerQuery = Math.max(1, maxResultsPerQuery);
            return this;
        }

        public Builder entityThreshold(double entityThreshold) {
            this.entityThreshold = entityThreshold;
            return this;
        }

        public Builder factThreshold(double factThreshold) {
            this.factThreshold = factThreshold;
            return this;
        }

        public Builder coverageThreshold(double coverageThreshold) {
            this.coverageThreshold = coverageThreshold;
            return this;
        }

        public Builder debounceWindow(int debounceWindow) {
            this.debounceWindow = Math.max(1, debounceWindow);
            return this;
        }

        public Builder maxCycles(int maxCycles) {
            this.maxCycles = Math.max(1, maxCycles);
            return this;
        }

        public Builder approvalRequired(boolean approvalRequired) {
            this.approvalRequired = approvalRequired;
            return this;
        }

        public Builder ollamaBaseUrl(String ollamaBaseUrl) {
            this.ollamaBaseUrl = ollamaBaseUrl;
            return this;
        }

        public Builder ollamaFastModel(String ollamaFastModel) {
            this.ollamaFastModel = ollamaFastModel;
            return this;
        }

        public Builder ollamaPowerfulModel(String ollamaPowerfulModel) {
            this.ollamaPowerfulModel = ollamaPowerfulModel;
            return this;
        }

        public Builder liteLlmBaseUrl(String liteLlmBaseUrl) {
            this.liteLlmBaseUrl = liteLlmBaseUrl;
            return this;
        }

        public Builder liteLlmModel(String liteLlmModel) {
            this.liteLlmModel = liteLlmModel;
            return this;
        }

        public Builder liteLlmApiKey(String liteLlmApiKey) {
            this.liteLlmApiKey = liteLlmApiKey;
            return this;
        }

        public Builder tavilyApiKey(String tavilyApiKey) {
            this.tavilyApiKey = tavilyApiKey;
            return this;
        }

        public Builder semanticScholarApiKey(String semanticScholarApiKey) {
            this.semanticScholarApiKey = semanticScholarApiKey;
            return this;
        }

        public Builder unpaywallEmail(String unpaywallEmail) {
            this.unpaywallEmail = unpaywallEmail;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder jdbcMemoryEnabled(boolean jdbcMemoryEnabled) {
            this.jdbcMemoryEnabled = jdbcMemoryEnabled;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder redisProgressEnabled(boolean redisProgressEnabled) {
            this.redisProgressEnabled = redisProgressEnabled;
            return this;
        }

        public SageConfig build() {
            return new SageConfig(this);
        }
    }
}
