package com.sage.search;

import com.sage.gate.ProviderGate;
import com.sage.gate.ProviderRegistry;
import com.sage.model.SourceResult;
import com.sage.model.error.SourceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a query out to ranked providers through their {@link ProviderGate}s and merges the results.
 * <p>
 * Outbound calls are bounded by a global concurrency cap that composes with each provider's own rate limit.
 * Every provider call is individually timeout-bounded from the moment it holds a slot, so one slow provider
 * cannot stall the aggregate or starve the providers queued behind it.
 * Results keep each provider's own order, providers appear in ranked order, duplicate URLs are dropped
 * (first wins) and URLs recorded as permanent failures are skipped.
 */
public final class SearchAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchAggregator.class);

    private final ProviderRegistry registry;
    private final KnownFailureCheck knownFailures;
    private final ExecutorService executor;
    private final Semaphore concurrencyCap;
    private final long providerTimeoutMillis;

    /**
     * @param maxConcurrentCalls    global cap on simultaneous outbound calls
     * @param providerTimeoutMillis per-provider call budget, counted from when the call gets its slot under the
     *                              cap; a provider exceeding it is cancelled and counts as empty
     */
    public SearchAggregator(ProviderRegistry registry, KnownFailureCheck knownFailures,
                            int maxConcurrentCalls, long providerTimeoutMillis) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.knownFailures = knownFailures != null ? knownFailures : KnownFailureCheck.NONE;
        this.concurrencyCap = new Semaphore(Math.max(1, maxConcurrentCalls), true);
        this.providerTimeoutMillis = Math.max(1, providerTimeoutMillis);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sage-search");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Collects results for the query from the given providers, already ranked best first.
     *
     * @param maxResults per-provider result limit
     * @return merged, de-duplicated results
     * @throws SourceExhaustedException when every provider returned nothing
     */
    public List<SourceResult> collect(String query, List<String> providers, int maxResults) {
        return collect(query, providers, maxResults, Map.of());
    }

    public List<SourceResult> collect(String query, List<String> providers, int maxResults, Map<String, String> filters) {
        CollectionReport report = collectDetailed(query, providers, maxResults, filters);
        return report.results();
    }

    /**
     * Like {@link #collect(String, List, int)} but also reports which providers were empty or timed out.
     *
     * @throws SourceExhaustedException when every provider returned nothing
     */
    public CollectionReport collectDetailed(String query, List<String> providers, int maxResults, Map<String, String> filters) {
        Objects.requireNonNull(providers, "providers");
        List<String> names = new ArrayList<>(new LinkedHashSet<>(providers));
        Map<String, String> safeFilters = filters != null ? filters : Map.of();

        List<CompletableFuture<ProviderOutcome>> futures = new ArrayList<>(names.size());
        for (String name : names) {
            futures.add(submit(name, query, maxResults, safeFilters));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SourceResult> merged = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        List<String> timedOut = new ArrayList<>();
        List<String> citations = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        int duplicates = 0;
        int skipped = 0;
        for (CompletableFuture<ProviderOutcome> future : futures) {
            ProviderOutcome outcome = future.join();
            if (outcome.timedOut()) timedOut.add(outcome.provider());
            if (outcome.results().isEmpty()) {
                empty.add(outcome.provider());
                continue;
            }
            for (SourceResult r : outcome.results()) {
                if (r == null || r.getUrl().isEmpty()) continue;
                citations.add(r.getUrl());
                if (!seenUrls.add(r.getUrl())) {
                    duplicates++;
                    continue;
                }
                if (isKnownFailure(r.getUrl())) {
                    skipped++;
                    continue;
                }
                merged.add(r);
            }
        }
        CollectionReport report = new CollectionReport(merged, names, empty, timedOut, citations, duplicates, skipped);
        log.info("Collected {} result(s) for query={} from {} provider(s); empty={} timedOut={} duplicates={} knownFailures={}",
                merged.size(), query, names.size(), empty, timedOut, duplicates, skipped);
        if (report.isExhausted()) {
            throw new SourceExhaustedException(names);
        }
        return report;
    }

    private CompletableFuture<ProviderOutcome> submit(String name, String query, int maxResults, Map<String, String> filters) {
        Optional<ProviderGate> gate = registry.gate(name);
        if (gate.isEmpty()) {
            log.warn("Provider {} is not registered; treating as empty", name);
            return CompletableFuture.completedFuture(new ProviderOutcome(name, List.of(), false));
        }
        ProviderGate g = gate.get();
        return CompletableFuture
                .supplyAsync(() -> callUnderCap(g, query, maxResults, filters), executor)
                .exceptionally(e -> {
                    log.warn("Provider {} failed unexpectedly; treating as empty. Error: {}", name, e.getMessage(), e);
                    return new ProviderOutcome(name, List.of(), false);
                });
    }

    /**
     * Waits for a slot under the cap, then gives the gate call its full budget. A call that overruns is
     * interrupted and its slot released, so a hung provider never holds a slot past its budget.
     */
    private ProviderOutcome callUnderCap(ProviderGate gate, String query, int maxResults, Map<String, String> filters) {
        try {
            concurrencyCap.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ProviderOutcome(gate.name(), List.of(), false);
        }
        try {
            Future<List<SourceResult>> call = executor.submit(() -> gate.search(query, maxResults, filters));
            try {
                return new ProviderOutcome(gate.name(), call.get(providerTimeoutMillis, TimeUnit.MILLISECONDS), false);
            } catch (TimeoutException e) {
                call.cancel(true);
                log.info("Provider {} exceeded its {} ms budget for query={}; cancelled",
                        gate.name(), providerTimeoutMillis, query);
                return new ProviderOutcome(gate.name(), List.of(), true);
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                return new ProviderOutcome(gate.name(), List.of(), false);
            } catch (ExecutionException e) {
                log.warn("Provider {} failed unexpectedly; treating as empty. Error: {}",
                        gate.name(), e.getCause() != null ? e.getCause().toString() : e.getMessage(), e);
                return new ProviderOutcome(gate.name(), List.of(), false);
            }
        } finally {
            concurrencyCap.release();
        }
    }

    private boolean isKnownFailure(String url) {
        try {
            return knownFailures.isKnownFailure(url);
        } catch (RuntimeException e) {
            log.warn("Known-failure lookup failed for {}; assuming not known. Error: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private record ProviderOutcome(String provider, List<SourceResult> results, boolean timedOut) {
    }
}
