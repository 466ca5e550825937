package com.sage.llm;

import com.sage.gate.RetryPolicy;
import com.sage.model.ChatMessage;
import com.sage.model.ModelRecommendation;
import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;
import com.sage.model.TaskComplexity;
import com.sage.model.error.ModelOverloadedException;
import com.sage.model.error.ModelUnavailableException;
import com.sage.model.error.PrivacyViolationException;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The only path by which completions are produced.
 * <p>
 * Before any call the model is checked against the privacy mode; a non-compliant model fails closed with
 * {@link PrivacyViolationException} and is never invoked. Overloaded models are retried with backoff; an
 * unavailable model falls back only along {@link FallbackGraph} edges the mode allows.
 */
public final class PrivacyRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PrivacyRouter.class);

    private final ModelCatalog catalog;
    private final ModelSelector selector;
    private final FallbackGraph fallback;
    private final RetryPolicy retryPolicy;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();
    private final PrivacyAdvisor advisor;
    private final ExecutorService streamExecutor;

    public PrivacyRouter(ModelCatalog catalog, ModelPreferenceTable table, FallbackGraph fallback,
                         RetryPolicy retryPolicy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.selector = new ModelSelector(Objects.requireNonNull(table, "table"));
        this.fallback = fallback != null ? fallback : FallbackGraph.defaults();
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
        this.advisor = new PrivacyAdvisor(this::classifyLocally);
        this.streamExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sage-token-stream");
            t.setDaemon(true);
            return t;
        });
    }

    /** Selects from the models that are currently available. */
    public ModelRecommendation select(TaskComplexity complexity, PrivacyMode privacyMode) {
        return select(complexity, privacyMode, catalog.available());
    }

    public ModelRecommendation select(TaskComplexity complexity, PrivacyMode privacyMode, Collection<ModelSpec> availableModels) {
        ModelRecommendation rec = selector.select(complexity, privacyMode, availableModels);
        log.debug("Selected {} for {}/{}", rec, privacyMode, complexity);
        return rec;
    }

    /**
     * Runs a completion on the named model, falling back along allowed edges if it is unavailable.
     *
     * @throws PrivacyViolationException if the model is not allowed under the mode (never retried)
     * @throws ModelUnavailableException if no allowed model could answer
     */
    public Completion complete(List<ChatMessage> messages, String model, PrivacyMode privacyMode) throws InterruptedException {
        ModelSpec spec = requireCompliant(model, privacyMode);
        Set<String> tried = new LinkedHashSet<>();
        while (true) {
            tried.add(spec.getName());
            try {
                String text = completeWithRetry(spec, messages);
                return new Completion(text, spec.getName(), spec.getTier());
            } catch (ModelUnavailableException e) {
                Optional<ModelSpec> next = nextFallback(spec, privacyMode, tried);
                if (next.isEmpty()) {
                    throw new ModelUnavailableException(spec.getName(), "No model left for privacy mode " + privacyMode
                            + " after trying " + tried + ": " + e.getMessage(), e);
                }
                log.warn("Model {} unavailable ({}); falling back to {}", spec.getName(), e.getMessage(), next.get().getName());
                spec = next.get();
            }
        }
    }

    /** Selects a model for the complexity and completes with it. */
    public Completion complete(List<ChatMessage> messages, TaskComplexity complexity, PrivacyMode privacyMode) throws InterruptedException {
        ModelRecommendation rec = select(complexity, privacyMode);
        return complete(messages, rec.getModel(), privacyMode);
    }

    /**
     * Streams a completion. The compliance check runs before the stream is created; afterwards every outcome,
     * including fallback exhaustion, arrives on the stream as a terminal event.
     *
     * @throws PrivacyViolationException if the model is not allowed under the mode
     */
    public TokenStream stream(List<ChatMessage> messages, String model, PrivacyMode privacyMode) {
        ModelSpec first = requireCompliant(model, privacyMode);
        TokenStream stream = new TokenStream();
        streamExecutor.execute(() -> runStream(stream, first, messages, privacyMode));
        return stream;
    }

    /** Advisory mode; an explicit mode is returned unchanged. Any model call for this runs on a local model. */
    public PrivacyAdvice recommendPrivacyMode(String query, PrivacyMode explicitMode) {
        return advisor.recommend(query, explicitMode);
    }

    private void runStream(TokenStream stream, ModelSpec first, List<ChatMessage> messages, PrivacyMode mode) {
        ModelSpec spec = first;
        Set<String> tried = new LinkedHashSet<>();
        try {
            while (!stream.isCancelled()) {
                tried.add(spec.getName());
                boolean[] emitted = {false};
                try {
                    stream.modelInfo(spec.getName());
                    spec.getClient().stream(spec.getName(), messages, token -> {
                        emitted[0] = true;
                        stream.token(token);
                    }, stream::isCancelled);
                    stream.done();
                    return;
                } catch (ModelUnavailableException e) {
                    Optional<ModelSpec> next = emitted[0] ? Optional.empty() : nextFallback(spec, mode, tried);
                    if (next.isEmpty()) {
                        stream.error("No model left for privacy mode " + mode + ": " + e.getMessage());
                        return;
                    }
                    log.warn("Streaming model {} unavailable; falling back to {}", spec.getName(), next.get().getName());
                    spec = next.get();
                }
            }
            stream.done();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.error("Stream interrupted");
        } catch (RuntimeException e) {
            log.warn("Stream on {} failed: {}", spec.getName(), e.getMessage());
            stream.error(e.getMessage());
        }
    }

    private String completeWithRetry(ModelSpec spec, List<ChatMessage> messages) throws InterruptedException {
        Retry.Context<String> attempts = retryFor(spec.getName()).context();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                String text = spec.getClient().complete(spec.getName(), messages);
                attempts.onComplete();
                return text;
            } catch (ModelOverloadedException e) {
                backOff(attempts, e, spec.getName(), attempt);
            }
        }
    }

    private static void backOff(Retry.Context<String> attempts, ModelOverloadedException e, String model, int attempt)
            throws InterruptedException {
        try {
            attempts.onError(e);
        } catch (Exception exhausted) {
            throw new ModelUnavailableException(model, "Model " + model
                    + " still overloaded after " + attempt + " attempt(s)", exhausted);
        }
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted backing off " + model);
        }
    }

    /** The retry used for overloaded calls to one model; created on first use. */
    Retry retryFor(String model) {
        return retries.computeIfAbsent(model, name -> {
            Retry retry = retryPolicy.newRetry(name);
            retry.getEventPublisher().onRetry(event -> log.debug("Model {} overloaded; retry {} in {} ms",
                    name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
            return retry;
        });
    }

    private ModelSpec requireCompliant(String model, PrivacyMode mode) {
        Objects.requireNonNull(mode, "privacyMode");
        ModelSpec spec = catalog.find(model)
                .orElseThrow(() -> new ModelUnavailableException(model, "Unknown model: " + model));
        if (!mode.allows(spec.getTier())) {
            log.error("Refusing {} under {}: tier {} not allowed", spec.getName(), mode, spec.getTier().id());
            throw new PrivacyViolationException(spec.getName(), mode);
        }
        return spec;
    }

    private Optional<ModelSpec> nextFallback(ModelSpec from, PrivacyMode mode, Set<String> tried) {
        ModelTier tier = from.getTier();
        Optional<ModelSpec> sameTier = catalog.firstAvailable(tier, tried);
        if (sameTier.isPresent()) return sameTier;
        Set<ModelTier> visited = new LinkedHashSet<>();
        visited.add(tier);
        Optional<ModelTier> next = fallback.next(tier, mode);
        while (next.isPresent() && visited.add(next.get())) {
            Optional<ModelSpec> candidate = catalog.firstAvailable(next.get(), tried);
            if (candidate.isPresent()) return candidate;
            next = fallback.next(next.get(), mode);
        }
        return Optional.empty();
    }

    private Optional<Boolean> classifyLocally(String query) {
        Optional<ModelSpec> local = catalog.firstAvailable(ModelTier.LOCAL_FAST, List.of());
        if (local.isEmpty()) return Optional.empty();
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system("Answer with exactly one word: SENSITIVE or PUBLIC. "
                + "A query is SENSITIVE if it involves personal, medical, financial, legal or confidential business data."));
        messages.add(ChatMessage.user(query));
        try {
            String answer = complete(messages, local.get().getName(), PrivacyMode.LOCAL_ONLY).text();
            return Optional.of(answer.trim().toUpperCase(Locale.ROOT).startsWith("SENSITIVE"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ModelUnavailableException e) {
            log.debug("Local privacy classifier unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        streamExecutor.shutdownNow();
    }
}
