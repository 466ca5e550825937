package com.sage.llm;

import com.sage.model.ChatMessage;

import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Transport to one model backend (e.g. Ollama or LiteLLM). Implementations report failures with
 * {@code ModelUnavailableException} (backend or model missing) or {@code ModelOverloadedException} (busy, retryable).
 * Only {@link PrivacyRouter} calls these; nothing else produces completions.
 */
public interface ChatModelClient {

    /** Non-streaming completion; returns the assistant text. */
    String complete(String model, List<ChatMessage> messages) throws InterruptedException;

    /**
     * Streaming completion; calls {@code onToken} for each chunk in order and returns when the model is done.
     * Implementations should stop early when {@code cancelled} reports true.
     */
    void stream(String model, List<ChatMessage> messages, Consumer<String> onToken, BooleanSupplier cancelled)
            throws InterruptedException;

    /** Cheap availability check; defaults to true. */
    default boolean isAvailable(String model) {
        return true;
    }
}
