package com.sage.llm.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sage.model.ChatMessage;

import java.util.List;

/** Ollama /api/chat request body. */
final class OllamaChatRequest {

    private final String model;
    private final List<ChatMessage> messages;
    @JsonProperty("stream")
    private final boolean stream;

    OllamaChatRequest(String model, List<ChatMessage> messages, boolean stream) {
        this.model = model;
        this.messages = messages;
        this.stream = stream;
    }

    public String getModel() { return model; }
    public List<ChatMessage> getMessages() { return messages; }
    public boolean isStream() { return stream; }
}
