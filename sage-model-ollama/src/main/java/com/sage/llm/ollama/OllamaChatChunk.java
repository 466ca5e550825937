package com.sage.llm.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One /api/chat response object. Non-streaming calls return a single one with {@code done=true};
 * streaming calls return one per line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaChatChunk {

    private String model;
    private Message message;
    private boolean done;
    private String error;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Message {
        private String role;
        private String content;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public Message getMessage() { return message; }
    public void setMessage(Message message) { this.message = message; }
    public boolean isDone() { return done; }
    public void setDone(boolean done) { this.done = done; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    String content() {
        return message != null && message.getContent() != null ? message.getContent() : "";
    }
}
