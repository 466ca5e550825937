package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One chat turn: role is "system", "user" or "assistant". */
public final class ChatMessage {

    private final String role;
    private final String content;

    @JsonCreator
    public ChatMessage(@JsonProperty("role") String role, @JsonProperty("content") String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }
}
