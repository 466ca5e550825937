package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete event on a token stream. Only the field relevant to the type is set; null fields are not serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StreamEvent {

    public enum Type {
        TOKEN,
        MODEL_INFO,
        DONE,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Type type;
    private final String token;
    private final String model;
    private final String error;

    @JsonCreator
    public StreamEvent(
            @JsonProperty("type") Type type,
            @JsonProperty("token") String token,
            @JsonProperty("model") String model,
            @JsonProperty("error") String error) {
        this.type = type;
        this.token = token;
        this.model = model;
        this.error = error;
    }

    public static StreamEvent token(String token) {
        return new StreamEvent(Type.TOKEN, token, null, null);
    }

    public static StreamEvent modelInfo(String model) {
        return new StreamEvent(Type.MODEL_INFO, null, model, null);
    }

    public static StreamEvent done() {
        return new StreamEvent(Type.DONE, null, null, null);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, null, null, message != null ? message : "unknown error");
    }

    public Type getType() {
        return type;
    }

    public String getToken() {
        return token;
    }

    public String getModel() {
        return model;
    }

    public String getError() {
        return error;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type == Type.DONE || type == Type.ERROR;
    }
}
