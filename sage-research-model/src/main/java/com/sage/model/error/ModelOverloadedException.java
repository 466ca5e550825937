package com.sage.model.error;

/** Model endpoint is busy (e.g. HTTP 429/503). Retryable. */
public final class ModelOverloadedException extends ModelException {

    public ModelOverloadedException(String model, String message) {
        super(model, message);
    }
}
