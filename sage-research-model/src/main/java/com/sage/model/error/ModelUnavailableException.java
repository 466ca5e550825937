package com.sage.model.error;

/**
 * No usable model for the call. Fatal for the call; under LOCAL_ONLY with no local model left it is fatal
 * for the session's model-dependent steps, which then degrade to a partial report.
 */
public final class ModelUnavailableException extends ModelException {

    public ModelUnavailableException(String model, String message) {
        super(model, message);
    }

    public ModelUnavailableException(String model, String message, Throwable cause) {
        super(model, message, cause);
    }
}
