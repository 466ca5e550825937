package com.sage.model.error;

/** Failure selecting or calling a language model. */
public class ModelException extends ResearchToolException {

    private final String model;

    public ModelException(String model, String message) {
        super(message);
        this.model = model;
    }

    public ModelException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    /** Model involved, or null when no model could be chosen. */
    public String getModel() {
        return model;
    }
}
