package com.sage.model.error;

/**
 * Root of the research engine's error taxonomy. All subclasses are unchecked.
 */
public class ResearchToolException extends RuntimeException {

    public ResearchToolException(String message) {
        super(message);
    }

    public ResearchToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
