package com.sage.model.error;

/** Research-loop level condition (as opposed to a single network or model call). */
public class ResearchException extends ResearchToolException {

    public ResearchException(String message) {
        super(message);
    }
}
