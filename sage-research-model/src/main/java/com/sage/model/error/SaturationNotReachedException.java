package com.sage.model.error;

/** Advisory: saturation has not been reached yet. Only affects loop continuation. */
public final class SaturationNotReachedException extends ResearchException {

    public SaturationNotReachedException(String reason) {
        super(reason);
    }
}
