package com.sage.saturation;

/** Whether to stop collecting, with a plain-language reason in either case. */
public record StopDecision(boolean stop, String reason) {

    static StopDecision stop(String reason) {
        return new StopDecision(true, reason);
    }

    static StopDecision proceed(String reason) {
        return new StopDecision(false, reason);
    }
}
