package com.sage.model.error;

import com.sage.model.PrivacyMode;

/**
 * A call would send session data to a model the privacy mode forbids. Never retried and never downgraded.
 */
public final class PrivacyViolationException extends ModelException {

    private final PrivacyMode privacyMode;

    public PrivacyViolationException(String model, PrivacyMode privacyMode) {
        super(model, "Model " + model + " is not allowed under privacy mode " + privacyMode);
        this.privacyMode = privacyMode;
    }

    public PrivacyMode getPrivacyMode() {
        return privacyMode;
    }
}
