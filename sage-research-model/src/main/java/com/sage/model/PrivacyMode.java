package com.sage.model;

/**
 * Which class of model may see a session's data.
 */
public enum PrivacyMode {
    /** Local models only, for the whole session. */
    LOCAL_ONLY,
    /** Cloud models may be used when the task warrants it. */
    CLOUD_ALLOWED,
    /** Local first; cloud only as the last preference for complex tasks. */
    HYBRID;

    public boolean allows(ModelTier tier) {
        return tier != null && (this != LOCAL_ONLY || tier.isLocal());
    }
}
