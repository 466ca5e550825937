package com.sage.model;

import java.util.Locale;

/** Model capability tiers. Only the CLOUD_* tiers send data off the machine. */
public enum ModelTier {
    LOCAL_FAST("local-fast", true),
    LOCAL_POWERFUL("local-powerful", true),
    CLOUD_BEST("cloud-best", false);

    private final String id;
    private final boolean local;

    ModelTier(String id, boolean local) {
        this.id = id;
        this.local = local;
    }

    public String id() {
        return id;
    }

    public boolean isLocal() {
        return local;
    }

    /** Accepts either the enum name or the hyphenated id (e.g. "local-fast"). */
    public static ModelTier fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Model tier must not be blank");
        }
        String v = value.trim();
        for (ModelTier tier : values()) {
            if (tier.id.equalsIgnoreCase(v) || tier.name().equalsIgnoreCase(v)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown model tier: " + v.toLowerCase(Locale.ROOT));
    }
}
