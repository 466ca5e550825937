package com.sage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Model chosen for a task, with the reason and whether it complies with the session's privacy mode.
 */
public final class ModelRecommendation {

    private final String model;
    private final ModelTier tier;
    private final String reasoning;
    private final boolean privacyCompliant;

    @JsonCreator
    public ModelRecommendation(
            @JsonProperty("model") String model,
            @JsonProperty("tier") ModelTier tier,
            @JsonProperty("reasoning") String reasoning,
            @JsonProperty("privacyCompliant") boolean privacyCompliant) {
        this.model = model;
        this.tier = tier;
        this.reasoning = reasoning != null ? reasoning : "";
        this.privacyCompliant = privacyCompliant;
    }

    public String getModel() {
        return model;
    }

    public ModelTier getTier() {
        return tier;
    }

    public String getReasoning() {
        return reasoning;
    }

    public boolean isPrivacyCompliant() {
        return privacyCompliant;
    }

    @Override
    public String toString() {
        return model + " [" + (tier != null ? tier.id() : "?") + "]: " + reasoning;
    }
}
