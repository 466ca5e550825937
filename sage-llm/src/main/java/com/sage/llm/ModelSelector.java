package com.sage.llm;

import com.sage.model.ModelRecommendation;
import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;
import com.sage.model.TaskComplexity;
import com.sage.model.error.ModelUnavailableException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Walks the preference list for (mode, complexity) and returns the first available model.
 * Tier filtering is delegated entirely to {@link ModelPreferenceTable#preferences(PrivacyMode, TaskComplexity)}.
 */
public final class ModelSelector {

    private final ModelPreferenceTable table;

    public ModelSelector(ModelPreferenceTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * @throws ModelUnavailableException when no available model matches any allowed tier
     */
    public ModelRecommendation select(TaskComplexity complexity, PrivacyMode privacyMode, Collection<ModelSpec> availableModels) {
        List<ModelTier> preferences = table.preferences(privacyMode, complexity);
        for (ModelTier tier : preferences) {
            for (ModelSpec spec : availableModels) {
                if (spec.getTier() == tier) {
                    return new ModelRecommendation(spec.getName(), tier, reasoning(privacyMode, complexity, tier, preferences),
                            privacyMode.allows(tier));
                }
            }
        }
        throw new ModelUnavailableException(null, "No available model for privacy mode " + privacyMode
                + " and complexity " + complexity + " (allowed tiers " + ids(preferences) + ")");
    }

    private static String reasoning(PrivacyMode mode, TaskComplexity complexity, ModelTier chosen, List<ModelTier> preferences) {
        String constraint = switch (mode) {
            case LOCAL_ONLY -> "Privacy mode LOCAL_ONLY requires a local model";
            case HYBRID -> "Privacy mode HYBRID prefers local models";
            case CLOUD_ALLOWED -> "Privacy mode CLOUD_ALLOWED permits cloud models";
        };
        String position = preferences.indexOf(chosen) == 0 ? "first choice" : "fallback from " + preferences.get(0).id();
        return constraint + "; " + complexity + " complexity task uses " + chosen.id() + " (" + position + ")";
    }

    private static String ids(List<ModelTier> tiers) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < tiers.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(tiers.get(i).id());
        }
        return sb.append(']').toString();
    }
}
