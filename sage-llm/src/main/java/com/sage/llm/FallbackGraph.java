package com.sage.llm;

import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared fallback edges between tiers. An edge is usable under a privacy mode only if the mode allows its
 * target, so under LOCAL_ONLY there is simply no edge into a cloud tier.
 */
public final class FallbackGraph {

    private final Map<ModelTier, ModelTier> edges;

    public FallbackGraph(Map<ModelTier, ModelTier> edges) {
        this.edges = new EnumMap<>(ModelTier.class);
        this.edges.putAll(edges);
    }

    /** local-powerful -> local-fast, cloud-best -> local-powerful. */
    public static FallbackGraph defaults() {
        return new FallbackGraph(Map.of(
                ModelTier.LOCAL_POWERFUL, ModelTier.LOCAL_FAST,
                ModelTier.CLOUD_BEST, ModelTier.LOCAL_POWERFUL));
    }

    public Optional<ModelTier> next(ModelTier from, PrivacyMode mode) {
        ModelTier to = edges.get(from);
        if (to == null || !mode.allows(to)) return Optional.empty();
        return Optional.of(to);
    }
}
