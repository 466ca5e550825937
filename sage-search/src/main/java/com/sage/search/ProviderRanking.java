package com.sage.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders providers by learned effectiveness for a domain (descending), breaking ties by static priority
 * (descending) and then by name.
 */
public final class ProviderRanking {

    private static final double EPSILON = 1e-9;

    private final EffectivenessLookup effectiveness;

    public ProviderRanking(EffectivenessLookup effectiveness) {
        this.effectiveness = effectiveness != null ? effectiveness : EffectivenessLookup.NEUTRAL;
    }

    /**
     * @param staticPriority priority per provider (e.g. primary 1.0, secondary 0.5); missing providers count as 0
     */
    public List<String> rank(String domain, List<String> providers, Map<String, Double> staticPriority) {
        Objects.requireNonNull(providers, "providers");
        Map<String, Double> priority = staticPriority != null ? staticPriority : Map.of();
        List<Scored> scored = new ArrayList<>();
        for (String p : providers) {
            if (p == null || scored.stream().anyMatch(s -> s.name.equals(p))) continue;
            scored.add(new Scored(p, effectiveness.getSourceEffectiveness(p, domain), priority.getOrDefault(p, 0.0)));
        }
        scored.sort(Comparator
                .comparingDouble((Scored s) -> -round(s.effectiveness))
                .thenComparingDouble(s -> -s.priority)
                .thenComparing(s -> s.name));
        List<String> ranked = new ArrayList<>(scored.size());
        for (Scored s : scored) ranked.add(s.name);
        return ranked;
    }

    private static double round(double v) {
        return Math.round(v / EPSILON) * EPSILON;
    }

    private static final class Scored {
        final String name;
        final double effectiveness;
        final double priority;

        Scored(String name, double effectiveness, double priority) {
            this.name = name;
            this.effectiveness = effectiveness;
            this.priority = priority;
        }
    }
}
