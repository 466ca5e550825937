package com.sage.search;

/**
 * Learned effectiveness of a source for a domain, in [0, 1]. Unseen pairs score 0.5.
 */
@FunctionalInterface
public interface EffectivenessLookup {

    double DEFAULT_SCORE = 0.5;

    EffectivenessLookup NEUTRAL = (source, domain) -> DEFAULT_SCORE;

    double getSourceEffectiveness(String source, String domain);
}
