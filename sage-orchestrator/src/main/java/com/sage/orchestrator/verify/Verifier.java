package com.sage.orchestrator.verify;

import com.sage.model.Fact;

import java.util.List;

/**
 * Cross-checks the facts gathered so far. Implementations return the full replacement list; the input is not
 * modified.
 */
public interface Verifier {

    /**
     * @param verificationThreshold minimum confidence for a fact with two or more sources to be marked verified
     */
    List<Fact> verify(List<Fact> facts, double verificationThreshold);
}
