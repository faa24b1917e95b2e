package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.RuleOutcome.Preference;

/**
 * Prefers the higher provider confidence. Ties unless both candidates carry a confidence;
 * one-sided confidence is left to {@code confidence-presence}.
 */
public class ConfidenceRule implements ConflationRule {

    public static final String NAME = "confidence";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Preference compare(AttributeCandidate candidateA, AttributeCandidate candidateB) {
        if (!candidateA.hasConfidence() || !candidateB.hasConfidence()) {
            return Preference.TIE;
        }
        return Preference.fromComparison(Double.compare(candidateA.sourceConfidence(), candidateB.sourceConfidence()));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
