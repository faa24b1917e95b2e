package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.RuleOutcome.Preference;

import java.util.Objects;

/**
 * Final tie-breaker: always prefers the configured provider.
 */
public class SourcePriorityRule implements ConflationRule {

    public static final String NAME = "source-priority";

    private final Provider preferred;

    public SourcePriorityRule(Provider preferred) {
        this.preferred = Objects.requireNonNull(preferred, "preferred is required");
    }

    public Provider getPreferred() {
        return preferred;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Preference compare(AttributeCandidate candidateA, AttributeCandidate candidateB) {
        return Preference.of(preferred);
    }

    @Override
    public String toString() {
        return NAME + "(" + preferred + ")";
    }
}
