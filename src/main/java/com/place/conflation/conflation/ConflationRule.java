package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.RuleOutcome.Preference;

import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * A comparator unit in a conflation cascade.
 * Given the ProviderA and ProviderB candidates, a rule either prefers one of them or ties.
 * Rules after {@code completeness} are only consulted when both candidates are usable.
 */
public interface ConflationRule {

    String getName();

    Preference compare(AttributeCandidate candidateA, AttributeCandidate candidateB);

    /**
     * A rule that prefers the candidate satisfying the predicate when exactly one does.
     */
    static ConflationRule preferring(String name, Predicate<AttributeCandidate> predicate) {
        return new ConflationRule() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Preference compare(AttributeCandidate candidateA, AttributeCandidate candidateB) {
                return Preference.fromComparison(Boolean.compare(predicate.test(candidateA), predicate.test(candidateB)));
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * A rule that prefers the candidate with the larger measure.
     */
    static ConflationRule preferringHigher(String name, ToDoubleFunction<AttributeCandidate> measure) {
        return new ConflationRule() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Preference compare(AttributeCandidate candidateA, AttributeCandidate candidateB) {
                return Preference.fromComparison(
                        Double.compare(measure.applyAsDouble(candidateA), measure.applyAsDouble(candidateB)));
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
