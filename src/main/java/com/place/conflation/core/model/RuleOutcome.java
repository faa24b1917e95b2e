package com.place.conflation.core.model;

import java.util.Objects;

/**
 * One entry of a decision trace: the rule that was evaluated and what it concluded.
 */
public record RuleOutcome(String ruleName, Preference preference) {

    public RuleOutcome {
        Objects.requireNonNull(ruleName, "ruleName is required");
        Objects.requireNonNull(preference, "preference is required");
    }

    /**
     * Returns true if this rule distinguished the candidates.
     */
    public boolean decided() {
        return preference != Preference.TIE;
    }

    @Override
    public String toString() {
        return ruleName + ":" + preference.name();
    }

    /**
     * Result of comparing a ProviderA candidate with a ProviderB candidate.
     */
    public enum Preference {
        PREFER_A,
        PREFER_B,
        TIE;

        public static Preference of(Provider provider) {
            return provider == Provider.PROVIDER_A ? PREFER_A : PREFER_B;
        }

        /**
         * Maps a signed comparison (positive favours A) to a preference.
         */
        public static Preference fromComparison(int comparison) {
            if (comparison > 0) {
                return PREFER_A;
            }
            if (comparison < 0) {
                return PREFER_B;
            }
            return TIE;
        }

        public Provider winner() {
            return switch (this) {
                case PREFER_A -> Provider.PROVIDER_A;
                case PREFER_B -> Provider.PROVIDER_B;
                case TIE -> null;
            };
        }
    }
}
