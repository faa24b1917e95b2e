package com.place.conflation.core.model;

import java.util.Objects;

/**
 * A ProviderA/ProviderB record pair judged to denote the same place.
 * Similarities are on a 0–100 scale; exact pairs carry 100 for both.
 */
public record MatchedPair(
        PlaceRecord recordA,
        PlaceRecord recordB,
        MatchKind matchKind,
        double nameSimilarity,
        double addressSimilarity
) {
    public MatchedPair {
        Objects.requireNonNull(recordA, "recordA is required");
        Objects.requireNonNull(recordB, "recordB is required");
        Objects.requireNonNull(matchKind, "matchKind is required");
        if (recordA.getProvider() != Provider.PROVIDER_A) {
            throw new IllegalArgumentException("recordA must come from " + Provider.PROVIDER_A);
        }
        if (recordB.getProvider() != Provider.PROVIDER_B) {
            throw new IllegalArgumentException("recordB must come from " + Provider.PROVIDER_B);
        }
        if (nameSimilarity < 0.0 || nameSimilarity > 100.0
                || addressSimilarity < 0.0 || addressSimilarity > 100.0) {
            throw new IllegalArgumentException("Similarities must be between 0 and 100");
        }
    }

    public static MatchedPair exact(PlaceRecord recordA, PlaceRecord recordB) {
        return new MatchedPair(recordA, recordB, MatchKind.EXACT, 100.0, 100.0);
    }

    public static MatchedPair fuzzy(PlaceRecord recordA, PlaceRecord recordB,
                                    double nameSimilarity, double addressSimilarity) {
        return new MatchedPair(recordA, recordB, MatchKind.FUZZY, nameSimilarity, addressSimilarity);
    }

    /**
     * Stable identity of the matched place, used to key output rows.
     */
    public String placeKey() {
        return recordA.getRecordId() + "|" + recordB.getRecordId();
    }

    public double combinedSimilarity() {
        return nameSimilarity + addressSimilarity;
    }
}
