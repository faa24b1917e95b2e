package com.place.conflation.matching;

import com.place.conflation.core.model.PlaceRecord;

import java.util.Comparator;

/**
 * A ProviderA/ProviderB pair whose name and address similarities both cleared the threshold.
 */
public record FuzzyCandidate(
        PlaceRecord recordA,
        PlaceRecord recordB,
        double nameSimilarity,
        double addressSimilarity
) {

    /**
     * Assignment order: combined similarity descending, then ProviderA record id, then ProviderB record id.
     */
    public static final Comparator<FuzzyCandidate> ASSIGNMENT_ORDER =
            Comparator.comparingDouble(FuzzyCandidate::combinedSimilarity).reversed()
                    .thenComparing(c -> c.recordA().getRecordId())
                    .thenComparing(c -> c.recordB().getRecordId());

    public double combinedSimilarity() {
        return nameSimilarity + addressSimilarity;
    }
}
