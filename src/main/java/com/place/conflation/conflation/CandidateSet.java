package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.Provider;

import java.util.Objects;

/**
 * The two providers' candidates for one attribute of one matched place.
 * A candidate is {@code null} when its provider did not supply the attribute.
 */
public record CandidateSet(
        AttributeKind attribute,
        AttributeCandidate candidateA,
        AttributeCandidate candidateB
) {
    public CandidateSet {
        Objects.requireNonNull(attribute, "attribute is required");
        if (candidateA != null && candidateA.sourceProvider() != Provider.PROVIDER_A) {
            throw new IllegalArgumentException("candidateA must come from " + Provider.PROVIDER_A);
        }
        if (candidateB != null && candidateB.sourceProvider() != Provider.PROVIDER_B) {
            throw new IllegalArgumentException("candidateB must come from " + Provider.PROVIDER_B);
        }
    }

    public AttributeCandidate get(Provider provider) {
        return provider == Provider.PROVIDER_A ? candidateA : candidateB;
    }

    /**
     * Returns the provider's candidate, or an empty placeholder when it is missing.
     */
    public AttributeCandidate getOrAbsent(Provider provider) {
        AttributeCandidate candidate = get(provider);
        return candidate != null ? candidate : AttributeCandidate.absent(attribute, provider);
    }

    public boolean bothMissing() {
        return candidateA == null && candidateB == null;
    }

    public boolean anyUsable() {
        return (candidateA != null && candidateA.isUsable()) || (candidateB != null && candidateB.isUsable());
    }
}
