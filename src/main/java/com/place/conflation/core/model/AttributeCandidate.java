package com.place.conflation.core.model;

import java.util.Objects;

/**
 * One provider's offered value for one attribute of one matched place.
 *
 * @param attribute           the attribute this candidate is for
 * @param value               canonical (normalized) value, empty when unusable
 * @param rawValue            the provider's value as received, trimmed; never null
 * @param sourceProvider      the offering provider
 * @param sourceConfidence    provider confidence in [0, 1], or {@code null} when absent or malformed
 * @param confidenceMalformed true when the provider sent a confidence that could not be used
 * @param canonicalBrand      true when the cleaned value is itself a canonical brand entry
 * @param businessSuffix      true when the cleaned value ends with a business-entity suffix
 * @param tokenCount          number of tokens in the cleaned value
 */
public record AttributeCandidate(
        AttributeKind attribute,
        String value,
        String rawValue,
        Provider sourceProvider,
        Double sourceConfidence,
        boolean confidenceMalformed,
        boolean canonicalBrand,
        boolean businessSuffix,
        int tokenCount
) {
    public AttributeCandidate {
        Objects.requireNonNull(attribute, "attribute is required");
        Objects.requireNonNull(sourceProvider, "sourceProvider is required");
        value = value != null ? value : "";
        rawValue = rawValue != null ? rawValue.trim() : "";
    }

    /**
     * Placeholder for a provider that did not supply the attribute at all.
     */
    public static AttributeCandidate absent(AttributeKind attribute, Provider provider) {
        return new AttributeCandidate(attribute, "", "", provider, null, false, false, false, 0);
    }

    /**
     * Returns true if this candidate carries a usable value.
     */
    public boolean isUsable() {
        return !value.isEmpty();
    }

    public boolean hasConfidence() {
        return sourceConfidence != null;
    }
}
