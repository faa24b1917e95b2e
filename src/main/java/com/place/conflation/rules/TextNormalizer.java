package com.place.conflation.rules;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.PlaceRecord;

import java.util.EnumMap;
import java.util.Map;

/**
 * Canonicalizes free-text attribute values for comparison.
 * Implementations are deterministic, total and idempotent: malformed or absent input yields an
 * empty string, and {@code normalize(normalize(x, k), k)} equals {@code normalize(x, k)}.
 */
public interface TextNormalizer {

    /**
     * Returns the canonical form of a raw value for the given attribute kind.
     */
    String normalize(String raw, AttributeKind kind);

    /**
     * Applies only the shared cleanup steps, without business-suffix removal or brand mapping.
     */
    String clean(String raw, AttributeKind kind);

    /**
     * Returns true if the cleaned name is itself an entry of the canonical brand table.
     */
    boolean isCanonicalBrand(String rawName);

    /**
     * Returns true if the cleaned name ends with a known business-entity suffix.
     */
    boolean hasBusinessSuffix(String rawName);

    /**
     * Returns a copy of the record with every attribute kind normalized.
     */
    default PlaceRecord normalizeRecord(PlaceRecord record) {
        Map<AttributeKind, String> normalized = new EnumMap<>(AttributeKind.class);
        for (AttributeKind kind : AttributeKind.values()) {
            normalized.put(kind, normalize(record.rawValue(kind), kind));
        }
        return record.withNormalizedAttributes(normalized);
    }
}
