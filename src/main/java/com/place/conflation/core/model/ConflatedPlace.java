package com.place.conflation.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The conflated view of one matched place: one decision per attribute kind.
 */
public record ConflatedPlace(
        MatchedPair pair,
        Map<AttributeKind, ResolvedAttribute> attributes,
        Provider bestSource
) {
    public ConflatedPlace {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(attributes, "attributes is required");
        for (AttributeKind kind : AttributeKind.values()) {
            if (!attributes.containsKey(kind)) {
                throw new IllegalArgumentException("Missing decision for attribute " + kind);
            }
        }
        attributes = Collections.unmodifiableMap(new EnumMap<>(attributes));
    }

    public ResolvedAttribute attribute(AttributeKind kind) {
        return attributes.get(kind);
    }

    public String placeKey() {
        return pair.placeKey();
    }
}
