package com.place.conflation.core.model;

import java.util.Objects;

/**
 * A record that could not take part in matching, with the reason.
 */
public record ExcludedRecord(PlaceRecord record, ExclusionReason reason) {
    public ExcludedRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
