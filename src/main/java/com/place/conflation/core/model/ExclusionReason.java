package com.place.conflation.core.model;

/**
 * Why a record was kept out of matching.
 */
public enum ExclusionReason {
    MISSING_NAME,
    MISSING_ADDRESS,
    MISSING_NAME_AND_ADDRESS,
    /** Another record of the same provider carries the same record id. */
    DUPLICATE_RECORD_ID;

    /**
     * Returns the reason for the given field state, or {@code null} when both fields are usable.
     */
    public static ExclusionReason of(boolean nameMissing, boolean addressMissing) {
        if (nameMissing && addressMissing) {
            return MISSING_NAME_AND_ADDRESS;
        }
        if (nameMissing) {
            return MISSING_NAME;
        }
        if (addressMissing) {
            return MISSING_ADDRESS;
        }
        return null;
    }
}
