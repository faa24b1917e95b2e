package com.place.conflation.core.model;

/**
 * Outcome class of one attribute decision.
 */
public enum ResolutionStatus {
    /**
     * A usable value was chosen.
     */
    RESOLVED,

    /**
     * At least one provider offered the attribute but no offered value is usable.
     */
    NO_USABLE_VALUE,

    /**
     * Neither provider offered the attribute at all.
     */
    UNRESOLVED
}
