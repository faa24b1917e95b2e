package com.place.conflation.core.model;

/**
 * How a matched pair was formed.
 */
public enum MatchKind {
    /**
     * Identical normalized name and normalized address.
     */
    EXACT,

    /**
     * Name and address token-set similarity both at or above the threshold.
     */
    FUZZY
}
