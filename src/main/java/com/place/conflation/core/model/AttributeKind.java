package com.place.conflation.core.model;

/**
 * Logical place attributes offered by both providers.
 */
public enum AttributeKind {
    NAME("name"),
    ADDRESS("address"),
    PHONE("phone"),
    WEBSITE("website"),
    CATEGORY("category");

    private final String key;

    AttributeKind(String key) {
        this.key = key;
    }

    /**
     * The raw attribute-map key for this attribute.
     */
    public String getKey() {
        return key;
    }
}
