package com.place.conflation.core.model;

/**
 * The two independent data providers whose records are linked and conflated.
 */
public enum Provider {
    PROVIDER_A("ProviderA"),
    PROVIDER_B("ProviderB");

    private final String label;

    Provider(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the other provider of the pair.
     */
    public Provider other() {
        return this == PROVIDER_A ? PROVIDER_B : PROVIDER_A;
    }
}
