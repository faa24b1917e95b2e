package com.place.conflation.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One place as reported by one provider.
 * Raw attributes are a flat attribute-name to raw-string mapping; normalized attributes are
 * derived by the text normalizer and attached with {@link #withNormalizedAttributes(Map)}.
 *
 * <p>An address may be supplied as a single {@code address} value or as the components
 * {@code street}, {@code city}, {@code region} and {@code postcode}. Components take precedence
 * and are joined in that fixed order.</p>
 */
public final class PlaceRecord {

    public static final String STREET = "street";
    public static final String CITY = "city";
    public static final String REGION = "region";
    public static final String POSTCODE = "postcode";

    private static final String ADDRESS_DELIMITER = ", ";
    private static final String[] ADDRESS_COMPONENTS = {STREET, CITY, REGION, POSTCODE};

    private final String recordId;
    private final Provider provider;
    private final Map<String, String> rawAttributes;
    private final Map<AttributeKind, String> normalizedAttributes;
    private final String confidence;

    private PlaceRecord(String recordId, Provider provider, Map<String, String> rawAttributes,
                        Map<AttributeKind, String> normalizedAttributes, String confidence) {
        this.recordId = recordId;
        this.provider = provider;
        this.rawAttributes = rawAttributes;
        this.normalizedAttributes = normalizedAttributes;
        this.confidence = confidence;
    }

    public String getRecordId() {
        return recordId;
    }

    public Provider getProvider() {
        return provider;
    }

    public Map<String, String> getRawAttributes() {
        return rawAttributes;
    }

    public Map<AttributeKind, String> getNormalizedAttributes() {
        return normalizedAttributes;
    }

    /**
     * The provider-supplied confidence exactly as received, or {@code null}.
     * Parsing is deferred so malformed values can be reported at conflation time.
     */
    public String getConfidence() {
        return confidence;
    }

    /**
     * Returns true if the raw attribute map carries a non-null value for the attribute (possibly blank).
     */
    public boolean hasAttribute(AttributeKind kind) {
        if (kind == AttributeKind.ADDRESS) {
            if (rawAttributes.get(AttributeKind.ADDRESS.getKey()) != null) {
                return true;
            }
            for (String component : ADDRESS_COMPONENTS) {
                if (rawAttributes.get(component) != null) {
                    return true;
                }
            }
            return false;
        }
        return rawAttributes.get(kind.getKey()) != null;
    }

    /**
     * Returns the raw value for the attribute, or {@code null} when absent.
     * For addresses given as components, the non-blank components are joined in fixed order.
     */
    public String rawValue(AttributeKind kind) {
        if (kind != AttributeKind.ADDRESS) {
            return rawAttributes.get(kind.getKey());
        }

        StringJoiner joiner = new StringJoiner(ADDRESS_DELIMITER);
        boolean anyComponent = false;
        for (String component : ADDRESS_COMPONENTS) {
            String value = rawAttributes.get(component);
            if (value != null) {
                anyComponent = true;
                if (!value.isBlank()) {
                    joiner.add(value.trim());
                }
            }
        }
        if (anyComponent) {
            return joiner.toString();
        }
        return rawAttributes.get(AttributeKind.ADDRESS.getKey());
    }

    /**
     * Returns the normalized value, or an empty string when the record has not been normalized
     * or the attribute normalized to nothing.
     */
    public String normalized(AttributeKind kind) {
        return normalizedAttributes.getOrDefault(kind, "");
    }

    /**
     * Returns a copy of this record carrying the given normalized attributes.
     */
    public PlaceRecord withNormalizedAttributes(Map<AttributeKind, String> normalized) {
        Map<AttributeKind, String> copy = new EnumMap<>(AttributeKind.class);
        copy.putAll(normalized);
        return new PlaceRecord(recordId, provider, rawAttributes,
                Collections.unmodifiableMap(copy), confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaceRecord that = (PlaceRecord) o;
        return provider == that.provider && Objects.equals(recordId, that.recordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, recordId);
    }

    @Override
    public String toString() {
        return "PlaceRecord{" +
                "provider=" + provider +
                ", recordId='" + recordId + '\'' +
                ", name='" + rawAttributes.get(AttributeKind.NAME.getKey()) + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String recordId;
        private Provider provider;
        private final Map<String, String> rawAttributes = new LinkedHashMap<>();
        private String confidence;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder provider(Provider provider) {
            this.provider = provider;
            return this;
        }

        public Builder attribute(String key, String value) {
            rawAttributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            rawAttributes.putAll(attributes);
            return this;
        }

        public Builder name(String name) {
            return attribute(AttributeKind.NAME.getKey(), name);
        }

        public Builder address(String address) {
            return attribute(AttributeKind.ADDRESS.getKey(), address);
        }

        public Builder address(String street, String city, String region, String postcode) {
            attribute(STREET, street);
            attribute(CITY, city);
            attribute(REGION, region);
            return attribute(POSTCODE, postcode);
        }

        public Builder phone(String phone) {
            return attribute(AttributeKind.PHONE.getKey(), phone);
        }

        public Builder website(String website) {
            return attribute(AttributeKind.WEBSITE.getKey(), website);
        }

        public Builder category(String category) {
            return attribute(AttributeKind.CATEGORY.getKey(), category);
        }

        public Builder confidence(String confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = Double.toString(confidence);
            return this;
        }

        public PlaceRecord build() {
            Objects.requireNonNull(recordId, "recordId is required");
            Objects.requireNonNull(provider, "provider is required");
            return new PlaceRecord(recordId, provider,
                    Collections.unmodifiableMap(new LinkedHashMap<>(rawAttributes)),
                    Map.of(), confidence);
        }
    }
}
