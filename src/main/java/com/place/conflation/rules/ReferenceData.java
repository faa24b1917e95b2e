package com.place.conflation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Curated, read-only lookup data used by normalization and conflation.
 *
 * @param brands           canonical brand string to the alias strings that map onto it
 * @param businessSuffixes business-entity suffixes removed from the end of names
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceData(
        Map<String, List<String>> brands,
        List<String> businessSuffixes
) {
    @JsonCreator
    public ReferenceData(@JsonProperty("brands") Map<String, List<String>> brands,
                         @JsonProperty("businessSuffixes") List<String> businessSuffixes) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (brands != null) {
            brands.forEach((canonical, aliases) ->
                    copy.put(canonical, aliases != null ? List.copyOf(aliases) : List.of()));
        }
        this.brands = Collections.unmodifiableMap(copy);
        this.businessSuffixes = businessSuffixes != null ? List.copyOf(businessSuffixes) : List.of();
    }

    public static ReferenceData empty() {
        return new ReferenceData(Map.of(), List.of());
    }
}
