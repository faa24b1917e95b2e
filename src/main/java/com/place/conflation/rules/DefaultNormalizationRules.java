package com.place.conflation.rules;

import com.place.conflation.core.model.AttributeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in cleanup rules for place attributes.
 * Case folding and diacritic stripping happen before any rule runs.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a normalizer with all default rules and the bundled reference data.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getAllRules(), ReferenceDataLoader.loadDefault());
    }

    /**
     * Creates a normalizer with all default rules and the given reference data.
     */
    public static NormalizationEngine createEngine(ReferenceData referenceData) {
        return new NormalizationEngine(getAllRules(), referenceData);
    }

    public static List<NormalizationRule> getAllRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getPhoneRules());
        rules.addAll(getWebsiteRules());
        rules.addAll(getCommonRules());
        return rules;
    }

    /**
     * Rules shared by free-text attributes (name, address, category).
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Punctuation and symbols become token breaks
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^a-z0-9\\s]")
                        .replacement(" ")
                        .applicableKinds(AttributeKind.NAME, AttributeKind.ADDRESS, AttributeKind.CATEGORY)
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    /**
     * Phone numbers reduce to digits, keeping the last ten when there are at least ten.
     */
    public static List<NormalizationRule> getPhoneRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("phone-digits-only")
                        .pattern("\\D")
                        .replacement("")
                        .applicableKinds(AttributeKind.PHONE)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("phone-last-ten")
                        .pattern("^\\d*(\\d{10})$")
                        .replacement("$1")
                        .applicableKinds(AttributeKind.PHONE)
                        .priority(20)
                        .build()
        );
    }

    /**
     * Websites reduce to a bare host: no scheme, no www, no port, no path.
     */
    public static List<NormalizationRule> getWebsiteRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("website-invalid-chars")
                        .pattern("[^a-z0-9.\\-:/?#]")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("website-scheme")
                        .pattern("^[a-z][a-z0-9.\\-]*://")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("website-path")
                        .pattern("[/?#].*$")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("website-port")
                        .pattern(":.*$")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(40)
                        .build(),

                // Any leading run of dots, hyphens and "www." labels
                NormalizationRule.builder()
                        .name("website-leading-noise")
                        .pattern("^([.\\-]|www\\.)+")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("website-trailing-noise")
                        .pattern("[.\\-]+$")
                        .replacement("")
                        .applicableKinds(AttributeKind.WEBSITE)
                        .priority(60)
                        .build()
        );
    }
}
