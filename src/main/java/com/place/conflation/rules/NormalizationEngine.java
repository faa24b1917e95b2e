package com.place.conflation.rules;

import com.place.conflation.core.model.AttributeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-driven {@link TextNormalizer}.
 *
 * <p>Every value is case-folded and stripped of diacritics, then the rules applicable to the
 * attribute kind run in priority order (lower number first), then whitespace is trimmed. Names
 * additionally lose trailing business-entity suffixes and are mapped through the brand table.</p>
 *
 * <p>Reference data is compiled once at construction: brand aliases and canonical forms are
 * cleaned with the same rules, so a canonical brand always normalizes to itself.</p>
 */
public class NormalizationEngine implements TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final List<NormalizationRule> rules;
    private final List<String> suffixes;
    private final Map<String, String> brandLookup;
    private final Set<String> canonicalBrands;

    public NormalizationEngine(List<NormalizationRule> rules, ReferenceData referenceData) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
        this.suffixes = compileSuffixes(referenceData.businessSuffixes());

        Map<String, String> lookup = new HashMap<>();
        Set<String> canonicals = new HashSet<>();
        referenceData.brands().forEach((canonical, aliases) -> {
            String canonicalForm = stripSuffixes(clean(canonical, AttributeKind.NAME));
            if (canonicalForm.isEmpty()) {
                throw new IllegalArgumentException("Canonical brand normalizes to nothing: '" + canonical + "'");
            }
            canonicals.add(canonicalForm);
            register(lookup, canonicalForm, canonicalForm);
            for (String alias : aliases) {
                String aliasForm = stripSuffixes(clean(alias, AttributeKind.NAME));
                if (!aliasForm.isEmpty()) {
                    register(lookup, aliasForm, canonicalForm);
                }
            }
        });
        this.brandLookup = Map.copyOf(lookup);
        this.canonicalBrands = Set.copyOf(canonicals);
    }

    @Override
    public String normalize(String raw, AttributeKind kind) {
        String result = clean(raw, kind);
        if (kind != AttributeKind.NAME || result.isEmpty()) {
            return result;
        }

        String stripped = stripSuffixes(result);
        String brand = brandLookup.get(stripped);
        if (brand != null && !brand.equals(stripped)) {
            log.debug("Brand alias '{}' -> '{}'", stripped, brand);
            return brand;
        }
        return stripped;
    }

    @Override
    public String clean(String raw, AttributeKind kind) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String result = foldCase(raw);
        for (NormalizationRule rule : rules) {
            if (kind == null || rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }
        return result.trim();
    }

    @Override
    public boolean isCanonicalBrand(String rawName) {
        String cleaned = clean(rawName, AttributeKind.NAME);
        return !cleaned.isEmpty() && canonicalBrands.contains(cleaned);
    }

    @Override
    public boolean hasBusinessSuffix(String rawName) {
        String cleaned = clean(rawName, AttributeKind.NAME);
        for (String suffix : suffixes) {
            if (cleaned.endsWith(" " + suffix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Repeatedly removes trailing suffix tokens; a name that consists only of a suffix is kept.
     */
    String stripSuffixes(String cleaned) {
        String result = cleaned;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String suffix : suffixes) {
                if (result.endsWith(" " + suffix)) {
                    result = result.substring(0, result.length() - suffix.length() - 1).trim();
                    changed = true;
                    break;
                }
            }
        }
        return result;
    }

    private List<String> compileSuffixes(List<String> rawSuffixes) {
        Set<String> compiled = new HashSet<>();
        for (String suffix : rawSuffixes) {
            String cleaned = clean(suffix, AttributeKind.NAME);
            if (!cleaned.isEmpty()) {
                compiled.add(cleaned);
            }
        }
        // Longest first, so "l l c" wins over a shorter overlapping entry
        List<String> ordered = new ArrayList<>(compiled);
        ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return List.copyOf(ordered);
    }

    private static void register(Map<String, String> lookup, String key, String canonical) {
        String existing = lookup.putIfAbsent(key, canonical);
        if (existing != null && !existing.equals(canonical)) {
            throw new IllegalArgumentException("Brand alias '" + key + "' maps to both '"
                    + existing + "' and '" + canonical + "'");
        }
    }

    private static String foldCase(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        return COMBINING_MARKS.matcher(Normalizer.normalize(lower, Normalizer.Form.NFD)).replaceAll("");
    }
}
