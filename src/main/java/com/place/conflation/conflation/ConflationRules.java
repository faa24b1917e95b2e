package com.place.conflation.conflation;

import com.place.conflation.api.ConflationOptions;
import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.Provider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Built-in conflation rules and the default cascade for each attribute kind.
 */
public final class ConflationRules {

    public static final String COMPLETENESS = "completeness";
    public static final String CANONICAL_BRAND = "canonical-brand";
    public static final String BUSINESS_SUFFIX = "business-suffix";
    public static final String STORE_NUMBER = "store-number";
    public static final String WORD_COUNT_WINDOW = "word-count-window";
    public static final String CONFIDENCE_PRESENCE = "confidence-presence";
    public static final String ADDRESS_COMPONENTS = "address-components";
    public static final String POSTAL_CODE = "postal-code";
    public static final String PHONE_DIGITS = "phone-digits";
    public static final String WEBSITE_FORMAT = "website-format";
    public static final String WEBSITE_DOMAIN = "website-domain";
    public static final String HTTPS = "https";
    public static final String CATEGORY_COUNT = "category-count";
    public static final String CATEGORY_BUCKET = "category-bucket";
    public static final String CATEGORY_SPECIFICITY = "category-specificity";

    static final int MIN_PHONE_DIGITS = 10;

    static final String OTHER_BUCKET = "other";

    /**
     * Category phrases to coarse buckets, matched on whole normalized tokens; the first match wins.
     */
    static final Map<String, String> CATEGORY_BUCKETS = categoryBuckets();

    /**
     * Social and aggregator hosts that do not count as a place's own website.
     */
    static final Set<String> AGGREGATOR_DOMAINS = Set.of(
            "facebook.com", "instagram.com", "youtube.com", "twitter.com", "x.com",
            "bing.com", "yelp.com", "tripadvisor.com");

    private static final Pattern ZIP_CODE = Pattern.compile("\\b\\d{5}(-\\d{4})?\\b");
    private static final Pattern WEBSITE = Pattern.compile("^https?://[\\w\\-.]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CATEGORY_SEPARATOR = Pattern.compile("[,;]");
    private static final Pattern STORE_NUMBER_TOKEN = Pattern.compile("\\b\\d{3,6}\\b");

    private ConflationRules() {
        // Utility class
    }

    /**
     * Returns the default cascade for every attribute kind.
     */
    public static Map<AttributeKind, RuleCascade> defaultCascades(ConflationOptions options) {
        Map<AttributeKind, RuleCascade> cascades = new EnumMap<>(AttributeKind.class);
        for (AttributeKind kind : AttributeKind.values()) {
            cascades.put(kind, defaultCascade(kind, options));
        }
        return cascades;
    }

    public static RuleCascade defaultCascade(AttributeKind kind, ConflationOptions options) {
        Provider preferred = options.getPreferredProvider();
        List<ConflationRule> rules = switch (kind) {
            case NAME -> List.of(
                    completeness(),
                    canonicalBrand(),
                    new ConfidenceRule(),
                    businessSuffix(),
                    storeNumber(),
                    wordCountWindow(options.getNameWordCountMin(), options.getNameWordCountMax()),
                    confidencePresence(),
                    new SourcePriorityRule(preferred));
            case ADDRESS -> List.of(
                    completeness(),
                    new ConfidenceRule(),
                    addressComponents(),
                    postalCode(),
                    confidencePresence(),
                    new SourcePriorityRule(preferred));
            case PHONE -> List.of(
                    completeness(),
                    phoneDigits(),
                    new ConfidenceRule(),
                    confidencePresence(),
                    new SourcePriorityRule(preferred));
            case WEBSITE -> List.of(
                    completeness(),
                    websiteFormat(),
                    websiteDomain(),
                    https(),
                    new ConfidenceRule(),
                    confidencePresence(),
                    new SourcePriorityRule(preferred));
            case CATEGORY -> List.of(
                    completeness(),
                    new ConfidenceRule(),
                    categoryCount(),
                    categoryBucket(),
                    categorySpecificity(),
                    confidencePresence(),
                    new SourcePriorityRule(preferred));
        };
        return new RuleCascade(kind, rules);
    }

    public static ConflationRule completeness() {
        return ConflationRule.preferring(COMPLETENESS, AttributeCandidate::isUsable);
    }

    public static ConflationRule canonicalBrand() {
        return ConflationRule.preferring(CANONICAL_BRAND, AttributeCandidate::canonicalBrand);
    }

    public static ConflationRule businessSuffix() {
        return ConflationRule.preferring(BUSINESS_SUFFIX, c -> !c.businessSuffix());
    }

    /**
     * Prefers a name without a store number such as {@code #0412} or {@code 6285}.
     */
    public static ConflationRule storeNumber() {
        return ConflationRule.preferring(STORE_NUMBER, c -> !hasStoreNumber(c.rawValue()));
    }

    public static ConflationRule wordCountWindow(int min, int max) {
        return ConflationRule.preferring(WORD_COUNT_WINDOW,
                c -> c.tokenCount() >= min && c.tokenCount() <= max);
    }

    public static ConflationRule confidencePresence() {
        return ConflationRule.preferring(CONFIDENCE_PRESENCE, AttributeCandidate::hasConfidence);
    }

    public static ConflationRule addressComponents() {
        return ConflationRule.preferringHigher(ADDRESS_COMPONENTS, c -> addressComponentCount(c.rawValue()));
    }

    public static ConflationRule postalCode() {
        return ConflationRule.preferring(POSTAL_CODE, c -> ZIP_CODE.matcher(c.rawValue()).find());
    }

    public static ConflationRule phoneDigits() {
        return ConflationRule.preferring(PHONE_DIGITS, c -> digitCount(c.rawValue()) >= MIN_PHONE_DIGITS);
    }

    public static ConflationRule websiteFormat() {
        return ConflationRule.preferring(WEBSITE_FORMAT, c -> WEBSITE.matcher(c.rawValue()).find());
    }

    public static ConflationRule websiteDomain() {
        return ConflationRule.preferring(WEBSITE_DOMAIN, c -> !isAggregatorHost(c.value()));
    }

    public static ConflationRule https() {
        return ConflationRule.preferring(HTTPS,
                c -> c.rawValue().toLowerCase(Locale.ROOT).startsWith("https://"));
    }

    public static ConflationRule categoryCount() {
        return ConflationRule.preferringHigher(CATEGORY_COUNT, c -> categoryCount(c.rawValue()));
    }

    /**
     * Prefers a category that falls into a known coarse bucket over one that does not.
     */
    public static ConflationRule categoryBucket() {
        return ConflationRule.preferring(CATEGORY_BUCKET, c -> !OTHER_BUCKET.equals(coarseCategory(c.value())));
    }

    public static ConflationRule categorySpecificity() {
        return ConflationRule.preferringHigher(CATEGORY_SPECIFICITY, c -> c.value().length());
    }

    static boolean hasStoreNumber(String rawName) {
        return STORE_NUMBER_TOKEN.matcher(rawName).find();
    }

    static String coarseCategory(String normalizedCategory) {
        String padded = " " + normalizedCategory + " ";
        for (Map.Entry<String, String> entry : CATEGORY_BUCKETS.entrySet()) {
            if (padded.contains(" " + entry.getKey() + " ")) {
                return entry.getValue();
            }
        }
        return OTHER_BUCKET;
    }

    static int addressComponentCount(String rawAddress) {
        return countNonBlank(rawAddress.split(","));
    }

    static int categoryCount(String rawCategory) {
        return countNonBlank(CATEGORY_SEPARATOR.split(rawCategory));
    }

    static int digitCount(String value) {
        int digits = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                digits++;
            }
        }
        return digits;
    }

    /**
     * Matches the normalized host against the aggregator list, including subdomains such as {@code m.facebook.com}.
     */
    static boolean isAggregatorHost(String host) {
        for (String domain : AGGREGATOR_DOMAINS) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> categoryBuckets() {
        Map<String, String> buckets = new LinkedHashMap<>();
        for (String phrase : List.of("restaurant", "fast food", "pizza", "sandwich", "burger", "chicken",
                "cafe", "coffee", "bakery", "bar")) {
            buckets.put(phrase, "food");
        }
        for (String phrase : List.of("grocery", "supermarket", "retail", "convenience store",
                "department store", "pharmacy", "store", "shop")) {
            buckets.put(phrase, "retail");
        }
        for (String phrase : List.of("hotel", "motel", "resort", "lodging")) {
            buckets.put(phrase, "lodging");
        }
        for (String phrase : List.of("car", "auto", "automotive", "repair", "dealer", "gas station")) {
            buckets.put(phrase, "automotive");
        }
        for (String phrase : List.of("health", "medical", "clinic", "therapy", "hospital", "dentist")) {
            buckets.put(phrase, "medical");
        }
        for (String phrase : List.of("event", "venue", "casino", "theater", "cinema", "stadium", "arena")) {
            buckets.put(phrase, "entertainment");
        }
        for (String phrase : List.of("service", "professional", "bank", "financial", "legal", "accounting")) {
            buckets.put(phrase, "services");
        }
        return Collections.unmodifiableMap(buckets);
    }

    private static int countNonBlank(String[] parts) {
        int count = 0;
        for (String part : parts) {
            if (!part.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
