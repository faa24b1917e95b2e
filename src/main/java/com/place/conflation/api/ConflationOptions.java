package com.place.conflation.api;

import com.place.conflation.core.model.Provider;
import com.place.conflation.rules.ReferenceData;
import com.place.conflation.rules.ReferenceDataLoader;
import com.place.conflation.similarity.BlockingKeyStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Options for a conflation run.
 * Configures the fuzzy threshold, provider priority, reference data, the name word-count
 * window, blocking and parallelism.
 */
public class ConflationOptions {

    private static final double DEFAULT_FUZZY_THRESHOLD = 85.0;
    private static final int DEFAULT_NAME_WORD_COUNT_MIN = 2;
    private static final int DEFAULT_NAME_WORD_COUNT_MAX = 7;
    private static final long DEFAULT_NORMALIZATION_CACHE_SIZE = 10_000;

    private final double fuzzyThreshold;
    private final List<Provider> providerPriority;
    private final ReferenceData referenceData;
    private final int nameWordCountMin;
    private final int nameWordCountMax;
    private final BlockingKeyStrategy blockingStrategy;
    private final int parallelism;
    private final long normalizationCacheSize;

    private ConflationOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.providerPriority = builder.providerPriority;
        this.referenceData = builder.referenceData != null
                ? builder.referenceData
                : ReferenceDataLoader.loadDefault();
        this.nameWordCountMin = builder.nameWordCountMin;
        this.nameWordCountMax = builder.nameWordCountMax;
        this.blockingStrategy = builder.blockingStrategy;
        this.parallelism = builder.parallelism;
        this.normalizationCacheSize = builder.normalizationCacheSize;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Providers from most to least preferred, used as the final tie-breaker.
     */
    public List<Provider> getProviderPriority() {
        return providerPriority;
    }

    public Provider getPreferredProvider() {
        return providerPriority.get(0);
    }

    public ReferenceData getReferenceData() {
        return referenceData;
    }

    public int getNameWordCountMin() {
        return nameWordCountMin;
    }

    public int getNameWordCountMax() {
        return nameWordCountMax;
    }

    public BlockingKeyStrategy getBlockingStrategy() {
        return blockingStrategy;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Maximum entries of the normalization cache; 0 disables caching.
     */
    public long getNormalizationCacheSize() {
        return normalizationCacheSize;
    }

    /**
     * Creates default options.
     */
    public static ConflationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private List<Provider> providerPriority = List.of(Provider.PROVIDER_A, Provider.PROVIDER_B);
        private ReferenceData referenceData;
        private int nameWordCountMin = DEFAULT_NAME_WORD_COUNT_MIN;
        private int nameWordCountMax = DEFAULT_NAME_WORD_COUNT_MAX;
        private BlockingKeyStrategy blockingStrategy = BlockingKeyStrategy.NONE;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private long normalizationCacheSize = DEFAULT_NORMALIZATION_CACHE_SIZE;

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            if (fuzzyThreshold < 0.0 || fuzzyThreshold > 100.0) {
                throw new IllegalArgumentException("fuzzyThreshold must be between 0 and 100");
            }
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        /**
         * Sets the provider preferred by the source-priority rule.
         */
        public Builder preferredProvider(Provider provider) {
            Objects.requireNonNull(provider, "provider is required");
            this.providerPriority = List.of(provider, provider.other());
            return this;
        }

        public Builder providerPriority(List<Provider> providerPriority) {
            if (providerPriority == null || providerPriority.size() != Provider.values().length
                    || providerPriority.stream().distinct().count() != Provider.values().length
                    || providerPriority.contains(null)) {
                throw new IllegalArgumentException("providerPriority must list every provider exactly once");
            }
            this.providerPriority = List.copyOf(providerPriority);
            return this;
        }

        public Builder referenceData(ReferenceData referenceData) {
            this.referenceData = Objects.requireNonNull(referenceData, "referenceData is required");
            return this;
        }

        public Builder nameWordCountWindow(int min, int max) {
            if (min < 1) {
                throw new IllegalArgumentException("nameWordCountMin must be positive");
            }
            if (max < min) {
                throw new IllegalArgumentException("nameWordCountMax must be >= nameWordCountMin");
            }
            this.nameWordCountMin = min;
            this.nameWordCountMax = max;
            return this;
        }

        /**
         * Sets the blocking used by the fuzzy stage. The default {@link BlockingKeyStrategy#NONE}
         * scores every pair; any other strategy may miss pairs that share no key.
         */
        public Builder blockingStrategy(BlockingKeyStrategy blockingStrategy) {
            this.blockingStrategy = Objects.requireNonNull(blockingStrategy, "blockingStrategy is required");
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder normalizationCacheSize(long normalizationCacheSize) {
            if (normalizationCacheSize < 0) {
                throw new IllegalArgumentException("normalizationCacheSize must not be negative");
            }
            this.normalizationCacheSize = normalizationCacheSize;
            return this;
        }

        public ConflationOptions build() {
            return new ConflationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ConflationOptions{" +
                "fuzzyThreshold=" + fuzzyThreshold +
                ", providerPriority=" + providerPriority +
                ", nameWordCountWindow=[" + nameWordCountMin + ", " + nameWordCountMax + "]" +
                ", brands=" + referenceData.brands().size() +
                ", businessSuffixes=" + referenceData.businessSuffixes().size() +
                ", parallelism=" + parallelism +
                ", normalizationCacheSize=" + normalizationCacheSize +
                '}';
    }
}
