package com.place.conflation.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed memoizing decorator for a {@link TextNormalizer}.
 * Normalization is pure, so cached results are identical to the delegate's.
 */
public class CachingTextNormalizer implements TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(CachingTextNormalizer.class);

    private final TextNormalizer delegate;
    private final Cache<CacheKey, String> cache;
    private final MetricsService metrics;

    public CachingTextNormalizer(TextNormalizer delegate, long maxSize) {
        this(delegate, maxSize, new NoOpMetricsService());
    }

    public CachingTextNormalizer(TextNormalizer delegate, long maxSize, MetricsService metrics) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.delegate = delegate;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.info("CachingTextNormalizer initialized: maxSize={}", maxSize);
    }

    @Override
    public String normalize(String raw, AttributeKind kind) {
        if (raw == null) {
            return delegate.normalize(null, kind);
        }
        CacheKey key = new CacheKey(raw, kind);
        String cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordNormalizationCacheHit();
            return cached;
        }
        metrics.recordNormalizationCacheMiss();
        String normalized = delegate.normalize(raw, kind);
        cache.put(key, normalized);
        return normalized;
    }

    @Override
    public String clean(String raw, AttributeKind kind) {
        return delegate.clean(raw, kind);
    }

    @Override
    public boolean isCanonicalBrand(String rawName) {
        return delegate.isCanonicalBrand(rawName);
    }

    @Override
    public boolean hasBusinessSuffix(String rawName) {
        return delegate.hasBusinessSuffix(rawName);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    private record CacheKey(String raw, AttributeKind kind) {
    }
}
