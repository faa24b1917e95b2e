package com.place.conflation.metrics;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolutionStatus;

import java.time.Duration;

/**
 * Interface for recording linkage and conflation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordStageDuration(String stage, Duration duration);

    void incrementMatchedPairs(MatchKind kind, long count);

    void incrementExcludedRecord(ExclusionReason reason);

    void recordFuzzySimilarity(double nameSimilarity, double addressSimilarity);

    /**
     * Records one attribute decision; {@code winner} is null unless the status is RESOLVED.
     */
    void incrementAttributeDecision(AttributeKind attribute, ResolutionStatus status, Provider winner);

    void incrementMalformedConfidence(Provider provider);

    void recordNormalizationCacheHit();

    void recordNormalizationCacheMiss();
}
