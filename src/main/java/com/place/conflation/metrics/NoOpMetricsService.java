package com.place.conflation.metrics;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolutionStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementMatchedPairs(MatchKind kind, long count) {
    }

    @Override
    public void incrementExcludedRecord(ExclusionReason reason) {
    }

    @Override
    public void recordFuzzySimilarity(double nameSimilarity, double addressSimilarity) {
    }

    @Override
    public void incrementAttributeDecision(AttributeKind attribute, ResolutionStatus status, Provider winner) {
    }

    @Override
    public void incrementMalformedConfidence(Provider provider) {
    }

    @Override
    public void recordNormalizationCacheHit() {
    }

    @Override
    public void recordNormalizationCacheMiss() {
    }
}
