package com.place.conflation.metrics;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code conflation.stage.duration}: Timer (tag: stage)</li>
 *   <li>{@code conflation.pairs.matched}: Counter (tag: matchKind)</li>
 *   <li>{@code conflation.records.excluded}: Counter (tag: reason)</li>
 *   <li>{@code conflation.similarity.name}: DistributionSummary</li>
 *   <li>{@code conflation.similarity.address}: DistributionSummary</li>
 *   <li>{@code conflation.attribute.decision}: Counter (tags: attribute, status, provider)</li>
 *   <li>{@code conflation.confidence.malformed}: Counter (tag: provider)</li>
 *   <li>{@code conflation.normalizer.cache.hit}: Counter</li>
 *   <li>{@code conflation.normalizer.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary nameSimilaritySummary;
    private final DistributionSummary addressSimilaritySummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.nameSimilaritySummary = DistributionSummary.builder("conflation.similarity.name")
                .description("Name similarity of accepted fuzzy candidates")
                .register(registry);
        this.addressSimilaritySummary = DistributionSummary.builder("conflation.similarity.address")
                .description("Address similarity of accepted fuzzy candidates")
                .register(registry);
        this.cacheHitCounter = Counter.builder("conflation.normalizer.cache.hit")
                .description("Number of normalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("conflation.normalizer.cache.miss")
                .description("Number of normalization cache misses")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("conflation.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMatchedPairs(MatchKind kind, long count) {
        String key = "matched:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflation.pairs.matched")
                        .description("Number of matched record pairs")
                        .tag("matchKind", kind.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementExcludedRecord(ExclusionReason reason) {
        String key = "excluded:" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflation.records.excluded")
                        .description("Number of records excluded before matching")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFuzzySimilarity(double nameSimilarity, double addressSimilarity) {
        nameSimilaritySummary.record(nameSimilarity);
        addressSimilaritySummary.record(addressSimilarity);
    }

    @Override
    public void incrementAttributeDecision(AttributeKind attribute, ResolutionStatus status, Provider winner) {
        String provider = winner != null ? winner.name() : "NONE";
        String key = "decision:" + attribute.name() + ":" + status.name() + ":" + provider;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflation.attribute.decision")
                        .description("Number of attribute decisions")
                        .tag("attribute", attribute.name())
                        .tag("status", status.name())
                        .tag("provider", provider)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementMalformedConfidence(Provider provider) {
        String key = "malformed:" + provider.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflation.confidence.malformed")
                        .description("Number of provider confidence values treated as absent")
                        .tag("provider", provider.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordNormalizationCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordNormalizationCacheMiss() {
        cacheMissCounter.increment();
    }
}
