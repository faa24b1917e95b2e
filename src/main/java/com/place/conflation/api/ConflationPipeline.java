package com.place.conflation.api;

import com.place.conflation.bulk.ProgressCallback;
import com.place.conflation.conflation.AttributeConflationResolver;
import com.place.conflation.conflation.AttributeResolver;
import com.place.conflation.conflation.CandidateAggregator;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ConflatedPlace;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.core.model.Provider;
import com.place.conflation.logging.LogContext;
import com.place.conflation.matching.LinkageResult;
import com.place.conflation.matching.RecordLinkageMatcher;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.metrics.NoOpMetricsService;
import com.place.conflation.rules.CachingTextNormalizer;
import com.place.conflation.rules.DefaultNormalizationRules;
import com.place.conflation.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the library: normalizes both providers' records, links them and conflates
 * every matched place.
 *
 * <pre>
 * ConflationPipeline pipeline = new ConflationPipeline(ConflationOptions.defaults());
 * ConflationResult result = pipeline.run(providerARecords, providerBRecords);
 * </pre>
 */
public class ConflationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConflationPipeline.class);

    private final ConflationOptions options;
    private final TextNormalizer normalizer;
    private final RecordLinkageMatcher matcher;
    private final AttributeConflationResolver resolver;
    private final MetricsService metrics;

    public ConflationPipeline(ConflationOptions options) {
        this(options, new NoOpMetricsService());
    }

    public ConflationPipeline(ConflationOptions options, MetricsService metrics) {
        this(options, createNormalizer(options, metrics), metrics);
    }

    public ConflationPipeline(ConflationOptions options, TextNormalizer normalizer, MetricsService metrics) {
        this(options, normalizer, new RecordLinkageMatcher(options, metrics),
                AttributeConflationResolver.ruleBased(options, new CandidateAggregator(normalizer, metrics), metrics),
                metrics);
    }

    private ConflationPipeline(ConflationOptions options, TextNormalizer normalizer, RecordLinkageMatcher matcher,
                               AttributeConflationResolver resolver, MetricsService metrics) {
        this.options = options;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.resolver = resolver;
        this.metrics = metrics;
        log.info("ConflationPipeline initialized: {}", options);
    }

    /**
     * Returns a pipeline that resolves {@code kind} with the given resolver instead of the rule cascade.
     */
    public ConflationPipeline withAttributeResolver(AttributeKind kind, AttributeResolver attributeResolver) {
        return new ConflationPipeline(options, normalizer, matcher,
                resolver.withResolver(kind, attributeResolver), metrics);
    }

    public ConflationResult run(Collection<PlaceRecord> recordsA, Collection<PlaceRecord> recordsB) {
        return run(recordsA, recordsB, ProgressCallback.NOOP);
    }

    /**
     * Runs the whole batch.
     *
     * @param recordsA raw ProviderA records
     * @param recordsB raw ProviderB records
     * @param callback optional progress callback
     * @throws IllegalArgumentException if a record is passed on the wrong provider's side
     */
    public ConflationResult run(Collection<PlaceRecord> recordsA, Collection<PlaceRecord> recordsB,
                                ProgressCallback callback) {
        requireProvider(recordsA, Provider.PROVIDER_A);
        requireProvider(recordsB, Provider.PROVIDER_B);
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("pipeline.started recordsA={} recordsB={}", recordsA.size(), recordsB.size());
            long runStart = System.nanoTime();

            List<PlaceRecord> normalized;
            try (LogContext stage = LogContext.forStage("normalize")) {
                long start = System.nanoTime();
                normalized = new ArrayList<>(recordsA.size() + recordsB.size());
                for (PlaceRecord record : recordsA) {
                    normalized.add(normalizer.normalizeRecord(record));
                }
                for (PlaceRecord record : recordsB) {
                    normalized.add(normalizer.normalizeRecord(record));
                }
                metrics.recordStageDuration("normalize", Duration.ofNanos(System.nanoTime() - start));
                log.info("normalize.completed records={}", normalized.size());
            }

            LinkageResult linkage;
            try (LogContext stage = LogContext.forStage("match")) {
                linkage = matcher.match(normalized, cb);
            }

            List<ConflatedPlace> places;
            try (LogContext stage = LogContext.forStage("resolve")) {
                long start = System.nanoTime();
                places = resolver.conflateAll(linkage.pairs());
                metrics.recordStageDuration("resolve", Duration.ofNanos(System.nanoTime() - start));
            }

            ConflationResult result = new ConflationResult(runId, linkage, places);
            metrics.recordStageDuration("pipeline", Duration.ofNanos(System.nanoTime() - runStart));
            log.info("pipeline.completed result={}", result);
            return result;
        }
    }

    private static TextNormalizer createNormalizer(ConflationOptions options, MetricsService metrics) {
        TextNormalizer engine = DefaultNormalizationRules.createEngine(options.getReferenceData());
        if (options.getNormalizationCacheSize() > 0) {
            return new CachingTextNormalizer(engine, options.getNormalizationCacheSize(), metrics);
        }
        return engine;
    }

    private static void requireProvider(Collection<PlaceRecord> records, Provider expected) {
        for (PlaceRecord record : records) {
            if (record.getProvider() != expected) {
                throw new IllegalArgumentException("Record " + record.getRecordId() + " from "
                        + record.getProvider() + " passed as " + expected);
            }
        }
    }
}
