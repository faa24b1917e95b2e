package com.place.conflation.matching;

import com.place.conflation.api.ConflationOptions;
import com.place.conflation.bulk.ProgressCallback;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ExcludedRecord;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.core.model.Provider;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.metrics.NoOpMetricsService;
import com.place.conflation.similarity.SimilarityAlgorithm;
import com.place.conflation.similarity.TokenSetSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Links ProviderA records to ProviderB records that denote the same place.
 *
 * <p>Matching runs in two stages over normalized records:</p>
 * <ol>
 *   <li><b>Exact</b>: records are grouped by (normalized name, normalized address); a group with
 *   exactly one record from each provider becomes an {@link MatchKind#EXACT} pair.</li>
 *   <li><b>Fuzzy</b>: the remaining records are compared with token-set similarity on name and
 *   address within blocking buckets; candidates are resolved one-to-one by {@link GreedyPairAssigner}.</li>
 * </ol>
 *
 * <p>Records without a usable name or address, and records whose id is repeated within their
 * provider, are excluded and reported. The result does not depend on input order.</p>
 */
public class RecordLinkageMatcher {
    private static final Logger log = LoggerFactory.getLogger(RecordLinkageMatcher.class);

    private static final Comparator<PlaceRecord> BY_RECORD_ID = Comparator.comparing(PlaceRecord::getRecordId);
    private static final Comparator<PlaceRecord> BY_PROVIDER_AND_ID =
            Comparator.comparing(PlaceRecord::getProvider).thenComparing(PlaceRecord::getRecordId);

    private final FuzzyMatchStage fuzzyStage;
    private final GreedyPairAssigner assigner;
    private final MetricsService metrics;

    public RecordLinkageMatcher(ConflationOptions options) {
        this(options, new TokenSetSimilarity(), new NoOpMetricsService());
    }

    public RecordLinkageMatcher(ConflationOptions options, MetricsService metrics) {
        this(options, new TokenSetSimilarity(), metrics);
    }

    public RecordLinkageMatcher(ConflationOptions options, SimilarityAlgorithm similarity, MetricsService metrics) {
        this.fuzzyStage = new FuzzyMatchStage(similarity, options.getBlockingStrategy(),
                options.getFuzzyThreshold(), options.getParallelism());
        this.assigner = new GreedyPairAssigner();
        this.metrics = metrics;
    }

    public LinkageResult match(Collection<PlaceRecord> recordsA, Collection<PlaceRecord> recordsB) {
        List<PlaceRecord> all = new ArrayList<>(recordsA.size() + recordsB.size());
        all.addAll(recordsA);
        all.addAll(recordsB);
        return match(all, ProgressCallback.NOOP);
    }

    /**
     * Matches normalized records of both providers.
     *
     * @param records  normalized records from ProviderA and ProviderB, in any order
     * @param callback optional progress callback for the fuzzy stage
     * @return pairs, exclusions and unmatched records
     */
    public LinkageResult match(Collection<PlaceRecord> records, ProgressCallback callback) {
        List<ExcludedRecord> excluded = new ArrayList<>();
        List<PlaceRecord> valid = validate(records, excluded);
        excluded.sort(Comparator.comparing(ExcludedRecord::record, BY_PROVIDER_AND_ID));
        for (ExcludedRecord record : excluded) {
            metrics.incrementExcludedRecord(record.reason());
        }
        if (!excluded.isEmpty()) {
            log.info("match.excluded count={} reasons={}", excluded.size(), countReasons(excluded));
        }

        long start = System.nanoTime();
        List<MatchedPair> pairs = new ArrayList<>();
        Set<PlaceRecord> consumed = new HashSet<>();
        for (MatchedPair pair : exactStage(valid)) {
            pairs.add(pair);
            consumed.add(pair.recordA());
            consumed.add(pair.recordB());
        }
        metrics.recordStageDuration("match.exact", Duration.ofNanos(System.nanoTime() - start));
        metrics.incrementMatchedPairs(MatchKind.EXACT, pairs.size());
        log.info("match.exact.completed pairs={}", pairs.size());

        List<PlaceRecord> remainingA = remaining(valid, Provider.PROVIDER_A, consumed);
        List<PlaceRecord> remainingB = remaining(valid, Provider.PROVIDER_B, consumed);

        start = System.nanoTime();
        List<FuzzyCandidate> candidates = fuzzyStage.findCandidates(remainingA, remainingB, callback);
        List<MatchedPair> fuzzyPairs = assigner.assign(candidates);
        for (MatchedPair pair : fuzzyPairs) {
            pairs.add(pair);
            consumed.add(pair.recordA());
            consumed.add(pair.recordB());
            metrics.recordFuzzySimilarity(pair.nameSimilarity(), pair.addressSimilarity());
        }
        metrics.recordStageDuration("match.fuzzy", Duration.ofNanos(System.nanoTime() - start));
        metrics.incrementMatchedPairs(MatchKind.FUZZY, fuzzyPairs.size());
        log.info("match.fuzzy.completed candidates={} pairs={}", candidates.size(), fuzzyPairs.size());

        pairs.sort(Comparator.comparing(MatchedPair::recordA, BY_RECORD_ID));
        LinkageResult result = new LinkageResult(pairs, excluded,
                remaining(remainingA, Provider.PROVIDER_A, consumed),
                remaining(remainingB, Provider.PROVIDER_B, consumed));
        log.info("match.completed result={}", result);
        return result;
    }

    private List<PlaceRecord> validate(Collection<PlaceRecord> records, List<ExcludedRecord> excluded) {
        Map<Provider, Map<String, Integer>> idCounts = new HashMap<>();
        for (PlaceRecord record : records) {
            idCounts.computeIfAbsent(record.getProvider(), p -> new HashMap<>())
                    .merge(record.getRecordId(), 1, Integer::sum);
        }

        List<PlaceRecord> valid = new ArrayList<>();
        for (PlaceRecord record : records) {
            if (idCounts.get(record.getProvider()).get(record.getRecordId()) > 1) {
                log.warn("match.duplicateRecordId provider={} recordId={}",
                        record.getProvider(), record.getRecordId());
                excluded.add(new ExcludedRecord(record, ExclusionReason.DUPLICATE_RECORD_ID));
                continue;
            }
            ExclusionReason reason = ExclusionReason.of(
                    record.normalized(AttributeKind.NAME).isEmpty(),
                    record.normalized(AttributeKind.ADDRESS).isEmpty());
            if (reason != null) {
                log.debug("match.excludedRecord provider={} recordId={} reason={}",
                        record.getProvider(), record.getRecordId(), reason);
                excluded.add(new ExcludedRecord(record, reason));
            } else {
                valid.add(record);
            }
        }
        return valid;
    }

    private List<MatchedPair> exactStage(List<PlaceRecord> valid) {
        Map<ExactKey, List<PlaceRecord>> groups = new LinkedHashMap<>();
        for (PlaceRecord record : valid) {
            ExactKey key = new ExactKey(record.normalized(AttributeKind.NAME), record.normalized(AttributeKind.ADDRESS));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<MatchedPair> pairs = new ArrayList<>();
        int ambiguousGroups = 0;
        for (List<PlaceRecord> group : groups.values()) {
            List<PlaceRecord> groupA = group.stream().filter(r -> r.getProvider() == Provider.PROVIDER_A).toList();
            List<PlaceRecord> groupB = group.stream().filter(r -> r.getProvider() == Provider.PROVIDER_B).toList();
            if (groupA.size() == 1 && groupB.size() == 1) {
                pairs.add(MatchedPair.exact(groupA.get(0), groupB.get(0)));
            } else if (!groupA.isEmpty() && !groupB.isEmpty()) {
                ambiguousGroups++;
            }
        }
        if (ambiguousGroups > 0) {
            log.debug("match.exact.ambiguousGroups count={}", ambiguousGroups);
        }
        return pairs;
    }

    private static List<PlaceRecord> remaining(List<PlaceRecord> records, Provider provider, Set<PlaceRecord> consumed) {
        return records.stream()
                .filter(r -> r.getProvider() == provider && !consumed.contains(r))
                .sorted(BY_RECORD_ID)
                .toList();
    }

    private static Map<ExclusionReason, Integer> countReasons(List<ExcludedRecord> excluded) {
        Map<ExclusionReason, Integer> counts = new TreeMap<>();
        for (ExcludedRecord record : excluded) {
            counts.merge(record.reason(), 1, Integer::sum);
        }
        return counts;
    }

    private record ExactKey(String name, String address) {
    }
}
