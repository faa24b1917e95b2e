package com.place.conflation.matching;

import com.place.conflation.core.model.ExcludedRecord;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the record linkage matcher.
 *
 * @param pairs      exact and fuzzy pairs, ordered by ProviderA record id
 * @param excluded   records kept out of matching, ordered by provider then record id
 * @param unmatchedA valid ProviderA records without a counterpart, ordered by record id
 * @param unmatchedB valid ProviderB records without a counterpart, ordered by record id
 */
public record LinkageResult(
        List<MatchedPair> pairs,
        List<ExcludedRecord> excluded,
        List<PlaceRecord> unmatchedA,
        List<PlaceRecord> unmatchedB
) {
    public LinkageResult {
        pairs = List.copyOf(pairs);
        excluded = List.copyOf(excluded);
        unmatchedA = List.copyOf(unmatchedA);
        unmatchedB = List.copyOf(unmatchedB);
    }

    public List<MatchedPair> pairsOfKind(MatchKind kind) {
        return pairs.stream().filter(p -> p.matchKind() == kind).toList();
    }

    public long countOf(MatchKind kind) {
        return pairs.stream().filter(p -> p.matchKind() == kind).count();
    }

    public Map<ExclusionReason, Long> exclusionCounts() {
        Map<ExclusionReason, Long> counts = new EnumMap<>(ExclusionReason.class);
        for (ExcludedRecord record : excluded) {
            counts.merge(record.reason(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        return "LinkageResult{exact=" + countOf(MatchKind.EXACT) +
                ", fuzzy=" + countOf(MatchKind.FUZZY) +
                ", excluded=" + excluded.size() +
                ", unmatchedA=" + unmatchedA.size() +
                ", unmatchedB=" + unmatchedB.size() + '}';
    }
}
