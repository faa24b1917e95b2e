package com.place.conflation.api;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ConflatedPlace;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolutionStatus;
import com.place.conflation.core.model.ResolvedAttribute;
import com.place.conflation.matching.LinkageResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a conflation run.
 *
 * @param runId   identifier of the run, also present in the log MDC
 * @param linkage matched pairs, exclusions and unmatched records
 * @param places  one conflated place per matched pair, in pair order
 */
public record ConflationResult(
        String runId,
        LinkageResult linkage,
        List<ConflatedPlace> places
) {
    public ConflationResult {
        places = List.copyOf(places);
    }

    /**
     * Number of places where each provider's value survived, per attribute.
     */
    public Map<AttributeKind, Map<Provider, Long>> winCounts() {
        Map<AttributeKind, Map<Provider, Long>> counts = new EnumMap<>(AttributeKind.class);
        for (AttributeKind kind : AttributeKind.values()) {
            Map<Provider, Long> perProvider = new EnumMap<>(Provider.class);
            for (Provider provider : Provider.values()) {
                perProvider.put(provider, 0L);
            }
            counts.put(kind, perProvider);
        }
        for (ConflatedPlace place : places) {
            for (ResolvedAttribute decision : place.attributes().values()) {
                if (decision.isResolved()) {
                    counts.get(decision.attribute()).merge(decision.winningProvider(), 1L, Long::sum);
                }
            }
        }
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Share of resolved decisions for {@code kind} won by {@code provider}, between 0 and 1.
     */
    public double winShare(AttributeKind kind, Provider provider) {
        Map<Provider, Long> perProvider = winCounts().get(kind);
        long total = perProvider.values().stream().mapToLong(Long::longValue).sum();
        return total == 0 ? 0.0 : (double) perProvider.get(provider) / total;
    }

    public long countOf(AttributeKind kind, ResolutionStatus status) {
        return places.stream()
                .filter(p -> p.attribute(kind).status() == status)
                .count();
    }

    @Override
    public String toString() {
        return "ConflationResult{runId=" + runId +
                ", linkage=" + linkage +
                ", places=" + places.size() + '}';
    }
}
