package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.metrics.NoOpMetricsService;
import com.place.conflation.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds per-attribute candidate sets from a matched pair.
 *
 * <p>Provider confidence is parsed here. Values that are not numbers, or fall outside
 * {@code [0, 1]}, are treated as absent and flagged on the candidate.</p>
 */
public class CandidateAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandidateAggregator.class);

    private final TextNormalizer normalizer;
    private final MetricsService metrics;

    public CandidateAggregator(TextNormalizer normalizer) {
        this(normalizer, new NoOpMetricsService());
    }

    public CandidateAggregator(TextNormalizer normalizer, MetricsService metrics) {
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    /**
     * Returns one candidate set per attribute kind.
     */
    public Map<AttributeKind, CandidateSet> aggregate(MatchedPair pair) {
        ParsedConfidence confidenceA = parseConfidence(pair.recordA());
        ParsedConfidence confidenceB = parseConfidence(pair.recordB());

        Map<AttributeKind, CandidateSet> sets = new EnumMap<>(AttributeKind.class);
        for (AttributeKind kind : AttributeKind.values()) {
            sets.put(kind, new CandidateSet(kind,
                    candidate(pair.recordA(), kind, confidenceA),
                    candidate(pair.recordB(), kind, confidenceB)));
        }
        return sets;
    }

    private AttributeCandidate candidate(PlaceRecord record, AttributeKind kind, ParsedConfidence confidence) {
        if (!record.hasAttribute(kind)) {
            return null;
        }
        String raw = record.rawValue(kind);
        String value = record.getNormalizedAttributes().containsKey(kind)
                ? record.normalized(kind)
                : normalizer.normalize(raw, kind);
        boolean isName = kind == AttributeKind.NAME;
        return new AttributeCandidate(kind, value, raw, record.getProvider(),
                confidence.value(), confidence.malformed(),
                isName && normalizer.isCanonicalBrand(raw),
                isName && normalizer.hasBusinessSuffix(raw),
                tokenCount(raw));
    }

    private ParsedConfidence parseConfidence(PlaceRecord record) {
        String raw = record.getConfidence();
        if (raw == null || raw.isBlank()) {
            return ParsedConfidence.ABSENT;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isFinite(value) && value >= 0.0 && value <= 1.0) {
                return new ParsedConfidence(value, false);
            }
        } catch (NumberFormatException e) {
            log.debug("Unparseable confidence '{}': {}", raw, e.getMessage());
        }
        log.warn("dataQuality.malformedConfidence provider={} recordId={} value='{}'",
                record.getProvider(), record.getRecordId(), raw);
        metrics.incrementMalformedConfidence(record.getProvider());
        return ParsedConfidence.MALFORMED;
    }

    static int tokenCount(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        return raw.trim().split("\\s+").length;
    }

    private record ParsedConfidence(Double value, boolean malformed) {
        static final ParsedConfidence ABSENT = new ParsedConfidence(null, false);
        static final ParsedConfidence MALFORMED = new ParsedConfidence(null, true);
    }
}
