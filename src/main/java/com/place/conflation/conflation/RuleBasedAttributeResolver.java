package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolvedAttribute;
import com.place.conflation.core.model.RuleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AttributeResolver} driven by a {@link RuleCascade}.
 *
 * <ul>
 *   <li>Neither provider supplied the attribute: {@code UNRESOLVED}.</li>
 *   <li>Supplied, but no usable value on either side: {@code NO_USABLE_VALUE}.</li>
 *   <li>Otherwise the cascade decides and the winner is {@code RESOLVED}.</li>
 * </ul>
 */
public class RuleBasedAttributeResolver implements AttributeResolver {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedAttributeResolver.class);

    private final RuleCascade cascade;

    public RuleBasedAttributeResolver(RuleCascade cascade) {
        this.cascade = cascade;
    }

    @Override
    public ResolvedAttribute resolve(CandidateSet candidates) {
        if (candidates.bothMissing()) {
            return ResolvedAttribute.unresolved(candidates.attribute());
        }

        AttributeCandidate candidateA = candidates.getOrAbsent(Provider.PROVIDER_A);
        AttributeCandidate candidateB = candidates.getOrAbsent(Provider.PROVIDER_B);
        List<String> notes = new ArrayList<>();
        for (AttributeCandidate candidate : List.of(candidateA, candidateB)) {
            if (candidate.confidenceMalformed()) {
                notes.add(malformedConfidenceNote(candidate.sourceProvider()));
            }
        }

        if (!candidates.anyUsable()) {
            notes.add("no usable value from either provider");
            log.debug("resolve.noUsableValue attribute={}", candidates.attribute());
            return ResolvedAttribute.noUsableValue(candidates.attribute(), List.of(), notes);
        }

        List<RuleOutcome> trace = cascade.evaluate(candidateA, candidateB);
        RuleOutcome deciding = trace.get(trace.size() - 1);
        AttributeCandidate winner = candidates.getOrAbsent(deciding.preference().winner());
        log.debug("resolve.decided attribute={} winner={} rule={}",
                candidates.attribute(), winner.sourceProvider(), deciding.ruleName());
        return ResolvedAttribute.resolved(winner, trace, notes);
    }

    static String malformedConfidenceNote(Provider provider) {
        return "malformed confidence from " + provider.getLabel() + " treated as absent";
    }
}
