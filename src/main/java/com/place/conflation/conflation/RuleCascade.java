package com.place.conflation.conflation;

import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.RuleOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of rules for one attribute kind, evaluated with early exit.
 * The last rule must be {@link SourcePriorityRule}, so every evaluation ends in a decision.
 */
public class RuleCascade {

    private final AttributeKind attribute;
    private final List<ConflationRule> rules;

    public RuleCascade(AttributeKind attribute, List<ConflationRule> rules) {
        this.attribute = Objects.requireNonNull(attribute, "attribute is required");
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("A cascade needs at least one rule");
        }
        if (!(rules.get(rules.size() - 1) instanceof SourcePriorityRule)) {
            throw new IllegalArgumentException("The cascade for " + attribute + " must end with "
                    + SourcePriorityRule.NAME);
        }
        this.rules = List.copyOf(rules);
    }

    public AttributeKind getAttribute() {
        return attribute;
    }

    public List<String> getRuleNames() {
        return rules.stream().map(ConflationRule::getName).toList();
    }

    /**
     * Evaluates rules in order until one prefers a candidate.
     *
     * @return every evaluated rule with its outcome; the last entry is the deciding one
     */
    public List<RuleOutcome> evaluate(AttributeCandidate candidateA, AttributeCandidate candidateB) {
        List<RuleOutcome> trace = new ArrayList<>();
        for (ConflationRule rule : rules) {
            RuleOutcome outcome = new RuleOutcome(rule.getName(), rule.compare(candidateA, candidateB));
            trace.add(outcome);
            if (outcome.decided()) {
                break;
            }
        }
        return trace;
    }

    @Override
    public String toString() {
        return "RuleCascade{" + attribute + "=" + rules + '}';
    }
}
