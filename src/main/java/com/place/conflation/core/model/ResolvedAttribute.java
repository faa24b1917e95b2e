package com.place.conflation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Final decision for one attribute of one matched place.
 *
 * @param attribute             the attribute decided
 * @param status                whether a usable value survived
 * @param winningValue          the winner's raw value (trimmed), empty unless {@link ResolutionStatus#RESOLVED}
 * @param winningCanonicalValue the winner's normalized value, empty unless resolved
 * @param winningProvider       the provider whose value survived, {@code null} unless resolved
 * @param decisionTrace         rules evaluated in order; the last entry decided when resolved
 * @param auditNotes            degraded-metadata signals observed while deciding
 */
public record ResolvedAttribute(
        AttributeKind attribute,
        ResolutionStatus status,
        String winningValue,
        String winningCanonicalValue,
        Provider winningProvider,
        List<RuleOutcome> decisionTrace,
        List<String> auditNotes
) {
    public ResolvedAttribute {
        Objects.requireNonNull(attribute, "attribute is required");
        Objects.requireNonNull(status, "status is required");
        winningValue = winningValue != null ? winningValue : "";
        winningCanonicalValue = winningCanonicalValue != null ? winningCanonicalValue : "";
        decisionTrace = decisionTrace != null ? List.copyOf(decisionTrace) : List.of();
        auditNotes = auditNotes != null ? List.copyOf(auditNotes) : List.of();
        if (status == ResolutionStatus.RESOLVED && winningProvider == null) {
            throw new IllegalArgumentException("A resolved attribute needs a winning provider");
        }
    }

    public static ResolvedAttribute resolved(AttributeCandidate winner, List<RuleOutcome> trace,
                                             List<String> auditNotes) {
        return new ResolvedAttribute(winner.attribute(), ResolutionStatus.RESOLVED,
                winner.rawValue(), winner.value(), winner.sourceProvider(), trace, auditNotes);
    }

    public static ResolvedAttribute noUsableValue(AttributeKind attribute, List<RuleOutcome> trace,
                                                  List<String> auditNotes) {
        return new ResolvedAttribute(attribute, ResolutionStatus.NO_USABLE_VALUE,
                "", "", null, trace, auditNotes);
    }

    public static ResolvedAttribute unresolved(AttributeKind attribute) {
        return new ResolvedAttribute(attribute, ResolutionStatus.UNRESOLVED,
                "", "", null, List.of(), List.of());
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }

    /**
     * Returns the name of the rule that chose the winner, or {@code null} if nothing was chosen.
     */
    public String decidingRule() {
        if (!isResolved() || decisionTrace.isEmpty()) {
            return null;
        }
        return decisionTrace.get(decisionTrace.size() - 1).ruleName();
    }

    /**
     * Rule names in evaluation order.
     */
    public List<String> traceRuleNames() {
        return decisionTrace.stream().map(RuleOutcome::ruleName).toList();
    }
}
