package com.place.conflation.rules;

import com.place.conflation.core.model.AttributeKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One regex rewrite of the normalizer, run after case folding.
 * Lower priorities run first; a rule without attribute kinds runs for every kind.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<AttributeKind> kinds;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern);
        this.replacement = builder.replacement;
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(builder.kinds));
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public boolean appliesTo(AttributeKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    /**
     * Rewrites every match in an already case-folded value.
     */
    public String apply(String folded) {
        if (folded.isEmpty()) {
            return folded;
        }
        return pattern.matcher(folded).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "@" + priority + (kinds.isEmpty() ? "" : kinds.toString());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private final Set<AttributeKind> kinds = EnumSet.noneOf(AttributeKind.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableKinds(AttributeKind... kinds) {
            this.kinds.addAll(Set.of(kinds));
            return this;
        }

        public Builder priority(int priority) {
            if (priority < 0) {
                throw new IllegalArgumentException("priority must not be negative");
            }
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
