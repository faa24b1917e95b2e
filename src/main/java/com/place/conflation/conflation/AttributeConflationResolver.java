package com.place.conflation.conflation;

import com.place.conflation.api.ConflationOptions;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ConflatedPlace;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.Provider;
import com.place.conflation.core.model.ResolvedAttribute;
import com.place.conflation.logging.LogContext;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Produces the conflated view of matched places, one {@link AttributeResolver} per attribute kind.
 * Resolvers can be replaced per attribute, e.g. by a trained model.
 */
public class AttributeConflationResolver {
    private static final Logger log = LoggerFactory.getLogger(AttributeConflationResolver.class);

    private final CandidateAggregator aggregator;
    private final Map<AttributeKind, AttributeResolver> resolvers;
    private final List<Provider> providerPriority;
    private final MetricsService metrics;

    public AttributeConflationResolver(CandidateAggregator aggregator,
                                       Map<AttributeKind, AttributeResolver> resolvers,
                                       List<Provider> providerPriority,
                                       MetricsService metrics) {
        for (AttributeKind kind : AttributeKind.values()) {
            if (!resolvers.containsKey(kind)) {
                throw new IllegalArgumentException("No resolver for attribute " + kind);
            }
        }
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.resolvers = new EnumMap<>(resolvers);
        this.providerPriority = List.copyOf(providerPriority);
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Creates a resolver using the default rule cascades for the given options.
     */
    public static AttributeConflationResolver ruleBased(ConflationOptions options, CandidateAggregator aggregator,
                                                        MetricsService metrics) {
        Map<AttributeKind, AttributeResolver> resolvers = new EnumMap<>(AttributeKind.class);
        ConflationRules.defaultCascades(options)
                .forEach((kind, cascade) -> resolvers.put(kind, new RuleBasedAttributeResolver(cascade)));
        return new AttributeConflationResolver(aggregator, resolvers, options.getProviderPriority(), metrics);
    }

    /**
     * Returns a copy that uses {@code resolver} for {@code kind}.
     */
    public AttributeConflationResolver withResolver(AttributeKind kind, AttributeResolver resolver) {
        Map<AttributeKind, AttributeResolver> replaced = new EnumMap<>(resolvers);
        replaced.put(kind, Objects.requireNonNull(resolver, "resolver is required"));
        return new AttributeConflationResolver(aggregator, replaced, providerPriority, metrics);
    }

    public AttributeResolver getResolver(AttributeKind kind) {
        return resolvers.get(kind);
    }

    public ConflatedPlace conflate(MatchedPair pair) {
        try (LogContext ctx = LogContext.forPlace(pair.placeKey())) {
            Map<AttributeKind, CandidateSet> candidates = aggregator.aggregate(pair);
            Map<AttributeKind, ResolvedAttribute> decisions = new EnumMap<>(AttributeKind.class);
            for (AttributeKind kind : AttributeKind.values()) {
                ResolvedAttribute decision = resolvers.get(kind).resolve(candidates.get(kind));
                if (decision == null || decision.attribute() != kind) {
                    throw new IllegalStateException("Resolver for " + kind + " returned " + decision);
                }
                decisions.put(kind, decision);
                metrics.incrementAttributeDecision(kind, decision.status(), decision.winningProvider());
            }
            ConflatedPlace place = new ConflatedPlace(pair, decisions, bestSource(decisions));
            log.debug("conflate.place.completed bestSource={}", place.bestSource());
            return place;
        }
    }

    public List<ConflatedPlace> conflateAll(List<MatchedPair> pairs) {
        List<ConflatedPlace> places = new ArrayList<>(pairs.size());
        for (MatchedPair pair : pairs) {
            places.add(conflate(pair));
        }
        log.info("conflate.completed places={}", places.size());
        return places;
    }

    /**
     * The provider that won the most attributes; ties go to the higher-priority provider.
     */
    Provider bestSource(Map<AttributeKind, ResolvedAttribute> decisions) {
        Map<Provider, Integer> wins = new EnumMap<>(Provider.class);
        for (ResolvedAttribute decision : decisions.values()) {
            if (decision.isResolved()) {
                wins.merge(decision.winningProvider(), 1, Integer::sum);
            }
        }
        Provider best = providerPriority.get(0);
        for (Provider provider : providerPriority) {
            if (wins.getOrDefault(provider, 0) > wins.getOrDefault(best, 0)) {
                best = provider;
            }
        }
        return best;
    }
}
