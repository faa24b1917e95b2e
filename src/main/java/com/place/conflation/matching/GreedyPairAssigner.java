package com.place.conflation.matching;

import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves many-to-many fuzzy candidates into a one-to-one assignment.
 * Candidates are walked in {@link FuzzyCandidate#ASSIGNMENT_ORDER}; a candidate is accepted only
 * if neither of its records has been taken by an earlier one.
 */
public class GreedyPairAssigner {

    public List<MatchedPair> assign(Collection<FuzzyCandidate> candidates) {
        List<FuzzyCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(FuzzyCandidate.ASSIGNMENT_ORDER);

        Set<PlaceRecord> consumed = new HashSet<>();
        List<MatchedPair> accepted = new ArrayList<>();
        for (FuzzyCandidate candidate : ordered) {
            if (consumed.contains(candidate.recordA()) || consumed.contains(candidate.recordB())) {
                continue;
            }
            consumed.add(candidate.recordA());
            consumed.add(candidate.recordB());
            accepted.add(MatchedPair.fuzzy(candidate.recordA(), candidate.recordB(),
                    candidate.nameSimilarity(), candidate.addressSimilarity()));
        }
        return accepted;
    }
}
