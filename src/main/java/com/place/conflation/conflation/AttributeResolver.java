package com.place.conflation.conflation;

import com.place.conflation.core.model.ResolvedAttribute;

/**
 * Chooses the surviving value for one attribute of one matched place.
 * Implementations must be deterministic and must not throw on malformed candidates.
 */
public interface AttributeResolver {

    ResolvedAttribute resolve(CandidateSet candidates);
}
