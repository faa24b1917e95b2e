package com.place.conflation.similarity;

import com.place.conflation.core.model.PlaceRecord;

import java.util.Set;

/**
 * Strategy interface for partitioning normalized records into buckets before fuzzy scoring.
 * Two records are scored against each other only if they share at least one key.
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking keys for a normalized record.
     *
     * @param record a record whose normalized attributes are populated
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(PlaceRecord record);

    /**
     * A single bucket holding every record: the unblocked full scan, and the default.
     */
    BlockingKeyStrategy NONE = record -> Set.of("all");
}
