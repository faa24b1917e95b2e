package com.place.conflation.similarity;

/**
 * Interface for similarity computation algorithms.
 * Implementations return a score between 0.0 (no similarity) and 100.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two normalized strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 100.0
     */
    double score(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
