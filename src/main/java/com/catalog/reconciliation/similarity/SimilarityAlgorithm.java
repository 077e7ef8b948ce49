package com.catalog.reconciliation.similarity;

/**
 * Interface for name similarity algorithms.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two normalized name keys.
     *
     * @param s1 first key
     * @param s2 second key
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
