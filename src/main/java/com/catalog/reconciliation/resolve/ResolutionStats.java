package com.catalog.reconciliation.resolve;

/**
 * Counters of one resolution run.
 *
 * @param itemsSeen      provider items processed
 * @param exactMatches   items attached by identical name key
 * @param fuzzyMatches   items attached by bigram similarity
 * @param canonicalItems canonical items created
 */
public record ResolutionStats(int itemsSeen, int exactMatches, int fuzzyMatches, int canonicalItems) {

    @Override
    public String toString() {
        return "ResolutionStats{items=" + itemsSeen +
                ", exact=" + exactMatches +
                ", fuzzy=" + fuzzyMatches +
                ", canonical=" + canonicalItems + '}';
    }
}
