package com.catalog.reconciliation.resolve;

import com.catalog.reconciliation.core.model.CanonicalItem;
import com.catalog.reconciliation.core.model.DiffReport;
import com.catalog.reconciliation.core.model.MatchDetail;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.SourceItem;
import com.catalog.reconciliation.diff.DiffEngine;
import com.catalog.reconciliation.similarity.BigramDiceSimilarity;
import com.catalog.reconciliation.similarity.NameKeys;
import com.catalog.reconciliation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves normalized provider items into canonical items.
 *
 * <p>Providers are processed strictly in the given order and items in list order. Each item
 * is attached to an existing canonical item or seeds a new one:</p>
 * <ol>
 *   <li><b>Exact</b>: the first canonical item with the same name key that has no entry
 *       for this provider yet (confidence 1).</li>
 *   <li><b>Fuzzy</b>: for non-id keys only, the canonical item with the highest bigram
 *       similarity among those lacking this provider and not carrying an id-key. Ties keep
 *       the earliest candidate. Accepted when the score reaches the threshold.</li>
 *   <li><b>New</b>: otherwise a new canonical item is created and its key indexed.</li>
 * </ol>
 * A canonical item never holds two entries of the same provider.
 *
 * <p>Fuzzy fallback scans every canonical item, so a run is O(n²) in the worst case.
 * Resolution is synchronous and runs on the caller's thread; instances are stateless
 * between runs.</p>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private static final Comparator<CanonicalItem> BY_SEVERITY_THEN_NAME =
            Comparator.<CanonicalItem>comparingInt(item -> item.diffReport().severity()).reversed()
                    .thenComparing(CanonicalItem::displayName, String.CASE_INSENSITIVE_ORDER);

    private final SimilarityAlgorithm similarity;
    private final DiffEngine diffEngine;

    public EntityResolver() {
        this(new BigramDiceSimilarity(), new DiffEngine());
    }

    public EntityResolver(SimilarityAlgorithm similarity, DiffEngine diffEngine) {
        this.similarity = similarity;
        this.diffEngine = diffEngine;
    }

    /**
     * Resolves all items and returns canonical items with diff reports, sorted by descending
     * severity and then by display name, case-insensitively.
     *
     * @param normalizedBySource items per provider; providers absent from the map contribute nothing
     * @param activeProviders    processing order, also the set of providers the diff is computed against
     * @param fuzzyThreshold     minimum similarity for a fuzzy match
     */
    public List<CanonicalItem> resolve(Map<Provider, List<SourceItem>> normalizedBySource,
                                       List<Provider> activeProviders,
                                       double fuzzyThreshold) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, List<Integer>> nameIndex = new HashMap<>();
        int itemsSeen = 0;
        int exactMatches = 0;
        int fuzzyMatches = 0;

        for (Provider provider : activeProviders) {
            List<SourceItem> items = normalizedBySource.getOrDefault(provider, List.of());

            for (int itemIndex = 0; itemIndex < items.size(); itemIndex++) {
                SourceItem item = items.get(itemIndex);
                String nameKey = NameKeys.nameKey(item, itemIndex);
                itemsSeen++;

                Candidate exact = findExact(candidates, nameIndex, nameKey, provider);
                if (exact != null) {
                    exact.attach(provider, item, MatchDetail.exact());
                    exactMatches++;
                    continue;
                }

                if (!NameKeys.isIdKey(nameKey)) {
                    Candidate best = null;
                    double bestScore = 0.0;
                    for (Candidate candidate : candidates) {
                        if (candidate.bySource.containsKey(provider) || NameKeys.isIdKey(candidate.nameKey)) {
                            continue;
                        }
                        double score = similarity.compute(nameKey, candidate.nameKey);
                        if (score > bestScore) {
                            bestScore = score;
                            best = candidate;
                        }
                    }
                    if (best != null && bestScore >= fuzzyThreshold) {
                        best.attach(provider, item, MatchDetail.fuzzy(roundConfidence(bestScore)));
                        fuzzyMatches++;
                        log.debug("resolve.fuzzy provider={} key='{}' matched='{}' score={}",
                                provider, nameKey, best.nameKey, bestScore);
                        continue;
                    }
                }

                Candidate created = new Candidate("canonical-" + (candidates.size() + 1), nameKey,
                        seedDisplayName(item, itemIndex));
                created.attach(provider, item, MatchDetail.exact());
                candidates.add(created);
                nameIndex.computeIfAbsent(nameKey, k -> new ArrayList<>()).add(candidates.size() - 1);
            }
        }

        List<CanonicalItem> result = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            CanonicalItem item = candidate.toCanonicalItem(preferredDisplayName(candidate, activeProviders));
            result.add(item.withDiffReport(diffEngine.diff(item, activeProviders)));
        }
        result.sort(BY_SEVERITY_THEN_NAME);

        ResolutionStats stats = new ResolutionStats(itemsSeen, exactMatches, fuzzyMatches, candidates.size());
        log.info("resolve.completed providers={} stats={}", activeProviders, stats);
        return result;
    }

    private static Candidate findExact(List<Candidate> candidates, Map<String, List<Integer>> nameIndex,
                                       String nameKey, Provider provider) {
        List<Integer> indexes = nameIndex.get(nameKey);
        if (indexes == null) {
            return null;
        }
        for (int index : indexes) {
            Candidate candidate = candidates.get(index);
            if (!candidate.bySource.containsKey(provider)) {
                return candidate;
            }
        }
        return null;
    }

    private static String preferredDisplayName(Candidate candidate, List<Provider> activeProviders) {
        for (Provider provider : activeProviders) {
            SourceItem source = candidate.bySource.get(provider);
            if (source != null && source.name() != null && !source.name().isEmpty()) {
                return source.name();
            }
        }
        return candidate.displayName;
    }

    private static String seedDisplayName(SourceItem item, int index) {
        if (item.name() != null) {
            return item.name();
        }
        if (item.sourceItemId() != null) {
            return item.sourceItemId();
        }
        return item.sourceId().id() + "-item-" + index;
    }

    private static double roundConfidence(double score) {
        return Math.round(score * 1000) / 1000.0;
    }

    /**
     * Mutable canonical item under construction.
     */
    private static final class Candidate {
        private final String canonicalId;
        private final String nameKey;
        private final String displayName;
        private final Map<Provider, SourceItem> bySource = new EnumMap<>(Provider.class);
        private final Map<Provider, MatchDetail> matchDetails = new EnumMap<>(Provider.class);

        private Candidate(String canonicalId, String nameKey, String displayName) {
            this.canonicalId = canonicalId;
            this.nameKey = nameKey;
            this.displayName = displayName;
        }

        private void attach(Provider provider, SourceItem item, MatchDetail detail) {
            if (bySource.putIfAbsent(provider, item) != null) {
                throw new IllegalStateException(canonicalId + " already holds an entry of " + provider);
            }
            matchDetails.put(provider, detail);
        }

        private CanonicalItem toCanonicalItem(String resolvedDisplayName) {
            return new CanonicalItem(canonicalId, nameKey, resolvedDisplayName, bySource, matchDetails,
                    DiffReport.empty());
        }
    }
}
