package com.catalog.reconciliation.similarity;

import java.util.HashMap;
import java.util.Map;

/**
 * Sørensen–Dice coefficient over character bigrams.
 *
 * <p>Each string is padded with one space on both sides before splitting into 2-grams, so
 * word boundaries contribute their own bigrams. The intersection is a multiset intersection:
 * a bigram occurring twice on one side and once on the other counts once.</p>
 *
 * <pre>
 * score = 2 * |A ∩ B| / (|A| + |B|)
 * </pre>
 */
public class BigramDiceSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        String left = " " + s1 + " ";
        String right = " " + s2 + " ";
        int leftCount = left.length() - 1;
        int rightCount = right.length() - 1;

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < leftCount; i++) {
            counts.merge(left.substring(i, i + 2), 1, Integer::sum);
        }

        int overlap = 0;
        for (int i = 0; i < rightCount; i++) {
            String bigram = right.substring(i, i + 2);
            Integer remaining = counts.get(bigram);
            if (remaining != null && remaining > 0) {
                overlap++;
                counts.put(bigram, remaining - 1);
            }
        }

        return (2.0 * overlap) / (leftCount + rightCount);
    }

    @Override
    public String getName() {
        return "BigramDice";
    }
}
