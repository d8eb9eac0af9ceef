package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.FuzzyMatch;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Tolerant matching of free text against a known vocabulary (catalog names, service labels).
 * <p>
 * Similarity is the matching-blocks ratio {@code 2 * M / T}, where {@code M} is the number of characters in the
 * longest common blocks found recursively and {@code T} the combined length of both normalized, lower-cased
 * strings. Equal strings score 1.0, strings sharing no character score 0.0.
 * <p>
 * Every character takes part in matching regardless of input length. There is no "autojunk" rule that
 * ignores characters occurring in more than one percent of a string of 200 or more characters, so long
 * repetitive inputs score by their actual common blocks.
 */
@Component
public class FuzzySimilarityMatcher {

    /**
     * Finds the most similar candidate. Ties keep the earlier candidate.
     *
     * @param query      text to match
     * @param candidates vocabulary in preference order
     * @return best candidate and its score, or {@link FuzzyMatch#none()} when nothing scores above zero
     */
    public FuzzyMatch bestMatch(String query, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return FuzzyMatch.none();
        }
        String normalizedQuery = normalize(query);
        String best = null;
        double bestScore = 0.0;
        for (String candidate : candidates) {
            double score = ratio(normalizedQuery, normalize(candidate));
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best == null ? FuzzyMatch.none() : new FuzzyMatch(best, bestScore);
    }

    /**
     * @param left  first string
     * @param right second string
     * @return similarity of the normalized, lower-cased strings in {@code [0, 1]}
     */
    public double similarity(String left, String right) {
        return ratio(normalize(left), normalize(right));
    }

    private static String normalize(String value) {
        return TextNormalizer.normalize(value).toLowerCase(Locale.ROOT);
    }

    private static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Sums the sizes of the matching blocks: take the longest common block, then recurse on the
     * pieces left and right of it.
     */
    private static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];
            int[] block = longestMatch(a, aLow, aHigh, b, bLow, bHigh);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int i = block[0];
            int j = block[1];
            if (aLow < i && bLow < j) {
                pending.push(new int[]{aLow, i, bLow, j});
            }
            if (i + size < aHigh && j + size < bHigh) {
                pending.push(new int[]{i + size, aHigh, j + size, bHigh});
            }
        }
        return matched;
    }

    /**
     * Longest common block of {@code a[aLow, aHigh)} and {@code b[bLow, bHigh)}; among equally long blocks
     * the one starting earliest in {@code a}, then earliest in {@code b}.
     *
     * @return {start in a, start in b, size}
     */
    private static int[] longestMatch(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        int[] previous = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            int[] current = new int[bHigh - bLow + 1];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) != b.charAt(j)) {
                    continue;
                }
                int k = previous[j - bLow] + 1;
                current[j - bLow + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
