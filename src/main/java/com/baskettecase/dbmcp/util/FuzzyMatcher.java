package com.baskettecase.dbmcp.util;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * "Did you mean?" suggestions for misspelled table and schema names, ranked by Levenshtein similarity.
 */
public final class FuzzyMatcher {

    public static final int MAX_SUGGESTIONS = 3;

    // 0.0 = nothing in common, 1.0 = identical
    private static final double SIMILARITY_THRESHOLD = 0.4;

    private FuzzyMatcher() {
    }

    /**
     * Candidates at least 40% similar to the input (case-insensitive), best first, at most {@link #MAX_SUGGESTIONS}.
     */
    public static List<String> suggestions(String input, List<String> candidates) {
        if (input == null || input.isEmpty() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        String needle = input.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .filter(candidate -> similarity(needle, candidate.toLowerCase(Locale.ROOT)) >= SIMILARITY_THRESHOLD)
                .sorted(Comparator.comparingDouble(
                        (String candidate) -> similarity(needle, candidate.toLowerCase(Locale.ROOT))).reversed())
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) editDistance(a, b) / longest;
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
