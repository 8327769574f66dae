package com.financeforge.reconciliation;

import java.util.Locale;

/**
 * Normalized Levenshtein similarity between account names.
 */
final class NameSimilarity {

    private NameSimilarity() {
    }

    /**
     * Lower-cases, turns punctuation into spaces and collapses whitespace.
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
    }

    /**
     * 1 - distance / longer length, over normalized names. Two empty names score 1.
     */
    static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        int longer = Math.max(left.length(), right.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) distance(left, right) / longer;
    }

    static int distance(String a, String b) {
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
