package com.legal.extraction.similarity;

/**
 * Edit-distance ratio: {@code 1 - distance / max(len1, len2)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int longest = Math.max(s1.length(), s2.length());
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(s1, s2) / longest;
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Two-row Wagner-Fischer; memory is linear in the shorter input.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] above = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < above.length; i++) {
            above[i] = i;
        }

        for (int row = 1; row <= longer.length(); row++) {
            current[0] = row;
            char c = longer.charAt(row - 1);
            for (int col = 1; col <= shorter.length(); col++) {
                int substitution = above[col - 1] + (shorter.charAt(col - 1) == c ? 0 : 1);
                int insertion = current[col - 1] + 1;
                int deletion = above[col] + 1;
                current[col] = Math.min(substitution, Math.min(insertion, deletion));
            }
            int[] swap = above;
            above = current;
            current = swap;
        }
        return above[shorter.length()];
    }
}
