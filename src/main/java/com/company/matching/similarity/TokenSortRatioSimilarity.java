package com.company.matching.similarity;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Token-order-invariant similarity.
 * Both strings are split on whitespace, their tokens sorted and re-joined with single spaces,
 * and the results compared with the normalized Indel ratio {@code 2 * LCS / (len1 + len2)}.
 *
 * <p>Comparison is case-sensitive; callers are expected to pass normalized names.</p>
 */
public class TokenSortRatioSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }

        String sorted1 = sortTokens(s1);
        String sorted2 = sortTokens(s2);

        int totalLength = sorted1.length() + sorted2.length();
        if (totalLength == 0) {
            return 1.0;
        }
        if (sorted1.equals(sorted2)) {
            return 1.0;
        }

        int lcs = longestCommonSubsequence(sorted1, sorted2);
        return (2.0 * lcs) / totalLength;
    }

    @Override
    public String getName() {
        return "TokenSortRatio";
    }

    /**
     * Sorts whitespace-separated tokens and re-joins them with a single space.
     */
    String sortTokens(String s) {
        String trimmed = s.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] tokens = WHITESPACE.split(trimmed);
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    /**
     * Length of the longest common subsequence, using two rolling rows.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        // Keep the shorter string on the row axis
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= s2.length(); j++) {
            char c2 = s2.charAt(j - 1);
            currentRow[0] = 0;
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c2) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(previousRow[i], currentRow[i - 1]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
