package com.place.conflation.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Order-independent token-set similarity on a 0–100 scale.
 *
 * <p>Both strings are split into sorted token sets. With {@code sect} the shared tokens and
 * {@code diffAB}/{@code diffBA} the tokens unique to each side, the score is the best indel
 * ratio among {@code sect} vs {@code sect+diffAB}, {@code sect} vs {@code sect+diffBA} and
 * {@code sect+diffAB} vs {@code sect+diffBA}. When one side's tokens are a subset of the other's
 * the score is 100.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    @Override
    public double score(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }

        TreeSet<String> tokens1 = tokenize(s1);
        TreeSet<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        List<String> intersection = new ArrayList<>();
        List<String> diff1 = new ArrayList<>();
        List<String> diff2 = new ArrayList<>();
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersection.add(token);
            } else {
                diff1.add(token);
            }
        }
        for (String token : tokens2) {
            if (!tokens1.contains(token)) {
                diff2.add(token);
            }
        }

        if (!intersection.isEmpty() && (diff1.isEmpty() || diff2.isEmpty())) {
            return 100.0;
        }

        String sect = String.join(" ", intersection);
        String combined1 = join(sect, String.join(" ", diff1));
        String combined2 = join(sect, String.join(" ", diff2));

        double best = ratio(combined1, combined2);
        if (!sect.isEmpty()) {
            best = Math.max(best, ratio(sect, combined1));
            best = Math.max(best, ratio(sect, combined2));
        }
        return best;
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    /**
     * Normalized indel similarity: {@code 100 * 2 * LCS / (|a| + |b|)}.
     */
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 100.0 * (2 * longestCommonSubsequence(a, b)) / total;
    }

    /**
     * LCS length with two rolling rows, O(min(m,n)) space.
     */
    private static int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }

    private static String join(String sect, String diff) {
        if (sect.isEmpty()) {
            return diff;
        }
        if (diff.isEmpty()) {
            return sect;
        }
        return sect + " " + diff;
    }

    private static TreeSet<String> tokenize(String s) {
        TreeSet<String> tokens = new TreeSet<>();
        for (String token : s.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
