package com.example.AlignAi.util;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

/**
 * Normalized indel similarity on a 0-100 scale: {@code 200 * lcs / (len(a) + len(b))}.
 */
public final class FuzzyRatio {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private FuzzyRatio() {}

    public static double ratio(String a, String b) {
        if (a == null || b == null) return 0.0;
        int total = a.length() + b.length();
        if (total == 0) return 100.0;
        int common = LCS.apply(a, b);
        return 200.0 * common / total;
    }
}
