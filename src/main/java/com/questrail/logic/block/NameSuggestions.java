package com.questrail.logic.block;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * "Did you mean" suggestions for mistyped names.
 */
public final class NameSuggestions
{
    private static final double CUTOFF = 0.6;

    private NameSuggestions()
    {
    }

    /**
     * Returns up to {@code limit} candidates similar to {@code word}, best match first.
     */
    public static List<String> closeMatches(String word, Collection<String> candidates, int limit)
    {
        record Scored(String name, double score) {}
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            double score = similarity(word, candidate);
            if (score >= CUTOFF) {
                scored.add(new Scored(candidate, score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::name));
        List<String> result = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < limit; i++) {
            result.add(scored.get(i).name());
        }
        return result;
    }

    /**
     * Similarity ratio in [0, 1]: twice the longest common subsequence length
     * divided by the total length.
     */
    static double similarity(String a, String b)
    {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int[][] lcs = new int[a.length() + 1][b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                lcs[i][j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? lcs[i - 1][j - 1] + 1
                        : Math.max(lcs[i - 1][j], lcs[i][j - 1]);
            }
        }
        return 2.0 * lcs[a.length()][b.length()] / total;
    }
}
