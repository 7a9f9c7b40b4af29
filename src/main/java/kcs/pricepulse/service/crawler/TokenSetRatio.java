package kcs.pricepulse.service.crawler;

import java.util.Arrays;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set similarity on a 0-100 scale.
 * <p>
 * Both strings are lower-cased, punctuation becomes whitespace and the tokens are
 * de-duplicated and sorted. The shared tokens are compared against each side's full token
 * string with an LCS based ratio and the best of the three comparisons is returned. When
 * one side's tokens are a subset of the other's the score is 100.
 * </p>
 */
final class TokenSetRatio {

    private TokenSetRatio() {
    }

    static double score(String left, String right) {
        SortedSet<String> a = tokens(left);
        SortedSet<String> b = tokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }

        SortedSet<String> common = new TreeSet<>(a);
        common.retainAll(b);
        SortedSet<String> onlyA = new TreeSet<>(a);
        onlyA.removeAll(b);
        SortedSet<String> onlyB = new TreeSet<>(b);
        onlyB.removeAll(a);

        if (!common.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 100;
        }

        String shared = String.join(" ", common);
        String combinedA = join(shared, String.join(" ", onlyA));
        String combinedB = join(shared, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!shared.isEmpty()) {
            best = Math.max(best, ratio(shared, combinedA));
            best = Math.max(best, ratio(shared, combinedB));
        }
        return best;
    }

    static SortedSet<String> tokens(String text) {
        SortedSet<String> tokens = new TreeSet<>();
        if (text == null) {
            return tokens;
        }
        String folded = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
        if (!folded.isEmpty()) {
            tokens.addAll(Arrays.asList(folded.split(" ")));
        }
        return tokens;
    }

    /** Normalized indel similarity: 2 * LCS / (len1 + len2), scaled to 100. */
    static double ratio(String s1, String s2) {
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 100;
        }
        return 100.0 * 2 * longestCommonSubsequence(s1, s2) / total;
    }

    private static int longestCommonSubsequence(String s1, String s2) {
        int[] prev = new int[s2.length() + 1];
        int[] curr = new int[s2.length() + 1];
        for (int i = 1; i <= s1.length(); i++) {
            for (int j = 1; j <= s2.length(); j++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[s2.length()];
    }

    private static String join(String shared, String rest) {
        if (shared.isEmpty()) {
            return rest;
        }
        return rest.isEmpty() ? shared : shared + " " + rest;
    }
}
