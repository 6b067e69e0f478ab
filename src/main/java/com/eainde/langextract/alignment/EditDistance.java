package com.eainde.langextract.alignment;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Edit-distance primitives used by approximate alignment.
 */
final class EditDistance {

    /** How many source columns are scanned between two stop checks. */
    private static final int CHECK_INTERVAL = 256;

    private EditDistance() {
    }

    /**
     * Classic Levenshtein distance with unit costs.
     */
    static int levenshtein(CharSequence a, CharSequence b) {
        int n = a.length();
        int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= n; i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[m];
    }

    /**
     * Approximate substring search (Sellers): for every end position in
     * {@code source[from, to)} reports the best-matching substring ending there whose
     * distance to {@code pattern} is at most {@code maxDistance}.
     *
     * <p>The pattern may start anywhere at no cost; the start of each match is carried
     * through the DP alongside the cost, preferring the diagonal on ties.</p>
     *
     * @param stop     polled periodically; when it returns true the scan ends early
     * @param onMatch  receives each candidate in source order
     * @return false if the scan was stopped before reaching {@code to}
     */
    static boolean search(String pattern, String source, int from, int to, int maxDistance,
                          BooleanSupplier stop, Consumer<AlignmentCandidate> onMatch) {
        int m = pattern.length();
        if (m == 0 || from >= to) {
            return true;
        }
        int[] cost = new int[m + 1];
        int[] start = new int[m + 1];
        int[] nextCost = new int[m + 1];
        int[] nextStart = new int[m + 1];

        // Column before the first source char: matching i pattern chars against nothing.
        for (int i = 0; i <= m; i++) {
            cost[i] = i;
            start[i] = from;
        }

        for (int j = from; j < to; j++) {
            if ((j - from) % CHECK_INTERVAL == 0 && stop.getAsBoolean()) {
                return false;
            }
            char sc = source.charAt(j);
            nextCost[0] = 0;
            nextStart[0] = j + 1;
            for (int i = 1; i <= m; i++) {
                int diagonal = cost[i - 1] + (pattern.charAt(i - 1) == sc ? 0 : 1);
                int skipSource = cost[i] + 1;
                int skipPattern = nextCost[i - 1] + 1;

                int best = diagonal;
                int bestStart = start[i - 1];
                if (skipSource < best) {
                    best = skipSource;
                    bestStart = start[i];
                }
                if (skipPattern < best) {
                    best = skipPattern;
                    bestStart = nextStart[i - 1];
                }
                nextCost[i] = best;
                nextStart[i] = bestStart;
            }

            if (nextCost[m] <= maxDistance && j + 1 > nextStart[m]) {
                onMatch.accept(new AlignmentCandidate(nextStart[m], j + 1, nextCost[m]));
            }

            int[] tmp = cost;
            cost = nextCost;
            nextCost = tmp;
            tmp = start;
            start = nextStart;
            nextStart = tmp;
        }
        return true;
    }
}
