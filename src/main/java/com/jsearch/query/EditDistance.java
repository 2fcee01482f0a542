package com.jsearch.query;

/**
 * Optimal string alignment distance: insertions, deletions, substitutions
 * and transpositions of adjacent characters all cost 1. Works on code
 * points.
 */
public final class EditDistance {
    private EditDistance() {
    }

    public static int distance(String a, String b) {
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        int[][] d = new int[s.length + 1][t.length + 1];
        for (int i = 0; i <= s.length; i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= t.length; j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= s.length; i++) {
            for (int j = 1; j <= t.length; j++) {
                int cost = s[i - 1] == t[j - 1] ? 0 : 1;
                int best = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && s[i - 1] == t[j - 2] && s[i - 2] == t[j - 1]) {
                    best = Math.min(best, d[i - 2][j - 2] + 1);
                }
                d[i][j] = best;
            }
        }
        return d[s.length][t.length];
    }

    /**
     * Cheaper check that skips terms whose length alone rules them out.
     */
    public static boolean withinDistance(String a, String b, int maxEdits) {
        int lengthA = a.codePointCount(0, a.length());
        int lengthB = b.codePointCount(0, b.length());
        if (Math.abs(lengthA - lengthB) > maxEdits) {
            return false;
        }
        return distance(a, b) <= maxEdits;
    }
}
