package org.argverify.core;

/**
 * Optimal-string-alignment variant of the Damerau-Levenshtein distance.
 */
public final class TextDistance {

    private TextDistance() {}

    public static int damerauLevenshtein(String a, String b) {
        int n = a.length();
        int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;
        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                int v = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
                    v = Math.min(v, d[i - 2][j - 2] + 1);
                }
                d[i][j] = v;
            }
        }
        return d[n][m];
    }

    /** Distance relative to the longer string; 0 for two empty strings. */
    public static double normalized(String a, String b) {
        int max = Math.max(a.length(), b.length());
        return max == 0 ? 0.0 : (double) damerauLevenshtein(a, b) / max;
    }
}
