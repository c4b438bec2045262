package io.github.jbellis.smartmatch.similarity;

/**
 * Levenshtein edit distance over Unicode code points, unit cost for insertion, deletion and substitution.
 */
public final class Levenshtein {
    private Levenshtein() {
    }

    public static int distance(String a, String b) {
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        if (s.length == 0) {
            return t.length;
        }
        if (t.length == 0) {
            return s.length;
        }

        // keep the shorter sequence in the rows
        if (s.length > t.length) {
            int[] tmp = s;
            s = t;
            t = tmp;
        }

        int[] previous = new int[s.length + 1];
        int[] current = new int[s.length + 1];
        for (int i = 0; i <= s.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= t.length; j++) {
            current[0] = j;
            for (int i = 1; i <= s.length; i++) {
                int cost = s[i - 1] == t[j - 1] ? 0 : 1;
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1),
                                      previous[i - 1] + cost);
            }
            int[] tmp = previous;
            previous = current;
            current = tmp;
        }
        return previous[s.length];
    }

    /**
     * {@code 1 - distance / max(length)}, in [0, 1]. Two empty strings are identical and score 1.
     */
    public static double similarity(String a, String b) {
        int maxLength = Math.max(a.codePointCount(0, a.length()), b.codePointCount(0, b.length()));
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) distance(a, b) / maxLength;
    }
}
