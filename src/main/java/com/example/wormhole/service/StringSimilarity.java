package com.example.wormhole.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized Levenshtein similarity used to compare display names and video titles.
 * <p>
 * Similarity is {@code 1 - distance / max(len1, len2)}: 1.0 for identical strings,
 * 0.0 when one side is empty and the other is not.
 */
public final class StringSimilarity {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-\\s]");

    /** Generic suffix tokens carrying no identity ("频道" = channel). */
    private static final Pattern GENERIC_TOKENS =
            Pattern.compile("official|频道|channel", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private StringSimilarity() {
        // utility class
    }

    /**
     * Normalizes a display name: lowercase, drop separators, drop generic tokens.
     * {@code "Test_User-Official Channel"} becomes {@code "testuser"}.
     */
    public static String normalize(String name) {
        if (name == null) return "";
        String lowered = name.toLowerCase(Locale.ROOT);
        String compact = SEPARATORS.matcher(lowered).replaceAll("");
        return GENERIC_TOKENS.matcher(compact).replaceAll("");
    }

    /**
     * Similarity of two display names after {@link #normalize(String)}.
     */
    public static double nameSimilarity(String a, String b) {
        return similarity(normalize(a), normalize(b));
    }

    /**
     * Normalized Levenshtein similarity in [0, 1]. Symmetric.
     */
    public static double similarity(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.equals(right)) return 1.0;
        int maxLen = Math.max(left.length(), right.length());
        if (maxLen == 0) return 1.0;
        if (left.isEmpty() || right.isEmpty()) return 0.0;

        int distance = levenshteinDistance(left, right);
        return 1.0 - ((double) distance / maxLen);
    }

    /**
     * Classic edit distance (insert/delete/substitute cost 1), O(min(m,n)) space.
     */
    static int levenshteinDistance(String a, String b) {
        if (a.length() > b.length()) { String t = a; a = b; b = t; }

        int[] prev = new int[a.length() + 1];
        int[] curr = new int[a.length() + 1];

        for (int i = 0; i <= a.length(); i++) prev[i] = i;

        for (int j = 1; j <= b.length(); j++) {
            curr[0] = j;
            for (int i = 1; i <= a.length(); i++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[i] = Math.min(Math.min(curr[i - 1] + 1, prev[i] + 1), prev[i - 1] + cost);
            }
            int[] temp = prev; prev = curr; curr = temp;
        }

        return prev[a.length()];
    }
}
