package com.componentwatch.monitor.match;

import java.text.Normalizer;
import java.util.Locale;

public final class TextNormalizer {
    private TextNormalizer() {
    }

    /**
     * Compatibility-decomposes the text, drops every non-ASCII code point (accents included) and
     * lowercases what is left. {@code null} yields an empty string.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        StringBuilder ascii = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char c = decomposed.charAt(i);
            if (c <= 0x7F) {
                ascii.append(c);
            }
        }
        return ascii.toString().toLowerCase(Locale.ROOT);
    }

    public static boolean partialMatch(String haystack, String needle) {
        return normalize(haystack).contains(normalize(needle));
    }
}
