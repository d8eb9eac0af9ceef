package com.example.invoicepipeline.application.extraction;

import java.util.regex.Pattern;

/**
 * Collapses the whitespace noise found in layout-derived text.
 * Every matcher in this package normalizes its input through here before attempting a structural match.
 */
public final class TextNormalizer {

    private static final char NO_BREAK_SPACE = '\u00A0';
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Replaces non-breaking spaces, collapses every whitespace run to one space and trims the result.
     * Total and idempotent; {@code null} yields an empty string.
     *
     * @param text raw text
     * @return normalized text
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String spaced = text.replace(NO_BREAK_SPACE, ' ');
        return WHITESPACE_RUN.matcher(spaced).replaceAll(" ").strip();
    }
}
