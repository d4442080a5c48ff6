package io.newsclusters.digest.api.util;

/**
 * Helpers for Telegram MarkdownV2 text.
 */
public final class MarkdownV2 {

    /** Characters that must be backslash-escaped outside of code and link targets. */
    public static final String RESERVED_CHARACTERS = "_*[]()~`>#+-=|{}.!";

    private MarkdownV2() {
    }

    /**
     * Escapes every reserved character, and any literal backslash, in raw text.
     * Apply once, to raw feed or user text only.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) return "";

        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || RESERVED_CHARACTERS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Prepares a URL for the target part of an inline link: surrounding whitespace is
     * stripped and only {@code \} and {@code )} are escaped, as the link syntax requires.
     */
    public static String linkTarget(String url) {
        if (url == null) return "";

        return url.strip()
                .replace("\\", "\\\\")
                .replace(")", "\\)");
    }

    /**
     * Truncates to at most {@code maxCodePoints} code points without splitting a surrogate pair.
     */
    public static String truncate(String text, int maxCodePoints) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }
}
