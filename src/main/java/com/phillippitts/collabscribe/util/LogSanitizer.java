package com.phillippitts.collabscribe.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of transcript text: line breaks collapsed, truncated to {@code max}
     * characters with a trailing ellipsis when cut.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("[\\r\\n\\t]+", " ").trim();
        if (max <= 0) {
            return "";
        }
        return flat.length() <= max ? flat : truncate(flat, max) + ELLIPSIS;
    }
}
