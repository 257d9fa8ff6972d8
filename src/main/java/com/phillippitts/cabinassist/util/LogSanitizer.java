package com.phillippitts.cabinassist.util;

/** Utility for privacy-safe logging of utterance previews. */
public final class LogSanitizer {

    /** Default number of characters of an utterance that may reach the logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of user or assistant speech: line breaks collapsed to spaces,
     * truncated to {@link #DEFAULT_PREVIEW_CHARS} with an ellipsis marker when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ').strip();
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
