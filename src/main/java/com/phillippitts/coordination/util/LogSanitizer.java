package com.phillippitts.coordination.util;

/** Utility for safe logging of caller-supplied text such as error messages. */
public final class LogSanitizer {
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
     * Collapses line breaks so a caller-supplied value cannot forge extra log lines, then truncates.
     */
    public static String singleLine(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.replaceAll("[\\r\\n]+", " "), max);
    }
}
