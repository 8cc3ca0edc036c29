package com.phillippitts.telesession.util;

/** Utility for privacy-safe logging of SDP blobs and coaching feedback. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, appending an ellipsis when cut;
     * returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Masks a credential for logs, keeping only its length.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        return "***(" + secret.length() + ")";
    }
}
