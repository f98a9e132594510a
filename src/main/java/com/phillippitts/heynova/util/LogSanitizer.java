package com.phillippitts.heynova.util;

/** Utility for privacy-safe logging of heard text and commands. */
public final class LogSanitizer {

    /** Default preview length for transcribed text at INFO level. */
    public static final int DEFAULT_PREVIEW_CHARS = 80;

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
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    public static String preview(String s) {
        return truncate(s, DEFAULT_PREVIEW_CHARS);
    }

    /** Hides everything but the last four characters of a credential. */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
