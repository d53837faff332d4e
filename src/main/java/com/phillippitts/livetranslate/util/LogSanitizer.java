package com.phillippitts.livetranslate.util;

/** Utility for privacy-safe logging of transcript previews and client-supplied values. */
public final class LogSanitizer {

    private static final int DEFAULT_VALUE_MAX = 64;

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
     * Makes a client-supplied value safe for a single log line: control characters become
     * {@code _} and the result is truncated.
     */
    public static String clientValue(String s) {
        String t = truncate(s, DEFAULT_VALUE_MAX);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }
}
