package com.phillippitts.streamwatch.util;

/** Utility for privacy-safe logging of URLs and broadcast titles. */
public final class LogSanitizer {

    private static final int MAX_URL_CHARS = 120;

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
     * Drops query string and fragment (which may carry tokens or cookies) and truncates.
     */
    public static String url(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        int cut = trimmed.length();
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            cut = query;
        }
        int fragment = trimmed.indexOf('#');
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return truncate(trimmed.substring(0, cut), MAX_URL_CHARS);
    }
}
