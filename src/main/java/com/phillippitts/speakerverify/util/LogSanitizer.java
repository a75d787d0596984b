package com.phillippitts.speakerverify.util;

/** Helpers for keeping user-supplied strings safe and short in log lines. */
public final class LogSanitizer {

    private static final int MAX_URL_CHARS = 200;

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
     * Drops query string, fragment and user-info from a URL so signed-URL tokens and
     * credentials never reach the logs, then truncates.
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return "";
        }
        String s = url;
        int cut = indexOfAny(s, '?', '#');
        if (cut >= 0) {
            s = s.substring(0, cut);
        }
        int schemeEnd = s.indexOf("://");
        if (schemeEnd >= 0) {
            int hostStart = schemeEnd + 3;
            int slash = s.indexOf('/', hostStart);
            int at = s.lastIndexOf('@', slash < 0 ? s.length() : slash);
            if (at >= hostStart) {
                s = s.substring(0, hostStart) + s.substring(at + 1);
            }
        }
        return truncate(s, MAX_URL_CHARS);
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) {
            return ib;
        }
        if (ib < 0) {
            return ia;
        }
        return Math.min(ia, ib);
    }
}
