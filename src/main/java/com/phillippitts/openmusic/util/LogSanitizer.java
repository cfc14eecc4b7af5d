package com.phillippitts.openmusic.util;

import java.util.regex.Pattern;

/** Utility for privacy-safe logging of queries and URLs. */
public final class LogSanitizer {

    /** Default maximum length of a logged query preview. */
    public static final int QUERY_PREVIEW_CHARS = 80;

    private static final Pattern SECRET_PARAM =
            Pattern.compile("(?i)([?&](?:key|api_key|token|access_token|password)=)[^&#]*");

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
     * Preview of a user query suitable for INFO logs.
     */
    public static String query(String q) {
        return truncate(q, QUERY_PREVIEW_CHARS);
    }

    /**
     * Masks credentials carried in URL query parameters (API keys, tokens, passwords).
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return "";
        }
        return SECRET_PARAM.matcher(url).replaceAll("$1***");
    }
}
