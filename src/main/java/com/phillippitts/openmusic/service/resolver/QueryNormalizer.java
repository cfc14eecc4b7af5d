package com.phillippitts.openmusic.service.resolver;

import java.net.URI;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Query clean-up used for cache keys and for the corrected-query fallback pass.
 */
public final class QueryNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryNormalizer() {}

    /**
     * Cache key: lower case, letters, digits and single spaces only.
     * {@code "  Daft PUNK - One More Time!"} becomes {@code "daft punk one more time"}.
     */
    public static String cacheKey(String query) {
        if (query == null) {
            return "";
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return collapse(NON_WORD.matcher(lower).replaceAll(" "));
    }

    /** Removes combining marks: {@code "Beyoncé"} becomes {@code "Beyonce"}. */
    public static String stripDiacritics(String s) {
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }

    /** Replaces punctuation with spaces and collapses whitespace, keeping case. */
    public static String stripPunctuation(String s) {
        return collapse(NON_WORD.matcher(s).replaceAll(" "));
    }

    /**
     * Corrected queries to try after the whole chain came back empty, in order: the query
     * without diacritics and punctuation, its first two words when it has more than two, and
     * its first word when that word is longer than three characters. Corrections identical to
     * the original query are omitted.
     */
    public static List<String> fallbackQueries(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String original = collapse(query);
        String cleaned = stripPunctuation(stripDiacritics(original));
        String[] words = cleaned.isEmpty() ? new String[0] : cleaned.split(" ");

        Set<String> corrections = new LinkedHashSet<>();
        corrections.add(cleaned);
        if (words.length > 2) {
            corrections.add(words[0] + " " + words[1]);
        }
        if (words.length > 1 && words[0].length() > 3) {
            corrections.add(words[0]);
        }

        List<String> result = new ArrayList<>();
        for (String c : corrections) {
            if (!c.isBlank() && !c.equalsIgnoreCase(original)) {
                result.add(c);
            }
        }
        return result;
    }

    /** True for absolute http(s) URLs with a host. */
    public static boolean isUrl(String input) {
        if (input == null) {
            return false;
        }
        String s = input.trim();
        if (!(s.regionMatches(true, 0, "http://", 0, 7) || s.regionMatches(true, 0, "https://", 0, 8))) {
            return false;
        }
        try {
            return URI.create(s).getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }
}
