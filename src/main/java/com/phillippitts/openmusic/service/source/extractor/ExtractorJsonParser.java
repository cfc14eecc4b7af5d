package com.phillippitts.openmusic.service.source.extractor;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.service.source.YouTubeUrls;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses yt-dlp {@code --dump-json} output: one JSON object per line.
 * Malformed lines are counted rather than thrown so that a single bad line does not discard
 * the rest of the result set.
 */
final class ExtractorJsonParser {

    private ExtractorJsonParser() {}

    /**
     * @param items successfully parsed items in output order
     * @param malformedLines non-blank lines that were not a usable JSON object
     */
    record ParseResult(List<Item> items, int malformedLines) {
        /** True when output was present but not a single line could be used. */
        boolean allMalformed() {
            return items.isEmpty() && malformedLines > 0;
        }
    }

    static ParseResult parseLines(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return new ParseResult(List.of(), 0);
        }
        List<Item> items = new ArrayList<>();
        int malformed = 0;
        for (String line : stdout.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Item item = parseItem(trimmed);
            if (item == null) {
                malformed++;
            } else {
                items.add(item);
            }
        }
        return new ParseResult(List.copyOf(items), malformed);
    }

    /**
     * Parses one JSON object into an item; returns null when the line is not JSON or lacks
     * the id/title fields.
     */
    static Item parseItem(String json) {
        try {
            JSONObject obj = new JSONObject(json);
            String title = obj.optString("title", "").trim();
            String id = obj.optString("id", "").trim();
            String url = obj.optString("webpage_url", "").trim();
            if (url.isEmpty() && !id.isEmpty()) {
                url = YouTubeUrls.watchUrl(id);
            }
            if (title.isEmpty() || url.isEmpty()) {
                return null;
            }
            String artist = firstNonBlank(obj.optString("uploader", ""), obj.optString("channel", ""));
            String thumbnail = blankToNull(obj.optString("thumbnail", ""));
            Duration duration = null;
            if (!obj.optBoolean("is_live", false)) {
                double seconds = obj.optDouble("duration", Double.NaN);
                if (!Double.isNaN(seconds) && seconds > 0) {
                    duration = Duration.ofMillis(Math.round(seconds * 1000));
                }
            }
            return Item.of(title, artist, duration, thumbnail, url, SourceKind.PRIMARY_EXTRACTOR);
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * First http(s) line of a {@code --get-url} run, or null.
     */
    static String firstUrl(String stdout) {
        if (stdout == null) {
            return null;
        }
        for (String line : stdout.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
                return trimmed;
            }
        }
        return null;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return blankToNull(b);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
