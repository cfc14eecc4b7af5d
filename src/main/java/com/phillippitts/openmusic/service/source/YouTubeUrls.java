package com.phillippitts.openmusic.service.source;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Video id extraction and canonical URL construction shared by the YouTube-backed adapters.
 */
public final class YouTubeUrls {

    private static final Pattern VIDEO_ID = Pattern.compile(
            "(?:youtube\\.com/(?:watch\\?(?:.*&)?v=|embed/|shorts/)|youtu\\.be/)"
                    + "([a-zA-Z0-9_-]{11})");

    private YouTubeUrls() {}

    public static Optional<String> videoId(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = VIDEO_ID.matcher(url);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean isVideoUrl(String url) {
        return videoId(url).isPresent();
    }

    public static String watchUrl(String videoId) {
        return "https://www.youtube.com/watch?v=" + videoId;
    }
}
