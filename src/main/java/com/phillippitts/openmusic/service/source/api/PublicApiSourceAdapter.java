package com.phillippitts.openmusic.service.source.api;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import com.phillippitts.openmusic.service.source.HttpFailures;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.YouTubeUrls;
import com.phillippitts.openmusic.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Official search API backend (YouTube Data API v3).
 *
 * <p>A search costs two requests: {@code /search} for ids and snippets, then {@code /videos}
 * for ISO-8601 durations. A failed duration lookup degrades to items without duration.
 */
@Component
public class PublicApiSourceAdapter implements SourceAdapter {

    private static final Logger LOG = LogManager.getLogger(PublicApiSourceAdapter.class);
    private static final String NAME = "youtube-api";
    private static final int MAX_RESULTS = 50;

    private final RestClient restClient;
    private final SourceProperties.Api config;

    public PublicApiSourceAdapter(RestClient sourceRestClient, SourceProperties properties) {
        this.restClient = sourceRestClient;
        this.config = properties.getApi();
    }

    @Override
    public List<Item> search(String query, int limit) {
        String key = requireApiKey();
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/search")
                .queryParam("part", "snippet")
                .queryParam("type", "video")
                .queryParam("order", "relevance")
                .queryParam("maxResults", Math.min(Math.max(limit, 1), MAX_RESULTS))
                .queryParam("q", "{q}")
                .queryParam("key", "{key}")
                .encode()
                .buildAndExpand(query, key)
                .toUri();

        JSONObject body = getJson(uri, "search");
        JSONArray results = body.optJSONArray("items");
        if (results == null) {
            return List.of();
        }

        List<String> ids = new ArrayList<>();
        List<JSONObject> snippets = new ArrayList<>();
        for (int i = 0; i < results.length(); i++) {
            JSONObject result = results.optJSONObject(i);
            if (result == null) {
                continue;
            }
            JSONObject id = result.optJSONObject("id");
            JSONObject snippet = result.optJSONObject("snippet");
            String videoId = id == null ? "" : id.optString("videoId", "");
            if (videoId.isEmpty() || snippet == null) {
                continue;
            }
            ids.add(videoId);
            snippets.add(snippet);
        }

        Map<String, Duration> durations = lookupDurations(ids, key);
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < ids.size() && items.size() < limit; i++) {
            Item item = toItem(ids.get(i), snippets.get(i), durations.get(ids.get(i)));
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    @Override
    public Optional<Item> resolve(String url) {
        String key = requireApiKey();
        Optional<String> videoId = YouTubeUrls.videoId(url);
        if (videoId.isEmpty()) {
            return Optional.empty();
        }
        JSONObject body = getJson(videosUri(videoId.get(), "snippet,contentDetails", key), "videos");
        JSONArray results = body.optJSONArray("items");
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        JSONObject video = results.optJSONObject(0);
        if (video == null) {
            return Optional.empty();
        }
        Duration duration = parseDuration(video.optJSONObject("contentDetails"));
        return Optional.ofNullable(toItem(videoId.get(), video.optJSONObject("snippet"), duration));
    }

    private Map<String, Duration> lookupDurations(List<String> ids, String key) {
        Map<String, Duration> durations = new HashMap<>();
        if (ids.isEmpty()) {
            return durations;
        }
        try {
            JSONObject body = getJson(videosUri(String.join(",", ids), "contentDetails", key), "videos");
            JSONArray results = body.optJSONArray("items");
            if (results != null) {
                for (int i = 0; i < results.length(); i++) {
                    JSONObject video = results.optJSONObject(i);
                    if (video == null) {
                        continue;
                    }
                    Duration d = parseDuration(video.optJSONObject("contentDetails"));
                    if (d != null) {
                        durations.put(video.optString("id", ""), d);
                    }
                }
            }
        } catch (RuntimeException e) {
            LOG.debug("Duration lookup failed, returning items without duration: {}", e.toString());
        }
        return durations;
    }

    private URI videosUri(String ids, String parts, String key) {
        return UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/videos")
                .queryParam("part", parts)
                .queryParam("id", "{ids}")
                .queryParam("key", "{key}")
                .encode()
                .buildAndExpand(ids, key)
                .toUri();
    }

    private JSONObject getJson(URI uri, String operation) {
        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            return new JSONObject(body == null ? "" : body);
        } catch (RuntimeException e) {
            LOG.debug("Public API {} failed for {}: {}", operation,
                    LogSanitizer.redactUrl(uri.toString()), e.toString());
            throw HttpFailures.translate(NAME, operation, e);
        }
    }

    private static Item toItem(String videoId, JSONObject snippet, Duration duration) {
        if (snippet == null) {
            return null;
        }
        String title = snippet.optString("title", "").trim();
        if (title.isEmpty()) {
            return null;
        }
        String channel = snippet.optString("channelTitle", "").trim();
        return Item.of(title, channel.isEmpty() ? null : channel, duration, thumbnail(snippet),
                YouTubeUrls.watchUrl(videoId), SourceKind.PUBLIC_API);
    }

    private static String thumbnail(JSONObject snippet) {
        JSONObject thumbs = snippet.optJSONObject("thumbnails");
        if (thumbs == null) {
            return null;
        }
        for (String size : List.of("high", "medium", "default")) {
            JSONObject t = thumbs.optJSONObject(size);
            if (t != null && !t.optString("url", "").isEmpty()) {
                return t.getString("url");
            }
        }
        return null;
    }

    /** Parses an ISO-8601 duration such as {@code PT4M13S}; live streams report zero. */
    static Duration parseDuration(JSONObject contentDetails) {
        if (contentDetails == null) {
            return null;
        }
        String iso = contentDetails.optString("duration", "");
        if (iso.isEmpty()) {
            return null;
        }
        try {
            Duration d = Duration.parse(iso);
            return d.isZero() ? null : d;
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String requireApiKey() {
        String key = config.getApiKey();
        if (key == null || key.isBlank()) {
            throw new BackendUnavailableException("API key not configured (source.api.api-key)", NAME);
        }
        return key;
    }

    @Override
    public boolean isValidUrl(String url) {
        return YouTubeUrls.isVideoUrl(url);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PUBLIC_API;
    }
}
