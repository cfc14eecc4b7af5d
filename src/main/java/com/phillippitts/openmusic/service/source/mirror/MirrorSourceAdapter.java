package com.phillippitts.openmusic.service.source.mirror;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import com.phillippitts.openmusic.service.source.HttpFailures;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.StreamUrlProvider;
import com.phillippitts.openmusic.service.source.YouTubeUrls;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Backend over Invidious-compatible mirror instances.
 *
 * <p>Each call starts at the next instance in round-robin order and moves on to the following
 * instance when one fails, trying at most {@code source.mirror.instances-per-call}. The
 * round-robin index is the only mutable state of this adapter.
 */
@Component
public class MirrorSourceAdapter implements SourceAdapter, StreamUrlProvider {

    private static final Logger LOG = LogManager.getLogger(MirrorSourceAdapter.class);
    private static final String NAME = "invidious";
    private static final int MIN_THUMBNAIL_WIDTH = 320;

    private final RestClient restClient;
    private final SourceProperties.Mirror config;
    private final AtomicInteger nextInstance = new AtomicInteger();

    public MirrorSourceAdapter(RestClient sourceRestClient, SourceProperties properties) {
        this.restClient = sourceRestClient;
        this.config = properties.getMirror();
    }

    @Override
    public List<Item> search(String query, int limit) {
        return onInstances("search", instance -> {
            URI uri = UriComponentsBuilder.fromHttpUrl(instance)
                    .path("/api/v1/search")
                    .queryParam("q", "{q}")
                    .queryParam("type", "video")
                    .queryParam("sort_by", "relevance")
                    .queryParam("page", 1)
                    .encode()
                    .buildAndExpand(query)
                    .toUri();
            JSONArray results = new JSONArray(get(uri));
            List<Item> items = new ArrayList<>();
            for (int i = 0; i < results.length() && items.size() < limit; i++) {
                JSONObject result = results.optJSONObject(i);
                if (result == null || !"video".equals(result.optString("type", "video"))) {
                    continue;
                }
                Item item = toItem(result);
                if (item != null) {
                    items.add(item);
                }
            }
            return items;
        });
    }

    @Override
    public Optional<Item> resolve(String url) {
        Optional<String> videoId = YouTubeUrls.videoId(url);
        if (videoId.isEmpty()) {
            return Optional.empty();
        }
        return onInstances("resolve", instance ->
                Optional.ofNullable(toItem(video(instance, videoId.get()))));
    }

    @Override
    public Optional<String> streamUrl(Item item) {
        Optional<String> videoId = YouTubeUrls.videoId(item.canonicalUrl());
        if (videoId.isEmpty()) {
            return Optional.empty();
        }
        return onInstances("stream", instance ->
                Optional.ofNullable(bestAudioUrl(video(instance, videoId.get()))));
    }

    private JSONObject video(String instance, String videoId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(instance)
                .path("/api/v1/videos/{id}")
                .buildAndExpand(videoId)
                .encode()
                .toUri();
        JSONObject video = new JSONObject(get(uri));
        if (!video.has("videoId")) {
            video.put("videoId", videoId);
        }
        return video;
    }

    /**
     * Runs {@code call} against successive instances until one succeeds.
     */
    private <T> T onInstances(String operation, Function<String, T> call) {
        List<String> instances = config.getInstances();
        if (instances == null || instances.isEmpty()) {
            throw new BackendUnavailableException("No mirror instances configured", NAME);
        }
        int start = Math.floorMod(nextInstance.getAndIncrement(), instances.size());
        int attempts = Math.min(instances.size(), config.getInstancesPerCall());

        BackendException last = null;
        for (int i = 0; i < attempts; i++) {
            String instance = trimSlash(instances.get((start + i) % instances.size()));
            try {
                return call.apply(instance);
            } catch (RuntimeException e) {
                last = HttpFailures.translate(NAME, operation, e);
                LOG.debug("Mirror {} failed {}: {}", instance, operation, last.getMessage());
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        }
        throw last;
    }

    private String get(URI uri) {
        RestClient.RequestHeadersSpec<?> request = restClient.get().uri(uri);
        String authorization = authorizationHeader();
        if (authorization != null) {
            request = request.header(HttpHeaders.AUTHORIZATION, authorization);
        }
        String body = request.retrieve().body(String.class);
        return body == null ? "" : body;
    }

    private String authorizationHeader() {
        if (config.getAuthToken() != null && !config.getAuthToken().isBlank()) {
            return "Bearer " + config.getAuthToken();
        }
        if (config.getAuthPassword() != null && !config.getAuthPassword().isBlank()) {
            return config.getAuthPassword();
        }
        return null;
    }

    static Item toItem(JSONObject video) {
        String id = video.optString("videoId", "");
        String title = video.optString("title", "").trim();
        if (id.isEmpty() || title.isEmpty()) {
            return null;
        }
        String author = video.optString("author", "").trim();
        long seconds = video.optLong("lengthSeconds", 0);
        Duration duration = seconds > 0 && !video.optBoolean("liveNow", false) ? Duration.ofSeconds(seconds) : null;
        return Item.of(title, author.isEmpty() ? null : author, duration, thumbnail(video),
                YouTubeUrls.watchUrl(id), SourceKind.MIRROR);
    }

    private static String thumbnail(JSONObject video) {
        JSONArray thumbs = video.optJSONArray("videoThumbnails");
        if (thumbs == null) {
            return null;
        }
        String fallback = null;
        for (int i = 0; i < thumbs.length(); i++) {
            JSONObject t = thumbs.optJSONObject(i);
            if (t == null || t.optString("url", "").isEmpty()) {
                continue;
            }
            if (t.optInt("width", 0) >= MIN_THUMBNAIL_WIDTH) {
                return t.getString("url");
            }
            if (fallback == null) {
                fallback = t.getString("url");
            }
        }
        return fallback;
    }

    /** Highest-bitrate audio-only format, or null when the mirror lists none. */
    static String bestAudioUrl(JSONObject video) {
        JSONArray formats = video.optJSONArray("adaptiveFormats");
        if (formats == null) {
            return null;
        }
        String best = null;
        long bestBitrate = -1;
        for (int i = 0; i < formats.length(); i++) {
            JSONObject f = formats.optJSONObject(i);
            if (f == null || !f.optString("type", "").startsWith("audio/")) {
                continue;
            }
            String url = f.optString("url", "");
            long bitrate = f.optLong("bitrate", 0);
            if (!url.isEmpty() && bitrate > bestBitrate) {
                best = url;
                bestBitrate = bitrate;
            }
        }
        return best;
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
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
        return SourceKind.MIRROR;
    }
}
