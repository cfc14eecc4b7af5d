package com.phillippitts.openmusic.service.source.feed;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.service.source.HttpFailures;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.YouTubeUrls;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort backend that needs no API key and no local binary.
 *
 * <p>First scrapes the public search-results page by pattern extraction. When the page yields
 * nothing, falls back to the RSS feeds of the configured channels, keeping entries whose
 * title mentions a query word.
 */
@Component
public class FeedSourceAdapter implements SourceAdapter {

    private static final Logger LOG = LogManager.getLogger(FeedSourceAdapter.class);
    private static final String NAME = "youtube-feed";

    static final Pattern VIDEO_ID = Pattern.compile("\"videoId\":\"([a-zA-Z0-9_-]{11})\"");
    static final Pattern TITLE_RUN = Pattern.compile("\"title\":\\{\"runs\":\\[\\{\"text\":\"((?:[^\"\\\\]|\\\\.)+)\"");
    private static final Pattern RSS_ENTRY = Pattern.compile("<entry>(.*?)</entry>", Pattern.DOTALL);
    private static final Pattern RSS_VIDEO_ID = Pattern.compile("<yt:videoId>([a-zA-Z0-9_-]{11})</yt:videoId>");
    private static final Pattern RSS_TITLE = Pattern.compile("<title>(?:<!\\[CDATA\\[)?(.*?)(?:\\]\\]>)?</title>", Pattern.DOTALL);
    private static final Pattern RSS_AUTHOR = Pattern.compile("<author>\\s*<name>(.*?)</name>", Pattern.DOTALL);

    /** How far after a video id the matching title is searched for. */
    private static final int TITLE_WINDOW_CHARS = 4000;

    private final RestClient restClient;
    private final SourceProperties.Feed config;

    public FeedSourceAdapter(RestClient sourceRestClient, SourceProperties properties) {
        this.restClient = sourceRestClient;
        this.config = properties.getFeed();
    }

    @Override
    public List<Item> search(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getSearchUrl())
                .queryParam("search_query", "{q}")
                .encode()
                .buildAndExpand(query)
                .toUri();
        List<Item> items = extractSearchResults(fetch(uri, "search"), limit);
        if (!items.isEmpty() || config.getChannelIds().isEmpty()) {
            return items;
        }
        LOG.debug("Search page yielded nothing, trying {} channel feeds", config.getChannelIds().size());
        return searchChannelFeeds(query, limit);
    }

    /**
     * Pairs every distinct video id on the page with the first title run that follows it.
     */
    static List<Item> extractSearchResults(String html, int limit) {
        List<Item> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher ids = VIDEO_ID.matcher(html);
        while (ids.find() && items.size() < limit) {
            String id = ids.group(1);
            if (!seen.add(id)) {
                continue;
            }
            int windowEnd = Math.min(html.length(), ids.end() + TITLE_WINDOW_CHARS);
            Matcher title = TITLE_RUN.matcher(html).region(ids.end(), windowEnd);
            if (!title.find()) {
                continue;
            }
            items.add(Item.of(unescapeJson(title.group(1)), null, null,
                    "https://i.ytimg.com/vi/" + id + "/hqdefault.jpg",
                    YouTubeUrls.watchUrl(id), SourceKind.FEED));
        }
        return items;
    }

    private List<Item> searchChannelFeeds(String query, int limit) {
        List<String> words = queryWords(query);
        List<Item> items = new ArrayList<>();
        BackendException lastError = null;
        for (String channelId : config.getChannelIds()) {
            if (items.size() >= limit) {
                break;
            }
            URI uri = UriComponentsBuilder.fromHttpUrl(config.getRssUrl())
                    .queryParam("channel_id", "{id}")
                    .encode()
                    .buildAndExpand(channelId)
                    .toUri();
            try {
                for (Item item : extractFeedEntries(fetch(uri, "feed"))) {
                    if (items.size() < limit && matchesAny(item.title(), words)) {
                        items.add(item);
                    }
                }
            } catch (BackendException e) {
                lastError = e;
                LOG.debug("Channel feed {} failed: {}", channelId, e.getMessage());
            }
        }
        if (items.isEmpty() && lastError != null) {
            throw lastError;
        }
        return items;
    }

    static List<Item> extractFeedEntries(String xml) {
        List<Item> items = new ArrayList<>();
        Matcher entries = RSS_ENTRY.matcher(xml);
        while (entries.find()) {
            String entry = entries.group(1);
            Matcher id = RSS_VIDEO_ID.matcher(entry);
            Matcher title = RSS_TITLE.matcher(entry);
            if (!id.find() || !title.find()) {
                continue;
            }
            String text = unescapeXml(title.group(1).trim());
            if (text.isEmpty()) {
                continue;
            }
            Matcher author = RSS_AUTHOR.matcher(entry);
            items.add(Item.of(text, author.find() ? unescapeXml(author.group(1).trim()) : null, null,
                    "https://i.ytimg.com/vi/" + id.group(1) + "/hqdefault.jpg",
                    YouTubeUrls.watchUrl(id.group(1)), SourceKind.FEED));
        }
        return items;
    }

    private String fetch(URI uri, String operation) {
        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            return body == null ? "" : body;
        } catch (RuntimeException e) {
            throw HttpFailures.translate(NAME, operation, e);
        }
    }

    private static List<String> queryWords(String query) {
        List<String> words = new ArrayList<>();
        for (String w : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (w.length() > 2) {
                words.add(w);
            }
        }
        return words;
    }

    private static boolean matchesAny(String title, List<String> words) {
        if (words.isEmpty()) {
            return true;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(lower::contains);
    }

    static String unescapeJson(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                out.append(c);
                continue;
            }
            char next = s.charAt(++i);
            switch (next) {
                case 'n' -> out.append(' ');
                case 't' -> out.append(' ');
                case 'u' -> {
                    String hex = i + 4 < s.length() ? s.substring(i + 1, i + 5) : "";
                    if (hex.matches("[0-9a-fA-F]{4}")) {
                        out.append((char) Integer.parseInt(hex, 16));
                        i += 4;
                    } else {
                        out.append('u');
                    }
                }
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    private static String unescapeXml(String s) {
        return s.replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }

    @Override
    public Optional<Item> resolve(String url) {
        return Optional.empty();
    }

    @Override
    public boolean isValidUrl(String url) {
        return false;
    }

    @Override
    public boolean supportsDirectResolution() {
        return false;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.FEED;
    }
}
