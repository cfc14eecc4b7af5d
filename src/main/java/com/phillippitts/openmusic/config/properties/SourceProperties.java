package com.phillippitts.openmusic.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the HTTP-based backend adapters.
 *
 * <p>The extractor subprocess is configured separately through
 * {@link com.phillippitts.openmusic.config.source.ExtractorConfig}.
 */
@ConfigurationProperties(prefix = "source")
@Validated
public class SourceProperties {

    @Valid
    private Http http = new Http();

    @Valid
    private Api api = new Api();

    @Valid
    private Mirror mirror = new Mirror();

    @Valid
    private Feed feed = new Feed();

    @Valid
    private Direct direct = new Direct();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Mirror getMirror() {
        return mirror;
    }

    public void setMirror(Mirror mirror) {
        this.mirror = mirror;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Direct getDirect() {
        return direct;
    }

    public void setDirect(Direct direct) {
        this.direct = direct;
    }

    /** Shared HTTP client settings. */
    public static class Http {

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(3);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(8);

        @NotBlank
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0 Safari/537.36";

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    /** Public search API (YouTube Data API v3). */
    public static class Api {

        @NotBlank
        private String baseUrl = "https://www.googleapis.com/youtube/v3";

        /** API key; the adapter reports itself unavailable while this is blank. */
        private String apiKey = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    /** Invidious-compatible mirror instances. */
    public static class Mirror {

        private List<String> instances = new ArrayList<>(List.of(
                "https://yewtu.be",
                "https://inv.nadeko.net",
                "https://invidious.nerdvpn.de"));

        /** Sent as {@code Authorization: Bearer ...} when set. */
        private String authToken = "";

        /** Sent as {@code Authorization: ...} when set and no token is configured. */
        private String authPassword = "";

        /** Maximum number of instances tried within one adapter call. */
        @Positive
        private int instancesPerCall = 3;

        public List<String> getInstances() {
            return instances;
        }

        public void setInstances(List<String> instances) {
            this.instances = instances;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getAuthPassword() {
            return authPassword;
        }

        public void setAuthPassword(String authPassword) {
            this.authPassword = authPassword;
        }

        public int getInstancesPerCall() {
            return instancesPerCall;
        }

        public void setInstancesPerCall(int instancesPerCall) {
            this.instancesPerCall = instancesPerCall;
        }
    }

    /** Scraped search page and channel RSS feeds. */
    public static class Feed {

        @NotBlank
        private String searchUrl = "https://www.youtube.com/results";

        @NotBlank
        private String rssUrl = "https://www.youtube.com/feeds/videos.xml";

        private List<String> channelIds = new ArrayList<>();

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getRssUrl() {
            return rssUrl;
        }

        public void setRssUrl(String rssUrl) {
            this.rssUrl = rssUrl;
        }

        public List<String> getChannelIds() {
            return channelIds;
        }

        public void setChannelIds(List<String> channelIds) {
            this.channelIds = channelIds;
        }
    }

    /** Direct links to audio files. */
    public static class Direct {

        private List<String> extensions = new ArrayList<>(List.of(".mp3", ".wav", ".ogg", ".flac", ".m4a"));

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }
    }
}
