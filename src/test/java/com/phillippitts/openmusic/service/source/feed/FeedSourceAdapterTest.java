package com.phillippitts.openmusic.service.source.feed;

import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FeedSourceAdapterTest {

    private static final String RESULTS_PAGE = "<script>var ytInitialData = {"
            + "\"videoRenderer\":{\"videoId\":\"aaaaaaaaaaa\",\"thumbnail\":{},"
            + "\"title\":{\"runs\":[{\"text\":\"Bohemian Rhapsody \\u0026 More\"}]}},"
            + "\"videoRenderer\":{\"videoId\":\"aaaaaaaaaaa\",\"title\":{\"runs\":[{\"text\":\"dup\"}]}},"
            + "\"videoRenderer\":{\"videoId\":\"bbbbbbbbbbb\",\"title\":{\"runs\":[{\"text\":\"Say \\\"Hi\\\"\"}]}}"
            + "};</script>";

    private static final String CHANNEL_FEED = """
            <feed>
              <entry>
                <yt:videoId>ccccccccccc</yt:videoId>
                <title>Queen &amp; Friends - Live</title>
                <author><name>Queen Official</name></author>
              </entry>
              <entry>
                <yt:videoId>ddddddddddd</yt:videoId>
                <title>Interview</title>
              </entry>
            </feed>
            """;

    private SourceProperties properties;
    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        properties = new SourceProperties();
        properties.getFeed().setSearchUrl("https://feed.example/results");
        properties.getFeed().setRssUrl("https://feed.example/feeds/videos.xml");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void extractsDistinctVideosWithTitles() {
        List<Item> items = FeedSourceAdapter.extractSearchResults(RESULTS_PAGE, 10);

        assertThat(items).extracting(Item::title).containsExactly("Bohemian Rhapsody & More", "Say \"Hi\"");
        assertThat(items.get(0).canonicalUrl()).isEqualTo("https://www.youtube.com/watch?v=aaaaaaaaaaa");
        assertThat(items.get(0).thumbnail()).isEqualTo("https://i.ytimg.com/vi/aaaaaaaaaaa/hqdefault.jpg");
        assertThat(items).allMatch(item -> item.sourceKind() == SourceKind.FEED);
    }

    @Test
    void extractionStopsAtLimit() {
        assertThat(FeedSourceAdapter.extractSearchResults(RESULTS_PAGE, 1)).hasSize(1);
        assertThat(FeedSourceAdapter.extractSearchResults("<html>consent</html>", 5)).isEmpty();
    }

    @Test
    void unescapesJsonSequences() {
        assertThat(FeedSourceAdapter.unescapeJson("a\\u0026b")).isEqualTo("a&b");
        assertThat(FeedSourceAdapter.unescapeJson("line\\nbreak")).isEqualTo("line break");
        assertThat(FeedSourceAdapter.unescapeJson("back\\\\slash")).isEqualTo("back\\slash");
        assertThat(FeedSourceAdapter.unescapeJson("bad\\uZZ")).isEqualTo("baduZZ");
        assertThat(FeedSourceAdapter.unescapeJson("trailing\\")).isEqualTo("trailing\\");
    }

    @Test
    void parsesRssEntries() {
        List<Item> items = FeedSourceAdapter.extractFeedEntries(CHANNEL_FEED);

        assertThat(items).extracting(Item::title).containsExactly("Queen & Friends - Live", "Interview");
        assertThat(items.get(0).artist()).isEqualTo("Queen Official");
        assertThat(items.get(1).artist()).isNull();
    }

    @Test
    void searchUsesResultsPage() {
        server.expect(requestTo("https://feed.example/results?search_query=queen"))
                .andRespond(withSuccess(RESULTS_PAGE, MediaType.TEXT_HTML));

        List<Item> items = new FeedSourceAdapter(restClient, properties).search("queen", 5);

        assertThat(items).hasSize(2);
        server.verify();
    }

    @Test
    void fallsBackToChannelFeedsFilteredByQueryWords() {
        properties.getFeed().setChannelIds(List.of("UCqueen"));
        server.expect(requestTo(startsWith("https://feed.example/results")))
                .andRespond(withSuccess("<html>nothing</html>", MediaType.TEXT_HTML));
        server.expect(requestTo("https://feed.example/feeds/videos.xml?channel_id=UCqueen"))
                .andRespond(withSuccess(CHANNEL_FEED, MediaType.APPLICATION_XML));

        List<Item> items = new FeedSourceAdapter(restClient, properties).search("queen live", 5);

        assertThat(items).extracting(Item::title).containsExactly("Queen & Friends - Live");
        server.verify();
    }

    @Test
    void allChannelFeedsFailingRethrows() {
        properties.getFeed().setChannelIds(List.of("UCqueen"));
        server.expect(requestTo(startsWith("https://feed.example/results")))
                .andRespond(withSuccess("", MediaType.TEXT_HTML));
        server.expect(requestTo(startsWith("https://feed.example/feeds")))
                .andRespond(withServerError());

        FeedSourceAdapter adapter = new FeedSourceAdapter(restClient, properties);

        assertThatThrownBy(() -> adapter.search("queen", 5))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("backend: youtube-feed");
    }

    @Test
    void cannotResolveUrls() {
        FeedSourceAdapter adapter = new FeedSourceAdapter(restClient, properties);

        assertThat(adapter.supportsDirectResolution()).isFalse();
        assertThat(adapter.isValidUrl("https://www.youtube.com/watch?v=aaaaaaaaaaa")).isFalse();
        assertThat(adapter.resolve("https://www.youtube.com/watch?v=aaaaaaaaaaa")).isEmpty();
    }
}
