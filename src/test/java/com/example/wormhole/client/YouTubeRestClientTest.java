package com.example.wormhole.client;

import com.example.wormhole.TestFixtures;
import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.model.YouTubeVideo;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class YouTubeRestClientTest {

    private static final String BASE = "https://www.googleapis.com/youtube/v3";
    private static final String CHANNEL_ID = "UCabcdefghijklmnopqrstuv";

    private MockRestServiceServer server;

    private YouTubeRestClient client(long dailyQuota) {
        WormholeProperties defaults = TestFixtures.properties(Path.of("unused"));
        WormholeProperties properties = new WormholeProperties(defaults.bilibili(),
                new WormholeProperties.Youtube(BASE, "test-key", dailyQuota),
                defaults.storage(), defaults.scanner(), defaults.pipeline(), defaults.submission(), defaults.reader());
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        return new YouTubeRestClient(properties, builder, Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC));
    }

    private static String channelJson(String id, String title, boolean hidden, boolean linked) {
        return """
                {"items":[{"id":"%s",
                  "snippet":{"title":"%s","description":"bilibili.com/space","customUrl":"@%s",
                    "thumbnails":{"default":{"url":"d.jpg"},"medium":{"url":"m.jpg"},"high":{"url":"h.jpg"}}},
                  "statistics":{"subscriberCount":"5000","hiddenSubscriberCount":%s,"videoCount":"12"},
                  "status":{"isLinked":%s}}]}
                """.formatted(id, title, title, hidden, linked);
    }

    @Test
    void getChannel_mapsSnippetStatisticsAndStatus() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andExpect(queryParam("key", "test-key"))
                .andExpect(queryParam("id", CHANNEL_ID))
                .andRespond(withSuccess(channelJson(CHANNEL_ID, "Creator", false, true), MediaType.APPLICATION_JSON));

        YouTubeChannel channel = client.getChannel(CHANNEL_ID);

        assertEquals(CHANNEL_ID, channel.id());
        assertEquals("Creator", channel.title());
        assertEquals("@Creator", channel.customUrl());
        assertEquals(5_000L, channel.subscriberCount());
        assertEquals(12L, channel.videoCount());
        assertEquals("h.jpg", channel.thumbnails().high());
        assertTrue(channel.verified());
        assertEquals(9_999, client.remainingQuota());
        server.verify();
    }

    @Test
    void getChannel_hiddenSubscriberCountIsNull() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andRespond(withSuccess(channelJson(CHANNEL_ID, "Creator", true, false), MediaType.APPLICATION_JSON));

        YouTubeChannel channel = client.getChannel(CHANNEL_ID);

        assertNull(channel.subscriberCount());
        assertFalse(channel.verified());
    }

    @Test
    void getChannel_noItemsIsNotFound() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andRespond(withSuccess("{\"items\":[]}", MediaType.APPLICATION_JSON));

        PlatformFetchException error = assertThrows(PlatformFetchException.class, () -> client.getChannel(CHANNEL_ID));

        assertEquals("Channel not found: " + CHANNEL_ID, error.getMessage());
    }

    @Test
    void apiErrorBodyIsFetchError() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"code\":403,\"message\":\"The request cannot be completed.\"}}"));

        PlatformFetchException error = assertThrows(PlatformFetchException.class, () -> client.getChannel(CHANNEL_ID));

        assertEquals("YouTube API error: The request cannot be completed.", error.getMessage());
    }

    @Test
    void searchChannels_skipsChannelsThatFailToLoad() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/search?")))
                .andExpect(queryParam("type", "channel"))
                .andExpect(queryParam("maxResults", "5"))
                .andRespond(withSuccess("""
                        {"items":[{"id":{"channelId":"UCgood"}},{"id":{"channelId":"UCgone"}},{"id":{}}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andExpect(queryParam("id", "UCgood"))
                .andRespond(withSuccess(channelJson("UCgood", "Good", false, false), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/channels?")))
                .andExpect(queryParam("id", "UCgone"))
                .andRespond(withSuccess("{\"items\":[]}", MediaType.APPLICATION_JSON));

        List<YouTubeChannel> channels = client.searchChannels("Good", 5);

        assertEquals(List.of("UCgood"), channels.stream().map(YouTubeChannel::id).toList());
        assertEquals(10_000 - 100 - 1 - 1, client.remainingQuota());
        server.verify();
    }

    @Test
    void getChannelVideos_readsSearchResults() {
        YouTubeRestClient client = client(10_000);
        server.expect(requestTo(startsWith(BASE + "/search?")))
                .andExpect(queryParam("channelId", CHANNEL_ID))
                .andExpect(queryParam("order", "date"))
                .andRespond(withSuccess("""
                        {"items":[{"id":{"videoId":"v1"},"snippet":{"title":"First video",
                          "channelId":"UCabcdefghijklmnopqrstuv","channelTitle":"Creator",
                          "publishedAt":"2024-04-01T00:00:00Z"}}]}
                        """, MediaType.APPLICATION_JSON));

        List<YouTubeVideo> videos = client.getChannelVideos(CHANNEL_ID, 10);

        assertEquals(1, videos.size());
        assertEquals("v1", videos.get(0).id());
        assertEquals("First video", videos.get(0).title());
    }

    @Test
    void exhaustedQuotaFailsBeforeAnyRequest() {
        YouTubeRestClient client = client(50);

        PlatformFetchException error = assertThrows(PlatformFetchException.class,
                () -> client.searchChannels("anyone", 5));

        assertTrue(error.getMessage().startsWith("YouTube API quota exhausted"));
        server.verify();
    }
}
