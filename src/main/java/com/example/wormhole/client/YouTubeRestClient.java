package com.example.wormhole.client;

import com.example.wormhole.client.YouTubeQuotaTracker.Operation;
import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.model.YouTubeVideo;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the YouTube Data API v3. Every call is charged against the daily quota first.
 */
@Service
public class YouTubeRestClient implements YouTubeApi {

    private static final Logger log = LoggerFactory.getLogger(YouTubeRestClient.class);

    private final RestClient restClient;
    private final String baseUrl;
    private final String apiKey;
    private final YouTubeQuotaTracker quota;

    public YouTubeRestClient(WormholeProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        this.baseUrl = properties.youtube().baseUrl();
        this.apiKey = properties.youtube().apiKey();
        this.quota = new YouTubeQuotaTracker(properties.youtube().dailyQuota(), clock);
        this.restClient = restClientBuilder.build();
    }

    @Override
    public YouTubeChannel getChannel(String channelId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet,statistics,status");
        params.put("id", channelId);
        JsonNode data = request("channels", params, Operation.CHANNELS);

        JsonNode items = data.path("items");
        if (!items.isArray() || items.isEmpty()) {
            throw new PlatformFetchException("Channel not found: " + channelId);
        }
        JsonNode item = items.get(0);
        JsonNode snippet = item.path("snippet");
        JsonNode statistics = item.path("statistics");
        Long subscribers = statistics.path("hiddenSubscriberCount").asBoolean(false)
                ? null
                : JsonFields.nullableLong(statistics.path("subscriberCount"));

        return new YouTubeChannel(
                item.path("id").asText(channelId),
                JsonFields.text(snippet.path("title")),
                JsonFields.text(snippet.path("description")),
                JsonFields.nullableText(snippet.path("customUrl")),
                thumbnails(snippet.path("thumbnails")),
                subscribers,
                JsonFields.nullableLong(statistics.path("videoCount")),
                item.path("status").path("isLinked").asBoolean(false));
    }

    @Override
    public List<YouTubeChannel> searchChannels(String query, int maxResults) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet");
        params.put("type", "channel");
        params.put("q", query);
        params.put("maxResults", String.valueOf(maxResults));
        JsonNode data = request("search", params, Operation.SEARCH);

        List<YouTubeChannel> channels = new ArrayList<>();
        for (JsonNode item : data.path("items")) {
            String channelId = item.path("id").path("channelId").asText();
            if (channelId.isEmpty()) continue;
            try {
                channels.add(getChannel(channelId));
            } catch (PlatformFetchException e) {
                log.warn("Skipping channel {} from search '{}': {}", channelId, query, e.getMessage());
            }
        }
        return channels;
    }

    @Override
    public List<YouTubeVideo> getChannelVideos(String channelId, int maxResults) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet");
        params.put("channelId", channelId);
        params.put("type", "video");
        params.put("order", "date");
        params.put("maxResults", String.valueOf(maxResults));
        JsonNode data = request("search", params, Operation.SEARCH);

        List<YouTubeVideo> videos = new ArrayList<>();
        for (JsonNode item : data.path("items")) {
            JsonNode snippet = item.path("snippet");
            videos.add(new YouTubeVideo(
                    item.path("id").path("videoId").asText(),
                    JsonFields.text(snippet.path("title")),
                    JsonFields.text(snippet.path("description")),
                    JsonFields.text(snippet.path("channelId")),
                    JsonFields.text(snippet.path("channelTitle")),
                    JsonFields.text(snippet.path("publishedAt"))));
        }
        return videos;
    }

    public long remainingQuota() {
        return quota.remaining();
    }

    private JsonNode request(String endpoint, Map<String, String> params, Operation operation) {
        quota.charge(operation);

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/" + endpoint)
                .queryParam("key", apiKey);
        params.forEach((name, value) -> uri.queryParam(name, value));
        URI target = uri.encode().build().toUri();

        JsonNode body;
        try {
            body = restClient.get()
                    .uri(target)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        // error details are read from the body below
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PlatformFetchException("YouTube API unreachable (" + endpoint + "): " + e.getMessage(), e);
        }
        if (body == null) {
            throw new PlatformFetchException("YouTube API returned an empty body (" + endpoint + ")");
        }
        if (body.has("error")) {
            throw new PlatformFetchException("YouTube API error: " + JsonFields.text(body.path("error").path("message")));
        }
        return body;
    }

    private static YouTubeChannel.Thumbnails thumbnails(JsonNode node) {
        return new YouTubeChannel.Thumbnails(
                JsonFields.nullableText(node.path("default").path("url")),
                JsonFields.nullableText(node.path("medium").path("url")),
                JsonFields.nullableText(node.path("high").path("url")));
    }
}
