package com.example.wormhole.client;

import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.BilibiliVideo;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HTTP client for the Bilibili web API.
 * <p>
 * Anonymous by default. With a SESSDATA cookie configured, requests carry the cookie and a
 * WBI signature ({@code wts} + {@code w_rid}) derived from the keys published by the nav endpoint.
 */
@Service
public class BilibiliRestClient implements BilibiliApi {

    private static final Logger log = LoggerFactory.getLogger(BilibiliRestClient.class);

    private static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";
    private static final String REFERER = "https://www.bilibili.com";

    /** Character permutation applied to img_key + sub_key to derive the mixin key. */
    private static final int[] MIXIN_KEY_ENC_TAB = {
            46, 47, 18, 2, 53, 8, 23, 32, 15, 50, 10, 31, 58, 3, 45, 35, 27, 43, 5, 49,
            33, 9, 42, 19, 29, 28, 14, 39, 12, 38, 41, 13, 37, 48, 7, 16, 24, 55, 40, 61,
            26, 17, 0, 1, 60, 51, 30, 4, 22, 25, 54, 21, 56, 59, 6, 63, 57, 62, 11, 36,
            20, 34, 44, 52
    };

    private final RestClient restClient;
    private final String baseUrl;
    private final String sessdata;
    private final Clock clock;

    private volatile String mixinKey;

    public BilibiliRestClient(WormholeProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        this.baseUrl = properties.bilibili().baseUrl();
        this.sessdata = properties.bilibili().sessdata();
        this.clock = clock;
        this.restClient = restClientBuilder
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.REFERER, REFERER)
                .build();
    }

    @Override
    public BilibiliUser getUserInfo(String uid) {
        JsonNode data = request("/x/space/acc/info", Map.of("mid", uid));
        JsonNode official = data.path("official");
        BilibiliUser.Official certification = official.path("type").asInt(-1) >= 0
                ? new BilibiliUser.Official(official.path("type").asInt(), JsonFields.text(official.path("desc")))
                : null;
        return new BilibiliUser(
                data.path("mid").asText(uid),
                JsonFields.text(data.path("name")),
                JsonFields.nullableText(data.path("face")),
                JsonFields.text(data.path("sign")),
                JsonFields.nullableLong(data.path("follower")),
                data.path("level").asInt(),
                certification);
    }

    @Override
    public List<BilibiliVideo> getUserVideos(String uid, int page, int pageSize) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("mid", uid);
        params.put("ps", String.valueOf(pageSize));
        params.put("pn", String.valueOf(page));
        JsonNode data = request("/x/space/arc/search", params);

        List<BilibiliVideo> videos = new ArrayList<>();
        for (JsonNode v : data.path("list").path("vlist")) {
            videos.add(new BilibiliVideo(
                    JsonFields.text(v.path("bvid")),
                    v.path("aid").asLong(),
                    JsonFields.text(v.path("title")),
                    JsonFields.nullableText(v.path("pic")),
                    JsonFields.text(v.path("author")),
                    v.path("mid").asLong(),
                    v.path("created").asLong(),
                    JsonFields.text(v.path("length")),
                    JsonFields.longOrZero(v.path("play")),
                    JsonFields.longOrZero(v.path("video_review"))));
        }
        return videos;
    }

    @Override
    public List<BilibiliUser> getHotRankings() {
        return rankingOwners("/x/web-interface/ranking/v2", "hot rankings");
    }

    @Override
    public List<BilibiliUser> getMustWatchList() {
        return rankingOwners("/x/web-interface/popular/precious", "must-watch list");
    }

    /**
     * There is no public endpoint for the yearly top-100 list; the hot ranking stands in for it.
     */
    @Override
    public List<BilibiliUser> getTop100Creators() {
        return getHotRankings();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private List<BilibiliUser> rankingOwners(String path, String label) {
        JsonNode data = fetch(URI.create(baseUrl + path), label);
        Set<String> seen = new LinkedHashSet<>();
        List<BilibiliUser> users = new ArrayList<>();
        for (JsonNode item : data.path("list")) {
            JsonNode owner = item.path("owner");
            String uid = owner.path("mid").asText();
            if (uid.isEmpty() || !seen.add(uid)) continue;
            users.add(BilibiliUser.fromRanking(uid, JsonFields.text(owner.path("name")),
                    JsonFields.nullableText(owner.path("face"))));
        }
        log.debug("Fetched {} unique owners from {}", users.size(), label);
        return users;
    }

    private JsonNode request(String path, Map<String, String> params) {
        String query = sessdata != null && !sessdata.isBlank()
                ? signedQuery(params)
                : encodeQuery(params);
        String uri = baseUrl + path + (query.isEmpty() ? "" : "?" + query);
        return fetch(URI.create(uri), path);
    }

    private JsonNode fetch(URI uri, String label) {
        JsonNode body;
        try {
            RestClient.RequestHeadersSpec<?> spec = restClient.get().uri(uri);
            if (sessdata != null && !sessdata.isBlank()) {
                spec = spec.header(HttpHeaders.COOKIE, "SESSDATA=" + sessdata);
            }
            body = spec.retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        // the JSON envelope carries the error code
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PlatformFetchException("Bilibili API unreachable (" + label + "): " + e.getMessage(), e);
        }
        if (body == null) {
            throw new PlatformFetchException("Bilibili API returned an empty body (" + label + ")");
        }
        if (body.path("code").asInt(-1) != 0) {
            throw new PlatformFetchException("Bilibili API error: " + JsonFields.text(body.path("message")));
        }
        return body.path("data");
    }

    String signedQuery(Map<String, String> params) {
        Map<String, String> sorted = new TreeMap<>(params);
        sorted.put("wts", String.valueOf(clock.instant().getEpochSecond()));
        String query = encodeQuery(sorted);
        return query + "&w_rid=" + md5Hex(query + mixinKey());
    }

    private String mixinKey() {
        String key = mixinKey;
        if (key == null) {
            JsonNode wbi = fetch(URI.create(baseUrl + "/x/web-interface/nav"), "nav").path("wbi_img");
            key = mixinKey(fileStem(JsonFields.text(wbi.path("img_url"))),
                    fileStem(JsonFields.text(wbi.path("sub_url"))));
            mixinKey = key;
        }
        return key;
    }

    static String mixinKey(String imgKey, String subKey) {
        String raw = imgKey + subKey;
        StringBuilder key = new StringBuilder(32);
        for (int index : MIXIN_KEY_ENC_TAB) {
            if (index < raw.length()) {
                key.append(raw.charAt(index));
            }
            if (key.length() == 32) break;
        }
        return key.toString();
    }

    private static String fileStem(String url) {
        String name = url.substring(url.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return dot >= 0 ? name.substring(0, dot) : name;
    }

    /** Values have {@code !'()*} stripped, as the signature check expects. */
    private static String encodeQuery(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue().replaceAll("[!'()*]", ""),
                        StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("&"));
    }

    private static String md5Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
