package com.example.wormhole.config;

import com.example.wormhole.model.ShardConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for the reconciliation service.
 */
@ConfigurationProperties(prefix = "wormhole")
public record WormholeProperties(
        @DefaultValue Bilibili bilibili,
        @DefaultValue Youtube youtube,
        @DefaultValue Storage storage,
        @DefaultValue Scanner scanner,
        @DefaultValue Pipeline pipeline,
        @DefaultValue Submission submission,
        @DefaultValue Reader reader
) {

    /**
     * Bilibili API access.
     *
     * @param baseUrl        API host
     * @param sessdata       SESSDATA cookie; when set, requests are WBI-signed
     * @param requestDelayMs pause between two rate-limited calls
     */
    public record Bilibili(
            @DefaultValue("https://api.bilibili.com") String baseUrl,
            String sessdata,
            @DefaultValue("1000") long requestDelayMs
    ) {}

    /**
     * YouTube Data API v3 access.
     *
     * @param baseUrl    API root
     * @param apiKey     API key
     * @param dailyQuota quota units available per 24h window
     */
    public record Youtube(
            @DefaultValue("https://www.googleapis.com/youtube/v3") String baseUrl,
            String apiKey,
            @DefaultValue("10000") long dailyQuota
    ) {}

    /**
     * Shard store layout.
     *
     * @param dataDir      root holding the {@code b2y} and {@code y2b} stores
     * @param level1Length first directory level length
     * @param level2Length second directory level length
     * @param hashLength   hash characters kept in file names
     * @param deleteMode   TRUNCATE keeps an empty tombstone file, REMOVE deletes it
     */
    public record Storage(
            @DefaultValue("./data") String dataDir,
            @DefaultValue("2") int level1Length,
            @DefaultValue("2") int level2Length,
            @DefaultValue("8") int hashLength,
            @DefaultValue("TRUNCATE") DeleteMode deleteMode
    ) {
        public ShardConfig shardConfig() {
            return new ShardConfig(level1Length, level2Length, hashLength);
        }
    }

    public enum DeleteMode {
        TRUNCATE,
        REMOVE
    }

    /**
     * @param maxUsers cap on unique candidates handed to verification per scan
     */
    public record Scanner(@DefaultValue("100") int maxUsers) {}

    /**
     * @param searchCandidates channels tried when a work item has no channel id
     * @param workers          size of the worker pool used for store writes
     */
    public record Pipeline(
            @DefaultValue("5") int searchCandidates,
            @DefaultValue("4") int workers
    ) {}

    /**
     * Submission endpoint and the ticket tracker it files into.
     *
     * @param maxRequestsPerWindow accepted submissions per client and window
     * @param window               rate-limit window length
     * @param ticketBaseUrl        GitHub API root
     * @param ticketToken          token used to file issues
     * @param ticketOwner          repository owner
     * @param ticketRepo           repository name
     */
    public record Submission(
            @DefaultValue("10") int maxRequestsPerWindow,
            @DefaultValue("1h") Duration window,
            @DefaultValue("https://api.github.com") String ticketBaseUrl,
            String ticketToken,
            String ticketOwner,
            String ticketRepo
    ) {}

    /**
     * @param cacheTtl how long lookup indexes and mappings stay cached
     */
    public record Reader(@DefaultValue("1h") Duration cacheTtl) {}
}
