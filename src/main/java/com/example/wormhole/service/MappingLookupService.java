package com.example.wormhole.service;

import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.MappingIndex;
import com.example.wormhole.model.UserMapping;
import com.example.wormhole.storage.ShardStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Read side of the two stores: resolves an identifier through the persisted index,
 * then loads the record from its shard. Indexes and records are cached for the configured TTL.
 */
@Service
public class MappingLookupService {

    private static final Logger log = LoggerFactory.getLogger(MappingLookupService.class);

    private static final long MAX_CACHED_MAPPINGS = 10_000;

    private final ShardStore bilibiliStore;
    private final ShardStore youtubeStore;

    private final Cache<Direction, MappingIndex> indexCache;
    private final Cache<String, UserMapping> mappingCache;

    private enum Direction {
        B2Y, Y2B;

        String cacheKey(String id) {
            return name().toLowerCase(Locale.ROOT) + ":" + id;
        }
    }

    public MappingLookupService(@Qualifier("bilibiliStore") ShardStore bilibiliStore,
                                @Qualifier("youtubeStore") ShardStore youtubeStore,
                                Clock clock,
                                WormholeProperties properties) {
        this.bilibiliStore = bilibiliStore;
        this.youtubeStore = youtubeStore;

        Duration ttl = properties.reader().cacheTtl();
        Ticker ticker = clockTicker(clock);
        this.indexCache = Caffeine.newBuilder()
                .maximumSize(Direction.values().length)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
        this.mappingCache = Caffeine.newBuilder()
                .maximumSize(MAX_CACHED_MAPPINGS)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    public Optional<UserMapping> findByBilibiliUid(String uid) {
        return find(Direction.B2Y, bilibiliStore, uid);
    }

    public Optional<UserMapping> findByYouTubeChannelId(String channelId) {
        return find(Direction.Y2B, youtubeStore, channelId);
    }

    public void clearCache() {
        indexCache.invalidateAll();
        mappingCache.invalidateAll();
    }

    private Optional<UserMapping> find(Direction direction, ShardStore store, String id) {
        String cacheKey = direction.cacheKey(id);
        UserMapping cached = mappingCache.getIfPresent(cacheKey);
        if (cached != null) {
            return Optional.of(cached);
        }

        try {
            Optional<String> shardPath = index(direction, store).pathOf(id);
            if (shardPath.isEmpty()) {
                return Optional.empty();
            }
            Optional<UserMapping> mapping = store.resolve(shardPath.get());
            mapping.ifPresent(m -> mappingCache.put(cacheKey, m));
            return mapping;
        } catch (RuntimeException e) {
            log.warn("Failed to look up {} in {}: {}", id, direction, e.getMessage());
            return Optional.empty();
        }
    }

    private MappingIndex index(Direction direction, ShardStore store) {
        return indexCache.get(direction, d -> {
            MappingIndex index = store.readIndex().orElseGet(MappingIndex::empty);
            log.debug("Loaded {} index: {} keys", d, index.size());
            return index;
        });
    }

    private static Ticker clockTicker(Clock clock) {
        Instant origin = clock.instant();
        return () -> Duration.between(origin, clock.instant()).toNanos();
    }
}
