package com.example.wormhole.config;

import com.example.wormhole.service.RateLimiter;
import com.example.wormhole.storage.ShardStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the shared infrastructure: JSON mapper, clock, worker pool,
 * the Bilibili rate limiter and the two mirror-image shard stores.
 * <p>
 * - bilibiliStore (b2y): records keyed by Bilibili UID
 * - youtubeStore (y2b): the same records keyed by YouTube channel id
 */
@Configuration
public class WormholeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool used for fan-out store writes.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService storageExecutor(WormholeProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.pipeline().workers(), runnable -> {
            Thread thread = new Thread(runnable, "shard-writer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Serializes calls against the Bilibili API.
     */
    @Bean(destroyMethod = "close")
    public RateLimiter bilibiliRateLimiter(WormholeProperties properties) {
        return new RateLimiter("bilibili", properties.bilibili().requestDelayMs());
    }

    @Bean("bilibiliStore")
    public ShardStore bilibiliStore(WormholeProperties properties, ObjectMapper objectMapper,
                                    @Qualifier("storageExecutor") ExecutorService storageExecutor) {
        return shardStore(properties, objectMapper, storageExecutor, "b2y");
    }

    @Bean("youtubeStore")
    public ShardStore youtubeStore(WormholeProperties properties, ObjectMapper objectMapper,
                                   @Qualifier("storageExecutor") ExecutorService storageExecutor) {
        return shardStore(properties, objectMapper, storageExecutor, "y2b");
    }

    /**
     * Shared ObjectMapper: ISO-8601 timestamps, unknown fields ignored.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private ShardStore shardStore(WormholeProperties properties, ObjectMapper objectMapper,
                                  ExecutorService executor, String direction) {
        WormholeProperties.Storage storage = properties.storage();
        return new ShardStore(Path.of(storage.dataDir(), direction), storage.shardConfig(),
                storage.deleteMode(), objectMapper, executor);
    }
}
