package com.example.wormhole.service;

import com.example.wormhole.config.WormholeProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request ceiling per client: each client gets a bucket of
 * {@code maxRequestsPerWindow} tokens that is refilled in full once per window,
 * counted from the client's first request.
 */
@Component
public class SubmissionThrottle {

    private static final long MAX_TRACKED_CLIENTS = 10_000;

    private final int maxRequests;
    private final Duration window;
    private final TimeMeter timeMeter;
    private final Cache<String, Bucket> buckets;

    public SubmissionThrottle(WormholeProperties properties, Clock clock) {
        this.maxRequests = properties.submission().maxRequestsPerWindow();
        this.window = properties.submission().window();
        this.timeMeter = new ClockTimeMeter(clock);
        this.buckets = Caffeine.newBuilder()
                .maximumSize(MAX_TRACKED_CLIENTS)
                .expireAfterAccess(window)
                .ticker(timeMeter::currentTimeNanos)
                .build();
    }

    /**
     * Counts one request for the client.
     *
     * @return false when the client has already used its allowance in the current window
     */
    public boolean tryAcquire(String clientKey) {
        return buckets.get(clientKey, key -> newBucket()).tryConsume(1);
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.classic(maxRequests, Refill.intervally(maxRequests, window));
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    /** Nanosecond time source for buckets and cache expiry, read from the injected clock. */
    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;
        private final Instant origin;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
            this.origin = clock.instant();
        }

        @Override
        public long currentTimeNanos() {
            return Duration.between(origin, clock.instant()).toNanos();
        }

        @Override
        public boolean isWallClockBased() {
            return false;
        }
    }
}
