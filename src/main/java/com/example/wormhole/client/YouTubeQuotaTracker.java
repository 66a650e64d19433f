package com.example.wormhole.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks YouTube Data API quota units. The free tier grants a daily budget;
 * {@code search} costs 100 units, list calls cost 1. The window resets 24 hours after it opened.
 */
public class YouTubeQuotaTracker {

    private static final Duration WINDOW = Duration.ofHours(24);

    public enum Operation {
        SEARCH(100),
        CHANNELS(1);

        private final int cost;

        Operation(int cost) {
            this.cost = cost;
        }

        public int cost() {
            return cost;
        }
    }

    private final long dailyLimit;
    private final Clock clock;

    private long used;
    private Instant windowStart;

    public YouTubeQuotaTracker(long dailyLimit, Clock clock) {
        this.dailyLimit = dailyLimit;
        this.clock = clock;
        this.windowStart = clock.instant();
    }

    /**
     * Reserves the units of one call.
     *
     * @throws PlatformFetchException when the remaining quota does not cover the call
     */
    public synchronized void charge(Operation operation) {
        resetIfElapsed();
        if (used + operation.cost() > dailyLimit) {
            throw new PlatformFetchException("YouTube API quota exhausted: %d/%d units used, %s needs %d"
                    .formatted(used, dailyLimit, operation, operation.cost()));
        }
        used += operation.cost();
    }

    public synchronized long remaining() {
        resetIfElapsed();
        return dailyLimit - used;
    }

    private void resetIfElapsed() {
        Instant now = clock.instant();
        if (!now.isBefore(windowStart.plus(WINDOW))) {
            used = 0;
            windowStart = now;
        }
    }
}
