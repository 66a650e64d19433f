package com.example.wormhole.service;

import com.example.wormhole.client.BilibiliApi;
import com.example.wormhole.client.PlatformFetchException;
import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.RankingType;
import com.example.wormhole.model.ScanResult;
import com.example.wormhole.storage.ShardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * Discovers Bilibili creators that have no mapping yet, from the platform's ranked lists.
 * Every list fetch goes through the Bilibili {@link RateLimiter}.
 */
@Service
public class CandidateScanner {

    private static final Logger log = LoggerFactory.getLogger(CandidateScanner.class);

    private final BilibiliApi bilibiliApi;
    private final RateLimiter rateLimiter;
    private final ShardStore bilibiliStore;
    private final ShardStore youtubeStore;
    private final Clock clock;

    public CandidateScanner(BilibiliApi bilibiliApi,
                            @Qualifier("bilibiliRateLimiter") RateLimiter rateLimiter,
                            @Qualifier("bilibiliStore") ShardStore bilibiliStore,
                            @Qualifier("youtubeStore") ShardStore youtubeStore,
                            Clock clock) {
        this.bilibiliApi = bilibiliApi;
        this.rateLimiter = rateLimiter;
        this.bilibiliStore = bilibiliStore;
        this.youtubeStore = youtubeStore;
        this.clock = clock;
    }

    /**
     * True only when neither store has a persisted index yet.
     */
    public boolean isColdStart() {
        return bilibiliStore.readIndex().isEmpty() && youtubeStore.readIndex().isEmpty();
    }

    public ScanResult scanMustWatchList() {
        return scan(RankingType.MUST_WATCH, bilibiliApi::getMustWatchList);
    }

    public ScanResult scanHotRankings() {
        return scan(RankingType.HOT, bilibiliApi::getHotRankings);
    }

    public ScanResult scanTop100() {
        return scan(RankingType.TOP_100, bilibiliApi::getTop100Creators);
    }

    /**
     * Cold start sweeps the top-100 and must-watch lists; later runs only look at the hot ranking.
     */
    public List<ScanResult> runDailyScan(boolean coldStart) {
        List<ScanResult> results = new ArrayList<>();
        if (coldStart) {
            log.info("Cold start detected - scanning top 100 and must-watch list");
            results.add(scanTop100());
            results.add(scanMustWatchList());
        } else {
            log.info("Regular scan - scanning hot rankings");
            results.add(scanHotRankings());
        }
        return results;
    }

    /**
     * Drops users that already have a stored mapping, keeping the original order.
     */
    public List<BilibiliUser> filterNewUsers(List<BilibiliUser> users) {
        List<BilibiliUser> newUsers = new ArrayList<>();
        for (BilibiliUser user : users) {
            if (!bilibiliStore.has(user.uid())) {
                newUsers.add(user);
            }
        }
        return newUsers;
    }

    /**
     * Merges scan results keeping the first occurrence of each UID, in result order
     * and then list order.
     */
    public List<BilibiliUser> deduplicateUsers(List<ScanResult> results) {
        Set<String> seenUids = new HashSet<>();
        List<BilibiliUser> uniqueUsers = new ArrayList<>();
        for (ScanResult result : results) {
            for (BilibiliUser user : result.users()) {
                if (seenUids.add(user.uid())) {
                    uniqueUsers.add(user);
                }
            }
        }
        return uniqueUsers;
    }

    private ScanResult scan(RankingType type, Callable<List<BilibiliUser>> fetch) {
        log.info("Scanning {} list...", type.value());
        List<BilibiliUser> users = await(type, fetch);
        List<BilibiliUser> newUsers = filterNewUsers(users);
        log.info("Scanned {} list: {} users, {} new", type.value(), users.size(), newUsers.size());
        return new ScanResult(type, newUsers, clock.instant(), users.size(), newUsers.size());
    }

    private List<BilibiliUser> await(RankingType type, Callable<List<BilibiliUser>> fetch) {
        try {
            return rateLimiter.execute(fetch).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PlatformFetchException fetchError) {
                throw fetchError;
            }
            throw new PlatformFetchException("Failed to fetch " + type.value() + " list: " + cause.getMessage(), cause);
        }
    }
}
