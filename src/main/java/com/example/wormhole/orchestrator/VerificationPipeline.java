package com.example.wormhole.orchestrator;

import com.example.wormhole.client.BilibiliApi;
import com.example.wormhole.client.YouTubeApi;
import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.MappingIndex;
import com.example.wormhole.model.PipelineReport;
import com.example.wormhole.model.ScanReport;
import com.example.wormhole.model.ScanResult;
import com.example.wormhole.model.UserMapping;
import com.example.wormhole.model.VerificationOutcome;
import com.example.wormhole.model.VerificationResult;
import com.example.wormhole.model.WorkItem;
import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.service.CandidateScanner;
import com.example.wormhole.service.ProfileVerifier;
import com.example.wormhole.service.RateLimiter;
import com.example.wormhole.storage.ShardEntry;
import com.example.wormhole.storage.ShardStore;
import com.example.wormhole.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reconciliation pipeline.
 * Verification run:
 * 1. Verify each work item (through the Bilibili rate limiter, one item at a time)
 * 2. Write every confirmed mapping to both stores (b2y by UID, y2b by channel id)
 * 3. Rebuild both indexes once every write has settled
 * <p>
 * Scan run: cold-start check, ranked-list scan, cross-list dedup, cap at {@code maxUsers}.
 */
@Service
public class VerificationPipeline {

    private static final Logger log = LoggerFactory.getLogger(VerificationPipeline.class);

    private final ProfileVerifier verifier;
    private final CandidateScanner scanner;
    private final BilibiliApi bilibiliApi;
    private final YouTubeApi youTubeApi;
    private final RateLimiter rateLimiter;
    private final ShardStore bilibiliStore;
    private final ShardStore youtubeStore;
    private final WormholeProperties properties;

    public VerificationPipeline(ProfileVerifier verifier,
                                CandidateScanner scanner,
                                BilibiliApi bilibiliApi,
                                YouTubeApi youTubeApi,
                                @Qualifier("bilibiliRateLimiter") RateLimiter rateLimiter,
                                @Qualifier("bilibiliStore") ShardStore bilibiliStore,
                                @Qualifier("youtubeStore") ShardStore youtubeStore,
                                WormholeProperties properties) {
        this.verifier = verifier;
        this.scanner = scanner;
        this.bilibiliApi = bilibiliApi;
        this.youTubeApi = youTubeApi;
        this.rateLimiter = rateLimiter;
        this.bilibiliStore = bilibiliStore;
        this.youtubeStore = youtubeStore;
        this.properties = properties;
    }

    public PipelineReport verifyBatch(List<WorkItem> items) {
        log.info("═══════════════════════════════════════════════");
        log.info("Starting verification run for {} work items", items.size());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Verification ──
        log.info("[1/3] Verifying {} pairs...", items.size());
        List<CompletableFuture<VerificationOutcome>> pending = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            pending.add(rateLimiter.execute(() -> verifyItem(item))
                    .exceptionally(ex -> failedOutcome(item, ex)));
        }
        List<VerificationOutcome> outcomes = pending.stream().map(CompletableFuture::join).toList();

        List<UserMapping> mappings = outcomes.stream()
                .filter(o -> o.result().success())
                .map(o -> o.result().mapping())
                .toList();
        log.info("[1/3] Verification completed: {}/{} confirmed", mappings.size(), outcomes.size());

        // ── Step 2: Persist both directions ──
        log.info("[2/3] Writing {} mappings to both stores...", mappings.size());
        List<String> persistenceErrors = new ArrayList<>();
        persist(bilibiliStore, "b2y", mappings.stream()
                .map(m -> new ShardEntry(m.bilibiliUid(), m)).toList(), persistenceErrors);
        persist(youtubeStore, "y2b", mappings.stream()
                .map(m -> new ShardEntry(m.youtubeChannelId(), m)).toList(), persistenceErrors);
        log.info("[2/3] Writes settled ({} errors)", persistenceErrors.size());

        // ── Step 3: Index rebuild (after the write barrier) ──
        log.info("[3/3] Rebuilding indexes...");
        MappingIndex bilibiliIndex = bilibiliStore.rebuildIndex();
        MappingIndex youtubeIndex = youtubeStore.rebuildIndex();
        log.info("[3/3] Indexes rebuilt: b2y {} keys, y2b {} keys", bilibiliIndex.size(), youtubeIndex.size());

        log.info("═══════════════════════════════════════════════");
        log.info("Verification complete: {}/{} successful", mappings.size(), outcomes.size());
        log.info("═══════════════════════════════════════════════");

        return new PipelineReport(outcomes, mappings.size(), persistenceErrors,
                bilibiliIndex.size(), youtubeIndex.size());
    }

    /**
     * Discovers new candidates: a broad sweep on cold start, the hot ranking otherwise.
     */
    public ScanReport scan() {
        boolean coldStart = scanner.isColdStart();
        log.info("Running scanner (cold start: {})", coldStart);

        List<ScanResult> results = scanner.runDailyScan(coldStart);
        List<BilibiliUser> uniqueUsers = scanner.deduplicateUsers(results);
        int maxUsers = properties.scanner().maxUsers();
        if (uniqueUsers.size() > maxUsers) {
            log.info("Capping {} candidates to {}", uniqueUsers.size(), maxUsers);
            uniqueUsers = uniqueUsers.subList(0, maxUsers);
        }

        log.info("Scanned {} unique new users", uniqueUsers.size());
        return new ScanReport(coldStart, results, List.copyOf(uniqueUsers));
    }

    /**
     * Scan followed by verification of every new candidate (channels are searched by name).
     */
    public PipelineReport runDaily() {
        ScanReport scan = scan();
        List<WorkItem> items = scan.uniqueUsers().stream()
                .map(user -> new WorkItem(user.uid(), null, null))
                .toList();
        return verifyBatch(items);
    }

    VerificationOutcome verifyItem(WorkItem item) {
        String uid = item.bilibiliUid();
        log.debug("Verifying {} -> {}", uid, item.youtubeChannelId() != null ? item.youtubeChannelId() : "searching...");

        if (item.youtubeChannelId() != null && !item.youtubeChannelId().isBlank()) {
            VerificationResult result = verifier.verify(uid, item.youtubeChannelId());
            logOutcome(uid, result);
            return outcome(item, item.youtubeChannelId(), result);
        }

        BilibiliUser user = bilibiliApi.getUserInfo(uid);
        List<YouTubeChannel> channels = youTubeApi.searchChannels(user.name(), properties.pipeline().searchCandidates());
        for (YouTubeChannel channel : channels) {
            VerificationResult result = verifier.verify(uid, channel.id());
            if (result.success() && result.level() <= 3) {
                logOutcome(uid, result);
                return outcome(item, channel.id(), result);
            }
        }

        log.info("No YouTube channel found for {}", uid);
        return outcome(item, null, VerificationResult.failed("No YouTube channel found"));
    }

    private void persist(ShardStore store, String direction, List<ShardEntry> entries, List<String> errors) {
        if (entries.isEmpty()) return;
        try {
            store.batchWrite(entries);
        } catch (StorageException e) {
            log.error("Failed to write {} mappings", direction, e);
            errors.add(direction + ": " + e.getMessage());
        }
    }

    private static VerificationOutcome outcome(WorkItem item, String channelId, VerificationResult result) {
        return new VerificationOutcome(item.bilibiliUid(), channelId, item.issueNumber(),
                result.withIssueNumber(item.issueNumber()));
    }

    private static VerificationOutcome failedOutcome(WorkItem item, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.warn("Error verifying {}: {}", item.bilibiliUid(), cause.getMessage());
        return outcome(item, item.youtubeChannelId(), VerificationResult.failed("Error: " + cause.getMessage()));
    }

    private static void logOutcome(String uid, VerificationResult result) {
        if (result.success()) {
            log.info("Verified: {} -> {} (Level {})", result.mapping().bilibiliUsername(),
                    result.mapping().youtubeChannelName(), result.level());
        } else {
            log.info("Verification failed for {} (level {}, confidence {})", uid, result.level(), result.confidence());
        }
    }
}
