package com.example.wormhole.orchestrator;

import com.example.wormhole.TestFixtures;
import com.example.wormhole.client.BilibiliApi;
import com.example.wormhole.client.PlatformFetchException;
import com.example.wormhole.client.YouTubeApi;
import com.example.wormhole.config.WormholeProperties.DeleteMode;
import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.MappingIndex;
import com.example.wormhole.model.PipelineReport;
import com.example.wormhole.model.RankingType;
import com.example.wormhole.model.ScanReport;
import com.example.wormhole.model.ScanResult;
import com.example.wormhole.model.ShardConfig;
import com.example.wormhole.model.UserMapping;
import com.example.wormhole.model.VerificationOutcome;
import com.example.wormhole.model.VerificationResult;
import com.example.wormhole.model.WorkItem;
import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.service.CandidateScanner;
import com.example.wormhole.service.ProfileVerifier;
import com.example.wormhole.service.RateLimiter;
import com.example.wormhole.storage.ShardStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class VerificationPipelineTest {

    @TempDir
    Path dataDir;

    private ProfileVerifier verifier;
    private CandidateScanner scanner;
    private BilibiliApi bilibiliApi;
    private YouTubeApi youTubeApi;
    private RateLimiter rateLimiter;
    private ExecutorService executor;
    private ShardStore bilibiliStore;
    private ShardStore youtubeStore;
    private VerificationPipeline pipeline;

    @BeforeEach
    void setUp() {
        verifier = mock(ProfileVerifier.class);
        scanner = mock(CandidateScanner.class);
        bilibiliApi = mock(BilibiliApi.class);
        youTubeApi = mock(YouTubeApi.class);
        rateLimiter = new RateLimiter("test", 0);
        executor = Executors.newFixedThreadPool(2);
        bilibiliStore = new ShardStore(dataDir.resolve("b2y"), ShardConfig.DEFAULT, DeleteMode.TRUNCATE,
                TestFixtures.objectMapper(), executor);
        youtubeStore = new ShardStore(dataDir.resolve("y2b"), ShardConfig.DEFAULT, DeleteMode.TRUNCATE,
                TestFixtures.objectMapper(), executor);
        pipeline = new VerificationPipeline(verifier, scanner, bilibiliApi, youTubeApi, rateLimiter,
                bilibiliStore, youtubeStore, TestFixtures.properties(dataDir, 2, 10, Duration.ofHours(1)));
    }

    @AfterEach
    void tearDown() {
        rateLimiter.close();
        executor.shutdownNow();
    }

    private static VerificationResult accepted(String uid, String channelId) {
        UserMapping mapping = TestFixtures.mapping(uid, channelId);
        return VerificationResult.accepted(1, 0.99, List.of("YouTube channel is verified"),
                mapping.metadata(), mapping);
    }

    private static VerificationResult rejected() {
        return VerificationResult.manualReview(0.2, List.of("Insufficient confidence for automatic verification",
                "Manual review required"), null);
    }

    private static YouTubeChannel channel(String id) {
        return new YouTubeChannel(id, "title-" + id, "", null, null, null, null, false);
    }

    @Test
    void verifyBatch_persistsConfirmedPairsInBothDirectionsAndRebuildsIndexes() throws Exception {
        when(verifier.verify("1", "UCone")).thenReturn(accepted("1", "UCone"));
        when(verifier.verify("2", "UCtwo")).thenReturn(rejected());

        PipelineReport report = pipeline.verifyBatch(List.of(WorkItem.of("1", "UCone"), WorkItem.of("2", "UCtwo")));

        assertEquals(List.of("1", "2"), report.outcomes().stream().map(VerificationOutcome::bilibiliUid).toList());
        assertEquals(1, report.successCount());
        assertEquals(1, report.verifiedMappings());
        assertTrue(report.persistenceErrors().isEmpty());

        UserMapping stored = bilibiliStore.read("1").orElseThrow();
        assertEquals(stored, youtubeStore.read("UCone").orElseThrow());
        assertArrayEquals(Files.readAllBytes(bilibiliStore.fullPath("1")),
                Files.readAllBytes(youtubeStore.fullPath("UCone")));
        assertFalse(bilibiliStore.has("2"));
        assertFalse(youtubeStore.has("UCtwo"));

        MappingIndex bilibiliIndex = bilibiliStore.readIndex().orElseThrow();
        MappingIndex youtubeIndex = youtubeStore.readIndex().orElseThrow();
        assertEquals(2, report.bilibiliIndexSize());
        assertEquals(bilibiliStore.shardPath("1"), bilibiliIndex.pathOf("UCone").orElseThrow());
        assertEquals(youtubeStore.shardPath("UCone"), youtubeIndex.pathOf("1").orElseThrow());
    }

    @Test
    void verifyBatch_tagsResultsAndStoredMappingWithIssueNumber() {
        when(verifier.verify("1", "UCone")).thenReturn(accepted("1", "UCone"));

        PipelineReport report = pipeline.verifyBatch(List.of(new WorkItem("1", "UCone", 42)));

        VerificationOutcome outcome = report.outcomes().get(0);
        assertEquals(42, outcome.issueNumber());
        assertEquals(42, outcome.result().metadata().issueNumber());
        assertEquals(42, bilibiliStore.read("1").orElseThrow().metadata().issueNumber());
    }

    @Test
    void verifyBatch_searchesChannelsWhenNoneGiven() {
        when(bilibiliApi.getUserInfo("1")).thenReturn(BilibiliUser.fromRanking("1", "Creator", null));
        when(youTubeApi.searchChannels("Creator", 5)).thenReturn(List.of(channel("UCwrong"), channel("UCright")));
        when(verifier.verify("1", "UCwrong")).thenReturn(rejected());
        when(verifier.verify("1", "UCright")).thenReturn(accepted("1", "UCright"));

        PipelineReport report = pipeline.verifyBatch(List.of(new WorkItem("1", null, null)));

        VerificationOutcome outcome = report.outcomes().get(0);
        assertEquals("UCright", outcome.youtubeChannelId());
        assertTrue(outcome.result().success());
        assertTrue(youtubeStore.read("UCright").isPresent());
    }

    @Test
    void verifyBatch_reportsMissingChannel() {
        when(bilibiliApi.getUserInfo("1")).thenReturn(BilibiliUser.fromRanking("1", "Nobody", null));
        when(youTubeApi.searchChannels("Nobody", 5)).thenReturn(List.of());

        PipelineReport report = pipeline.verifyBatch(List.of(new WorkItem("1", null, null)));

        VerificationResult result = report.outcomes().get(0).result();
        assertFalse(result.success());
        assertEquals(4, result.level());
        assertEquals(List.of("No YouTube channel found"), result.reasons());
    }

    @Test
    void verifyBatch_itemFailureDoesNotStopTheBatch() {
        when(bilibiliApi.getUserInfo("1")).thenThrow(new PlatformFetchException("Bilibili API error: -404"));
        when(verifier.verify("2", "UCtwo")).thenReturn(accepted("2", "UCtwo"));

        PipelineReport report = pipeline.verifyBatch(List.of(new WorkItem("1", null, null), WorkItem.of("2", "UCtwo")));

        assertEquals(List.of("Error: Bilibili API error: -404"), report.outcomes().get(0).result().reasons());
        assertTrue(report.outcomes().get(1).result().success());
        assertTrue(bilibiliStore.has("2"));
    }

    @Test
    void verifyBatch_recordsStoreFailureAndKeepsOtherDirection() throws Exception {
        Path blocked = bilibiliStore.fullPath("1");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("occupied"), "x");
        when(verifier.verify("1", "UCone")).thenReturn(accepted("1", "UCone"));

        PipelineReport report = pipeline.verifyBatch(List.of(WorkItem.of("1", "UCone")));

        assertEquals(1, report.persistenceErrors().size());
        assertTrue(report.persistenceErrors().get(0).startsWith("b2y: "));
        assertTrue(youtubeStore.read("UCone").isPresent());
        assertEquals(2, report.youtubeIndexSize());
    }

    @Test
    void verifyBatch_withNothingConfirmedStillWritesIndexes() {
        when(verifier.verify("1", "UCone")).thenReturn(rejected());

        PipelineReport report = pipeline.verifyBatch(List.of(WorkItem.of("1", "UCone")));

        assertEquals(0, report.verifiedMappings());
        assertEquals(0, bilibiliStore.readIndex().orElseThrow().size());
        assertEquals(0, youtubeStore.readIndex().orElseThrow().size());
    }

    @Test
    void scan_capsUniqueCandidates() {
        List<BilibiliUser> users = List.of(BilibiliUser.fromRanking("1", "a", null),
                BilibiliUser.fromRanking("2", "b", null), BilibiliUser.fromRanking("3", "c", null));
        List<ScanResult> results = List.of(new ScanResult(RankingType.HOT, users, TestFixtures.NOW, 3, 3));
        when(scanner.isColdStart()).thenReturn(false);
        when(scanner.runDailyScan(false)).thenReturn(results);
        when(scanner.deduplicateUsers(results)).thenReturn(users);

        ScanReport report = pipeline.scan();

        assertFalse(report.coldStart());
        assertEquals(List.of("1", "2"), report.uniqueUsers().stream().map(BilibiliUser::uid).toList());
    }

    @Test
    void runDaily_verifiesEveryScannedCandidateBySearch() {
        List<BilibiliUser> users = List.of(BilibiliUser.fromRanking("1", "Creator", null));
        when(scanner.isColdStart()).thenReturn(true);
        when(scanner.runDailyScan(anyBoolean())).thenReturn(List.of());
        when(scanner.deduplicateUsers(anyList())).thenReturn(users);
        when(bilibiliApi.getUserInfo("1")).thenReturn(users.get(0));
        when(youTubeApi.searchChannels("Creator", 5)).thenReturn(List.of(channel("UCone")));
        when(verifier.verify("1", "UCone")).thenReturn(accepted("1", "UCone"));

        PipelineReport report = pipeline.runDaily();

        verify(scanner).runDailyScan(true);
        assertEquals(1, report.successCount());
        assertTrue(bilibiliStore.has("1"));
    }
}
