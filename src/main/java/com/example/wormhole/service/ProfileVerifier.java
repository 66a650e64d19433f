package com.example.wormhole.service;

import com.example.wormhole.client.BilibiliApi;
import com.example.wormhole.client.YouTubeApi;
import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.BilibiliVideo;
import com.example.wormhole.model.UserMapping;
import com.example.wormhole.model.VerificationMetadata;
import com.example.wormhole.model.VerificationResult;
import com.example.wormhole.model.VerifiedBy;
import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.model.YouTubeVideo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Multi-level verification of a (Bilibili UID, YouTube channel) pair.
 * <p>
 * Levels are tried in order and the first one that succeeds wins:
 * <ol>
 *   <li>YouTube channel verified and normalized names at least 80% similar</li>
 *   <li>either bio points at the other platform</li>
 *   <li>weighted score of name similarity, shared video titles and audience ratio reaches 0.7</li>
 *   <li>manual review: nothing above succeeded, or a fetch failed</li>
 * </ol>
 * {@link #verify(String, String)} never throws; failures become level-4 results with the
 * cause in {@code reasons}.
 */
@Service
public class ProfileVerifier {

    private static final Logger log = LoggerFactory.getLogger(ProfileVerifier.class);

    static final double LEVEL1_NAME_THRESHOLD = 0.8;
    static final double LEVEL2_CONFIDENCE = 0.85;
    static final double LEVEL3_THRESHOLD = 0.7;
    static final double TITLE_MATCH_THRESHOLD = 0.7;
    static final int RECENT_CONTENT_SAMPLE = 10;
    static final double MIN_AUDIENCE_RATIO = 0.5;
    static final double MAX_AUDIENCE_RATIO = 2.0;

    private static final List<String> YOUTUBE_LINK_PATTERNS = List.of("youtube.com", "youtu.be");
    /** "b站" is the colloquial short name of Bilibili. */
    private static final List<String> BILIBILI_LINK_PATTERNS = List.of("bilibili.com", "b站", "b站空间");

    private final BilibiliApi bilibiliApi;
    private final YouTubeApi youTubeApi;
    private final Clock clock;

    public ProfileVerifier(BilibiliApi bilibiliApi, YouTubeApi youTubeApi, Clock clock) {
        this.bilibiliApi = bilibiliApi;
        this.youTubeApi = youTubeApi;
        this.clock = clock;
    }

    public VerificationResult verify(String bilibiliUid, String youtubeChannelId) {
        try {
            return cascade(bilibiliUid, youtubeChannelId);
        } catch (Exception e) {
            log.warn("Verification of {} -> {} aborted: {}", bilibiliUid, youtubeChannelId, e.getMessage());
            return VerificationResult.failed("Verification failed: " + describe(e));
        }
    }

    private VerificationResult cascade(String bilibiliUid, String youtubeChannelId) {
        BilibiliUser user = bilibiliApi.getUserInfo(bilibiliUid);
        YouTubeChannel channel = youTubeApi.getChannel(youtubeChannelId);

        Evidence evidence = new Evidence();
        evidence.bilibiliFollowers = user.follower();
        evidence.youtubeSubscribers = channel.subscriberCount();

        double nameSimilarity = StringSimilarity.nameSimilarity(user.name(), channel.title());

        // ── Level 1: verified channel + name match ──
        if (channel.verified()) {
            evidence.youtubeVerified = true;
            evidence.usernameSimilarity = nameSimilarity;
            if (nameSimilarity >= LEVEL1_NAME_THRESHOLD) {
                log.debug("{} -> {}: level 1 (name similarity {})", bilibiliUid, youtubeChannelId, nameSimilarity);
                return accept(1, 0.95 + nameSimilarity * 0.05,
                        List.of("YouTube channel is verified", "Username similarity: " + percent(nameSimilarity)),
                        user, channel, evidence);
            }
        }

        // ── Level 2: cross-platform bio reference ──
        boolean bioMatch = bioMentionsOtherPlatform(user, channel, bilibiliUid, youtubeChannelId);
        evidence.bioMatch = bioMatch;
        if (bioMatch) {
            evidence.usernameSimilarity = nameSimilarity;
            log.debug("{} -> {}: level 2 (bio reference)", bilibiliUid, youtubeChannelId);
            return accept(2, LEVEL2_CONFIDENCE,
                    List.of("Cross-platform bio mentions detected", "Bio contains platform link"),
                    user, channel, evidence);
        }

        // ── Level 3: weighted similarity ──
        evidence.usernameSimilarity = nameSimilarity;
        List<BilibiliVideo> bilibiliVideos = bilibiliApi.getUserVideos(bilibiliUid, 1, RECENT_CONTENT_SAMPLE);
        List<YouTubeVideo> youtubeVideos = youTubeApi.getChannelVideos(youtubeChannelId, RECENT_CONTENT_SAMPLE);
        int matchingVideos = countMatchingTitles(bilibiliVideos, youtubeVideos);
        evidence.matchingVideos = matchingVideos;

        double confidence = 0.0;
        List<String> reasons = new ArrayList<>();

        if (nameSimilarity >= 0.8) {
            confidence += 0.4;
            reasons.add("High username similarity: " + percent(nameSimilarity));
        } else if (nameSimilarity >= 0.6) {
            confidence += 0.2;
            reasons.add("Moderate username similarity: " + percent(nameSimilarity));
        }

        if (matchingVideos >= 3) {
            confidence += 0.3;
            reasons.add(matchingVideos + " matching video titles");
        } else if (matchingVideos >= 1) {
            confidence += 0.15;
            reasons.add(matchingVideos + " matching video title(s)");
        }

        Double ratio = audienceRatio(user.follower(), channel.subscriberCount());
        if (ratio == null) {
            reasons.add("Audience size check skipped: missing follower or subscriber count");
        } else if (ratio >= MIN_AUDIENCE_RATIO && ratio <= MAX_AUDIENCE_RATIO) {
            confidence += 0.15;
            reasons.add("Follower count ratio is reasonable");
        }

        if (confidence >= LEVEL3_THRESHOLD) {
            log.debug("{} -> {}: level 3 (confidence {})", bilibiliUid, youtubeChannelId, confidence);
            return accept(3, confidence, reasons, user, channel, evidence);
        }

        // ── Level 4: manual review ──
        List<String> reviewReasons = new ArrayList<>();
        reviewReasons.add("Insufficient confidence for automatic verification");
        reviewReasons.addAll(reasons);
        reviewReasons.add("Manual review required");
        log.debug("{} -> {}: manual review (confidence {})", bilibiliUid, youtubeChannelId, confidence);
        return VerificationResult.manualReview(confidence, reviewReasons, evidence.toMetadata());
    }

    /**
     * Case-insensitive substring search in both directions.
     */
    static boolean bioMentionsOtherPlatform(BilibiliUser user, YouTubeChannel channel,
                                            String bilibiliUid, String youtubeChannelId) {
        String sign = lower(user.sign());
        String description = lower(channel.description());

        boolean bilibiliMentionsYouTube = mentions(sign, lower(youtubeChannelId))
                || YOUTUBE_LINK_PATTERNS.stream().anyMatch(sign::contains);
        boolean youtubeMentionsBilibili = mentions(description, lower(bilibiliUid))
                || BILIBILI_LINK_PATTERNS.stream().anyMatch(description::contains);

        return bilibiliMentionsYouTube || youtubeMentionsBilibili;
    }

    /**
     * Counts Bilibili videos with at least one YouTube title at least 70% similar.
     * Each Bilibili video counts once; YouTube videos are not consumed by a match.
     */
    static int countMatchingTitles(List<BilibiliVideo> bilibiliVideos, List<YouTubeVideo> youtubeVideos) {
        int matches = 0;
        for (BilibiliVideo bilibiliVideo : bilibiliVideos.subList(0, Math.min(RECENT_CONTENT_SAMPLE, bilibiliVideos.size()))) {
            String title = lower(bilibiliVideo.title());
            for (YouTubeVideo youtubeVideo : youtubeVideos.subList(0, Math.min(RECENT_CONTENT_SAMPLE, youtubeVideos.size()))) {
                if (StringSimilarity.similarity(title, lower(youtubeVideo.title())) >= TITLE_MATCH_THRESHOLD) {
                    matches++;
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Subscribers per follower; null when either count is missing or the follower count is zero.
     */
    static Double audienceRatio(Long followers, Long subscribers) {
        if (followers == null || subscribers == null || followers == 0) {
            return null;
        }
        return (double) subscribers / followers;
    }

    private VerificationResult accept(int level, double confidence, List<String> reasons,
                                      BilibiliUser user, YouTubeChannel channel, Evidence evidence) {
        VerificationMetadata metadata = evidence.toMetadata();
        UserMapping mapping = new UserMapping(
                user.uid(),
                user.name(),
                user.face(),
                channel.id(),
                channel.title(),
                channel.thumbnails() != null ? channel.thumbnails().high() : null,
                level,
                clock.instant(),
                VerifiedBy.AUTO,
                metadata);
        return VerificationResult.accepted(level, confidence, reasons, metadata, mapping);
    }

    private static String percent(double similarity) {
        return String.format(Locale.ROOT, "%.1f%%", similarity * 100);
    }

    private static boolean mentions(String text, String id) {
        return !id.isEmpty() && text.contains(id);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Mutable accumulator for the metadata filled in level by level. */
    private static final class Evidence {
        Long bilibiliFollowers;
        Long youtubeSubscribers;
        Double usernameSimilarity;
        Boolean bioMatch;
        Boolean youtubeVerified;
        Integer matchingVideos;

        VerificationMetadata toMetadata() {
            return new VerificationMetadata(bilibiliFollowers, youtubeSubscribers, null,
                    usernameSimilarity, bioMatch, youtubeVerified, matchingVideos, null);
        }
    }
}
