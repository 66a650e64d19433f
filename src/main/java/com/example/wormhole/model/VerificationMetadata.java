package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Evidence trail collected while a pair is verified.
 * Every field is optional and filled in as the verification levels are attempted.
 *
 * @param bilibiliFollowers   Bilibili follower count
 * @param youtubeSubscribers  YouTube subscriber count (hidden counts stay null)
 * @param avatarSimilarity    avatar similarity score (0.0-1.0)
 * @param usernameSimilarity  normalized display-name similarity (0.0-1.0)
 * @param bioMatch            whether either bio references the other platform
 * @param youtubeVerified     whether the YouTube channel carries the verified flag
 * @param matchingVideos      number of recent video titles found on both platforms
 * @param issueNumber         ticket number when the pair was submitted by a user
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationMetadata(
        Long bilibiliFollowers,
        Long youtubeSubscribers,
        Double avatarSimilarity,
        Double usernameSimilarity,
        Boolean bioMatch,
        Boolean youtubeVerified,
        Integer matchingVideos,
        Integer issueNumber
) {

    public static VerificationMetadata empty() {
        return new VerificationMetadata(null, null, null, null, null, null, null, null);
    }

    /** Creates a copy carrying the given ticket number. */
    public VerificationMetadata withIssueNumber(Integer newIssueNumber) {
        return new VerificationMetadata(bilibiliFollowers, youtubeSubscribers, avatarSimilarity,
                usernameSimilarity, bioMatch, youtubeVerified, matchingVideos, newIssueNumber);
    }
}
