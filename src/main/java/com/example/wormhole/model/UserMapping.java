package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Confirmed link between one Bilibili user and one YouTube channel.
 * <p>
 * The same record is stored twice, once keyed by {@code bilibiliUid} and once by
 * {@code youtubeChannelId}; both copies serialize to identical bytes.
 *
 * @param bilibiliUid         Bilibili user id (digits)
 * @param bilibiliUsername    Bilibili display name
 * @param bilibiliAvatar      Bilibili avatar URL, may be null
 * @param youtubeChannelId    YouTube channel id
 * @param youtubeChannelName  YouTube channel title
 * @param youtubeAvatar       YouTube avatar URL, may be null
 * @param verificationLevel   1 (strongest) to 4 (manual review)
 * @param verifiedAt          when the mapping was confirmed
 * @param verifiedBy          automatic or manual confirmation
 * @param metadata            evidence collected during verification
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserMapping(
        String bilibiliUid,
        String bilibiliUsername,
        String bilibiliAvatar,
        String youtubeChannelId,
        String youtubeChannelName,
        String youtubeAvatar,
        int verificationLevel,
        Instant verifiedAt,
        VerifiedBy verifiedBy,
        VerificationMetadata metadata
) {
    public UserMapping {
        if (verificationLevel < 1 || verificationLevel > 4) {
            throw new IllegalArgumentException("verificationLevel must be within 1..4: " + verificationLevel);
        }
    }

    /** Creates a copy with new metadata. */
    public UserMapping withMetadata(VerificationMetadata newMetadata) {
        return new UserMapping(bilibiliUid, bilibiliUsername, bilibiliAvatar, youtubeChannelId, youtubeChannelName,
                youtubeAvatar, verificationLevel, verifiedAt, verifiedBy, newMetadata);
    }
}
