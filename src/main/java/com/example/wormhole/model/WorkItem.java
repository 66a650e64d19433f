package com.example.wormhole.model;

/**
 * One pair to verify.
 *
 * @param bilibiliUid      Bilibili user id
 * @param youtubeChannelId YouTube channel id; null means "search for a channel"
 * @param issueNumber      originating ticket, may be null
 */
public record WorkItem(String bilibiliUid, String youtubeChannelId, Integer issueNumber) {

    public static WorkItem of(String bilibiliUid, String youtubeChannelId) {
        return new WorkItem(bilibiliUid, youtubeChannelId, null);
    }
}
