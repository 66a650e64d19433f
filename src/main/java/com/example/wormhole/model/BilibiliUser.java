package com.example.wormhole.model;

/**
 * Bilibili user profile as returned by the space and ranking endpoints.
 * Ranking entries only carry {@code uid}, {@code name} and {@code face}; the rest default to empty/zero.
 *
 * @param uid      numeric user id as a string
 * @param name     display name
 * @param face     avatar URL
 * @param sign     profile bio
 * @param follower follower count, null when unknown
 * @param level    account level
 * @param official official certification, null when absent
 */
public record BilibiliUser(
        String uid,
        String name,
        String face,
        String sign,
        Long follower,
        int level,
        Official official
) {
    public record Official(int type, String desc) {}

    /** Minimal profile built from a ranking entry. */
    public static BilibiliUser fromRanking(String uid, String name, String face) {
        return new BilibiliUser(uid, name, face, "", null, 0, null);
    }
}
