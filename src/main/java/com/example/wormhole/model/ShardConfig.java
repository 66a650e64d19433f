package com.example.wormhole.model;

/**
 * Git-style two-level shard layout: {@code ab/cd/abcdef12.json}.
 *
 * @param level1Length hex characters used for the first directory level
 * @param level2Length hex characters used for the second directory level
 * @param hashLength   hex characters of the SHA-256 digest kept in the file name
 */
public record ShardConfig(int level1Length, int level2Length, int hashLength) {

    public static final ShardConfig DEFAULT = new ShardConfig(2, 2, 8);

    /** SHA-256 yields 64 hex characters. */
    private static final int MAX_HASH_LENGTH = 64;

    public ShardConfig {
        if (level1Length <= 0 || level2Length <= 0 || hashLength <= 0) {
            throw new IllegalArgumentException("shard lengths must be positive");
        }
        if (hashLength > MAX_HASH_LENGTH) {
            throw new IllegalArgumentException("hashLength cannot exceed " + MAX_HASH_LENGTH);
        }
        if (level1Length + level2Length > hashLength) {
            throw new IllegalArgumentException(
                    "level1Length + level2Length (%d) exceeds hashLength (%d)"
                            .formatted(level1Length + level2Length, hashLength));
        }
    }
}
