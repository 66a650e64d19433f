package com.example.wormhole.model;

import java.time.Instant;
import java.util.List;

/**
 * Candidates found on one ranked list after dropping already mapped users.
 *
 * @param type         list that was scanned
 * @param users        new candidates in ranking order
 * @param scannedAt    scan timestamp
 * @param totalScanned users on the list before filtering
 * @param newUsers     users kept after filtering
 */
public record ScanResult(
        RankingType type,
        List<BilibiliUser> users,
        Instant scannedAt,
        int totalScanned,
        int newUsers
) {
    public ScanResult {
        users = List.copyOf(users);
    }
}
