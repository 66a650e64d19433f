package com.example.wormhole.model;

import java.util.List;

/**
 * Output of a scan run: the per-list results and the merged unique candidates.
 */
public record ScanReport(
        boolean coldStart,
        List<ScanResult> results,
        List<BilibiliUser> uniqueUsers
) {}
