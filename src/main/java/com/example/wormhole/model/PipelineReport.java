package com.example.wormhole.model;

import java.util.List;

/**
 * Result of a batch verification run.
 *
 * @param outcomes          one entry per work item, in input order
 * @param verifiedMappings  mappings handed to both stores
 * @param persistenceErrors storage failures reported by the stores, empty when every write succeeded
 * @param bilibiliIndexSize entries in the rebuilt b2y index
 * @param youtubeIndexSize  entries in the rebuilt y2b index
 */
public record PipelineReport(
        List<VerificationOutcome> outcomes,
        int verifiedMappings,
        List<String> persistenceErrors,
        int bilibiliIndexSize,
        int youtubeIndexSize
) {
    public long successCount() {
        return outcomes.stream().filter(o -> o.result().success()).count();
    }
}
