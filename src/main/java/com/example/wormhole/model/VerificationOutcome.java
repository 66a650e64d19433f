package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A verification result annotated with the work item it came from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationOutcome(
        String bilibiliUid,
        String youtubeChannelId,
        Integer issueNumber,
        VerificationResult result
) {}
