package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one verification attempt. Not persisted as-is.
 *
 * @param success    true when an automatic level (1-3) accepted the pair
 * @param level      verification level reached (4 = manual review)
 * @param confidence evidence strength (0.0-1.0)
 * @param reasons    ordered, human-readable explanation of the decision
 * @param metadata   evidence collected so far
 * @param mapping    the finished mapping, present only when {@code success} is true
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(
        boolean success,
        int level,
        double confidence,
        List<String> reasons,
        VerificationMetadata metadata,
        UserMapping mapping
) {
    public VerificationResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        metadata = metadata == null ? VerificationMetadata.empty() : metadata;
        if (success != (mapping != null)) {
            throw new IllegalArgumentException("mapping must be present exactly when verification succeeds");
        }
    }

    public static VerificationResult accepted(int level, double confidence, List<String> reasons,
                                              VerificationMetadata metadata, UserMapping mapping) {
        return new VerificationResult(true, level, confidence, reasons, metadata, mapping);
    }

    /** Level-4 result routed to manual review. */
    public static VerificationResult manualReview(double confidence, List<String> reasons,
                                                  VerificationMetadata metadata) {
        return new VerificationResult(false, 4, confidence, reasons, metadata, null);
    }

    /** Level-4 result for an attempt aborted by an error. */
    public static VerificationResult failed(String reason) {
        return new VerificationResult(false, 4, 0.0, List.of(reason), VerificationMetadata.empty(), null);
    }

    /** Creates a copy whose metadata (and mapping metadata) reference the originating ticket. */
    public VerificationResult withIssueNumber(Integer issueNumber) {
        if (issueNumber == null) {
            return this;
        }
        VerificationMetadata tagged = metadata.withIssueNumber(issueNumber);
        UserMapping taggedMapping = mapping == null ? null
                : mapping.withMetadata(mapping.metadata() == null
                        ? VerificationMetadata.empty().withIssueNumber(issueNumber)
                        : mapping.metadata().withIssueNumber(issueNumber));
        return new VerificationResult(success, level, confidence, reasons, tagged, taggedMapping);
    }
}
