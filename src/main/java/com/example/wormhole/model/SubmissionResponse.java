package com.example.wormhole.model;

/**
 * Acknowledgement returned once the submission ticket has been filed.
 */
public record SubmissionResponse(
        boolean success,
        String message,
        String issueUrl,
        int issueNumber
) {}
