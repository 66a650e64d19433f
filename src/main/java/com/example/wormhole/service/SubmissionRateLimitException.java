package com.example.wormhole.service;

/**
 * A client exceeded its submission allowance for the current window.
 */
public class SubmissionRateLimitException extends RuntimeException {

    public SubmissionRateLimitException(String clientKey) {
        super("Rate limit exceeded for " + clientKey);
    }
}
