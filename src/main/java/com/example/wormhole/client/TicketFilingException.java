package com.example.wormhole.client;

/**
 * The ticket tracker rejected or could not be reached for a submission.
 */
public class TicketFilingException extends RuntimeException {

    public TicketFilingException(String message, Throwable cause) {
        super(message, cause);
    }
}
