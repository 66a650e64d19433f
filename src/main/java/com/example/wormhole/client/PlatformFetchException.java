package com.example.wormhole.client;

/**
 * Any failure reaching or decoding a platform API.
 */
public class PlatformFetchException extends RuntimeException {

    public PlatformFetchException(String message) {
        super(message);
    }

    public PlatformFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
