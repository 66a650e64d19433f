package com.example.wormhole.storage;

/**
 * File-system failure while reading or writing a shard store.
 * Missing and unparsable records are reported as absent, never with this exception.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
