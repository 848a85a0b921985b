package com.flagship.payday.eventstore;

/**
 * A storage backend failed (connection, serialization, constraint other than the stream key).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
