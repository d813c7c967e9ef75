package com.mimecast.mailroom.queue;

import java.io.IOException;

/**
 * Queue store I/O failure.
 * <p>Runners retry with backoff; the entry itself is left untouched.
 */
public class StorageException extends IOException {

    /**
     * Constructs a new StorageException.
     *
     * @param message Message.
     */
    public StorageException(String message) {
        super(message);
    }

    /**
     * Constructs a new StorageException.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
