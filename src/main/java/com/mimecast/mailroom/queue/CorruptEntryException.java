package com.mimecast.mailroom.queue;

/**
 * Queue record that cannot be decoded.
 * <p>The record has already been moved to the quarantine queue when this is thrown by the store.
 */
public class CorruptEntryException extends StorageException {

    /**
     * Constructs a new CorruptEntryException.
     *
     * @param message Message.
     */
    public CorruptEntryException(String message) {
        super(message);
    }

    /**
     * Constructs a new CorruptEntryException.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
