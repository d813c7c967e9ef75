package com.mimecast.mailroom.queue;

/**
 * Entry is no longer where the caller expected it.
 * <p>Usually another runner claimed it first; callers skip it.
 */
public class EntryNotFoundException extends StorageException {

    /**
     * Constructs a new EntryNotFoundException.
     *
     * @param queue Queue name.
     * @param id    Entry id.
     */
    public EntryNotFoundException(String queue, EntryId id) {
        super("Entry not found: " + queue + "/" + id);
    }
}
