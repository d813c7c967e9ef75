package com.mimecast.mailroom.queue;

import com.mimecast.mailroom.mime.MailMessage;

/**
 * A claimed queue entry: identifier bound to its message and metadata.
 */
public class QueueEntry {

    private final String queue;
    private final EntryId id;
    private final MailMessage message;
    private final Metadata metadata;

    /**
     * Constructs a new QueueEntry.
     *
     * @param queue    Queue the entry was claimed from.
     * @param id       Entry id.
     * @param message  Message.
     * @param metadata Metadata.
     */
    public QueueEntry(String queue, EntryId id, MailMessage message, Metadata metadata) {
        this.queue = queue;
        this.id = id;
        this.message = message;
        this.metadata = metadata;
    }

    public String getQueue() {
        return queue;
    }

    public EntryId getId() {
        return id;
    }

    public MailMessage getMessage() {
        return message;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    /**
     * Gets the list the entry targets.
     *
     * @return List name or null.
     */
    public String getListName() {
        return metadata.getListName();
    }

    @Override
    public String toString() {
        return queue + "/" + id;
    }
}
