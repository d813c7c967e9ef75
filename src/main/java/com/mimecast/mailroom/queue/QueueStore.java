package com.mimecast.mailroom.queue;

import com.mimecast.mailroom.mime.MailMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable store of (message, metadata) pairs organised in named queues.
 *
 * <p>Lifecycle of an entry: {@code enqueue} makes it ready; {@code dequeue} claims it into a
 * process private staging area; {@code finish} or {@code requeue} commit the claim.
 * A staged entry survives process death and is made ready again by {@code recover}
 * once it is older than the grace period.
 * <p>An entry is ready in at most one queue at any instant.
 */
public interface QueueStore {

    /**
     * Stores a new ready entry.
     *
     * @param queue    Queue name.
     * @param message  Message.
     * @param metadata Metadata.
     * @return Entry id.
     * @throws StorageException I/O failure; nothing was made visible.
     */
    EntryId enqueue(String queue, MailMessage message, Metadata metadata) throws StorageException;

    /**
     * Lists ready entries, oldest first.
     * <p>Entries whose not-before time lies after {@code now} and entries outside the shard are
     * skipped. The listing is a snapshot; entries may be claimed by others in the meantime.
     *
     * @param queue Queue name.
     * @param shard Shard assignment.
     * @param now   Current time.
     * @return Entry ids.
     * @throws StorageException I/O failure.
     */
    List<EntryId> listReady(String queue, ShardAssignment shard, Instant now) throws StorageException;

    /**
     * Lists every ready entry regardless of shard or not-before time.
     *
     * @param queue Queue name.
     * @return Entry ids, oldest first.
     * @throws StorageException I/O failure.
     */
    List<EntryId> listReady(String queue) throws StorageException;

    /**
     * Claims and loads an entry.
     *
     * @param queue Queue name.
     * @param id    Entry id.
     * @return QueueEntry.
     * @throws EntryNotFoundException Another worker claimed it first.
     * @throws CorruptEntryException  Undecodable; already moved to quarantine.
     * @throws StorageException       I/O failure.
     */
    QueueEntry dequeue(String queue, EntryId id) throws StorageException;

    /**
     * Persists the current state of a claimed entry in place.
     *
     * @param entry Claimed entry.
     * @throws StorageException I/O failure or entry no longer staged.
     */
    void checkpoint(QueueEntry entry) throws StorageException;

    /**
     * Removes a claimed entry. Success commit point.
     *
     * @param queue Queue name.
     * @param id    Entry id.
     * @throws StorageException I/O failure or entry no longer staged.
     */
    void finish(String queue, EntryId id) throws StorageException;

    /**
     * Re-homes a claimed entry into a target queue's ready set.
     *
     * @param queue       Queue it was claimed from.
     * @param id          Entry id.
     * @param message     Possibly mutated message.
     * @param metadata    Possibly mutated metadata.
     * @param targetQueue Target queue.
     * @param notBefore   Earliest processing time, null for immediately.
     * @return Entry id in the target queue.
     * @throws StorageException I/O failure; the entry stays claimed.
     */
    EntryId requeue(String queue, EntryId id, MailMessage message, Metadata metadata,
                    String targetQueue, Instant notBefore) throws StorageException;

    /**
     * Re-homes a claimed entry into a target queue's ready set for immediate processing.
     *
     * @param queue       Queue it was claimed from.
     * @param id          Entry id.
     * @param message     Possibly mutated message.
     * @param metadata    Possibly mutated metadata.
     * @param targetQueue Target queue.
     * @return Entry id in the target queue.
     * @throws StorageException I/O failure; the entry stays claimed.
     */
    default EntryId requeue(String queue, EntryId id, MailMessage message, Metadata metadata,
                            String targetQueue) throws StorageException {
        return requeue(queue, id, message, metadata, targetQueue, null);
    }

    /**
     * Makes abandoned staged entries ready again.
     *
     * @param queue Queue name.
     * @param shard Only entries in this shard are recovered.
     * @param grace Minimum age of a claim before it is considered abandoned.
     * @param now   Current time.
     * @return Number of recovered entries.
     * @throws StorageException I/O failure.
     */
    int recover(String queue, ShardAssignment shard, Duration grace, Instant now) throws StorageException;

    /**
     * Counts ready entries.
     *
     * @param queue Queue name.
     * @return Count.
     * @throws StorageException I/O failure.
     */
    long size(String queue) throws StorageException;
}
