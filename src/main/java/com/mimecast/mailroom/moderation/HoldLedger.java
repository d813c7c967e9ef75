package com.mimecast.mailroom.moderation;

import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueRecordCodec;
import com.mimecast.mailroom.queue.StorageException;

import java.util.List;
import java.util.Optional;

/**
 * Per-list ledger of held messages awaiting a moderator decision.
 */
public interface HoldLedger {

    /**
     * Records a held message.
     * <p>Idempotent on the Message-ID while the record is pending: holding the same message again
     * returns the existing id and leaves the existing record untouched. Once that record is resolved
     * the message is held under a new id.
     *
     * @param listName List name.
     * @param message  Held message, persisted with the record.
     * @param metadata Metadata at hold time.
     * @param reason   Hold reason.
     * @param rule     Rule that triggered the hold.
     * @return HoldId.
     * @throws StorageException I/O failure.
     */
    HoldId record(String listName, MailMessage message, Metadata metadata, String reason, String rule) throws StorageException;

    /**
     * Gets a hold record.
     *
     * @param id Hold id.
     * @return Optional of HoldRecord.
     * @throws StorageException I/O failure.
     */
    Optional<HoldRecord> get(HoldId id) throws StorageException;

    /**
     * Loads the held message and metadata.
     *
     * @param id Hold id.
     * @return Optional of record.
     * @throws StorageException I/O failure or corrupt record.
     */
    Optional<QueueRecordCodec.Record> getMessage(HoldId id) throws StorageException;

    /**
     * Lists pending records of a list, oldest first.
     *
     * @param listName List name.
     * @return List of HoldRecord.
     * @throws StorageException I/O failure.
     */
    List<HoldRecord> pending(String listName) throws StorageException;

    /**
     * Transitions a pending record to a terminal disposition and drops the held message.
     * <p>Resolving again with the same disposition returns the record unchanged.
     *
     * @param id          Hold id.
     * @param disposition Terminal disposition.
     * @return Updated HoldRecord.
     * @throws StorageException         I/O failure.
     * @throws IllegalArgumentException Unknown id or non terminal disposition.
     * @throws IllegalStateException    Already resolved differently.
     */
    HoldRecord resolve(HoldId id, HoldDisposition disposition) throws StorageException;
}
