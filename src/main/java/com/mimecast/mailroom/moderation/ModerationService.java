package com.mimecast.mailroom.moderation;

import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueRecordCodec;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.StorageException;
import com.mimecast.mailroom.notice.Notifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Moderator actions on held messages.
 *
 * <p>Approving re-injects the held message into the incoming queue with the holding rule bypassed
 * and the moderator approval flag set, so the next evaluation does not hold it again for the same reason.
 * Rejecting notifies the sender. Discarding drops the message silently.
 * <p>Side effects happen before the ledger transition; a crash in between leaves the hold pending
 * and a repeated resolve repeats them.
 */
public class ModerationService {
    private static final Logger log = LogManager.getLogger(ModerationService.class);

    public static final String DEFAULT_REJECT_REASON = "Your message was rejected by the list moderator";

    private final HoldLedger ledger;
    private final QueueStore store;
    private final Notifier notifier;
    private final Clock clock;

    /**
     * Constructs a new ModerationService.
     *
     * @param ledger   Hold ledger.
     * @param store    Queue store approved messages are injected into.
     * @param notifier Notifier for rejections.
     * @param clock    Clock.
     */
    public ModerationService(HoldLedger ledger, QueueStore store, Notifier notifier, Clock clock) {
        this.ledger = ledger;
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Lists pending holds of a list.
     *
     * @param list List.
     * @return List of HoldRecord, oldest first.
     * @throws StorageException I/O failure.
     */
    public List<HoldRecord> pending(MailingList list) throws StorageException {
        return ledger.pending(list.getName());
    }

    /**
     * Resolves a hold.
     *
     * @param id          Hold id.
     * @param disposition Terminal disposition.
     * @param list        List the hold belongs to.
     * @param comment     Moderator comment used as rejection reason, may be null.
     * @return Updated HoldRecord.
     * @throws StorageException         I/O failure.
     * @throws IllegalArgumentException Unknown id or non terminal disposition.
     * @throws IllegalStateException    Already resolved differently.
     */
    public HoldRecord resolve(HoldId id, HoldDisposition disposition, MailingList list, String comment) throws StorageException {
        if (!disposition.isTerminal()) {
            throw new IllegalArgumentException("Cannot resolve to " + disposition);
        }
        HoldRecord record = ledger.get(id).orElseThrow(() -> new IllegalArgumentException("No such hold: " + id));
        if (!record.isPending()) {
            return ledger.resolve(id, disposition);
        }

        Optional<QueueRecordCodec.Record> held = ledger.getMessage(id);
        switch (disposition) {
            case APPROVED:
                if (held.isEmpty()) {
                    throw new StorageException("Held message missing for " + id);
                }
                approve(id, record, held.get());
                break;
            case REJECTED:
                if (held.isPresent()) {
                    notifier.notifyRejection(list, held.get().getMessage(), held.get().getMetadata(),
                            comment != null ? comment : DEFAULT_REJECT_REASON);
                } else {
                    log.warn("Held message missing for {}, rejecting without notice", id);
                }
                break;
            default:
                break;
        }

        return ledger.resolve(id, disposition);
    }

    /**
     * Discards pending holds older than each list's hold limit.
     *
     * @param lists Lists to check.
     * @return Number of expired holds.
     */
    public int expire(ListRegistry lists) {
        Instant now = clock.instant();
        int expired = 0;
        for (MailingList list : lists.getLists()) {
            if (list.getMaxDaysToHold() <= 0) {
                continue;
            }
            Instant cutoff = now.minus(Duration.ofDays(list.getMaxDaysToHold()));
            try {
                for (HoldRecord record : ledger.pending(list.getName())) {
                    if (record.getHeldAt().isBefore(cutoff)) {
                        ledger.resolve(record.getId(), HoldDisposition.DISCARDED);
                        log.info("Expired hold {} held since {}", record.getId(), record.getHeldAt());
                        expired++;
                    }
                }
            } catch (StorageException | IllegalStateException e) {
                log.error("Unable to expire holds for {}: {}", list.getName(), e.getMessage());
            }
        }
        return expired;
    }

    private void approve(HoldId id, HoldRecord record, QueueRecordCodec.Record held) throws StorageException {
        Metadata metadata = held.getMetadata().copy();
        if (record.getRule() != null) {
            metadata.addToList(Metadata.BYPASS_RULES, record.getRule());
        }
        metadata.put(Metadata.MODERATOR_APPROVED, true)
                .remove(Metadata.VERDICT)
                .remove(Metadata.HOLD_ID)
                .remove(Metadata.COMPLETED)
                .remove(Metadata.RETRY_COUNT)
                .remove(Metadata.STORAGE_FAILURES)
                .remove(Metadata.NOT_BEFORE)
                .remove(Metadata.LAST_ERROR);
        metadata.recordDecision("moderation", "approved", id.toString(), clock.instant());

        EntryId entryId = store.enqueue(QueueNames.IN, held.getMessage(), metadata);
        log.info("Approved hold {} re-injected as {}/{}", id, QueueNames.IN, entryId);
    }
}
