package com.mimecast.mailroom.notice;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Notifier queueing notice requests into the bounces queue.
 * <p>The notice message itself is composed later by the bounces runner.
 */
public class QueueNotifier implements Notifier {
    private static final Logger log = LogManager.getLogger(QueueNotifier.class);

    public static final String TYPE_REJECT = "reject";
    public static final String TYPE_FAILURE = "failure";

    private final QueueStore store;

    public QueueNotifier(QueueStore store) {
        this.store = store;
    }

    @Override
    public boolean notifyRejection(MailingList list, MailMessage original, Metadata metadata, String reason) throws StorageException {
        return enqueue(list, original, metadata, TYPE_REJECT, reason, List.of());
    }

    @Override
    public boolean notifyFailure(MailingList list, MailMessage original, Metadata metadata, String reason,
                                 List<String> failedRecipients) throws StorageException {
        return enqueue(list, original, metadata, TYPE_FAILURE, reason, failedRecipients);
    }

    private boolean enqueue(MailingList list, MailMessage original, Metadata metadata, String type,
                            String reason, List<String> failedRecipients) throws StorageException {
        String sender = original.getSender();
        if (!isNotifiable(list, original, metadata, sender)) {
            log.info("Not sending {} notice for {}: sender={}", type, original.getMessageId(), sender);
            return false;
        }

        Metadata request = Metadata.forList(list.getName())
                .put(Metadata.NOTICE_TYPE, type)
                .put(Metadata.NOTICE_REASON, reason)
                .put(Metadata.ORIGINAL_SENDER, sender)
                .put(Metadata.FAILED_RECIPIENTS, new ArrayList<>(failedRecipients));
        EntryId id = store.enqueue(QueueNames.BOUNCES, original.copy(), request);
        log.info("Queued {} notice: id={}, list={}, sender={}, reason={}", type, id, list.getName(), sender, reason);
        return true;
    }

    /**
     * Loop guard.
     */
    static boolean isNotifiable(MailingList list, MailMessage original, Metadata metadata, String sender) {
        if (metadata.getBoolean(Metadata.NOTICE) || metadata.containsKey(Metadata.NOTICE_TYPE) || sender == null) {
            return false;
        }
        String autoSubmitted = original.getHeader("Auto-Submitted");
        if (autoSubmitted != null && !autoSubmitted.trim().toLowerCase(Locale.ROOT).startsWith("no")) {
            return false;
        }
        String local = sender.contains("@") ? sender.substring(0, sender.indexOf('@')) : sender;
        return !local.equalsIgnoreCase("mailer-daemon") && !local.equalsIgnoreCase("postmaster")
                && !sender.equalsIgnoreCase(list.getBouncesAddress())
                && !sender.equalsIgnoreCase(list.getPostingAddress());
    }
}
