package com.mimecast.mailroom.notice;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.StorageException;

import java.util.List;

/**
 * Sends notices back to senders.
 * <p>Notices are never sent about notices or to senders that cannot be determined.
 */
public interface Notifier {

    /**
     * Notifies the sender that a posting was rejected.
     *
     * @param list     List.
     * @param original Rejected message.
     * @param metadata Metadata of the rejected message.
     * @param reason   Rejection reason.
     * @return True if a notice was queued.
     * @throws StorageException Unable to queue the notice.
     */
    boolean notifyRejection(MailingList list, MailMessage original, Metadata metadata, String reason) throws StorageException;

    /**
     * Notifies the sender of a permanent delivery failure.
     *
     * @param list             List.
     * @param original         Undeliverable message.
     * @param metadata         Metadata of the undeliverable message.
     * @param reason           Diagnostic.
     * @param failedRecipients Recipients that failed.
     * @return True if a notice was queued.
     * @throws StorageException Unable to queue the notice.
     */
    boolean notifyFailure(MailingList list, MailMessage original, Metadata metadata, String reason,
                          List<String> failedRecipients) throws StorageException;
}
