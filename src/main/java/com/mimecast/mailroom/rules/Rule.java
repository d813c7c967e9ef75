package com.mimecast.mailroom.rules;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;

/**
 * Rule interface.
 *
 * <p>Rules are stateless predicates. A hit may write an annotation into metadata explaining
 * itself but must never touch the message.
 * <p>Annotations are keyed by rule name so evaluating the same rule twice is harmless.
 */
public interface Rule {

    /**
     * Gets rule name as referenced by chain definitions.
     *
     * @return String.
     */
    String getName();

    /**
     * Gets human readable description.
     *
     * @return String.
     */
    String getDescription();

    /**
     * Checks the message.
     *
     * @param message  Message.
     * @param metadata Metadata.
     * @param list     Target list.
     * @return True on hit.
     */
    boolean check(MailMessage message, Metadata metadata, MailingList list);
}
