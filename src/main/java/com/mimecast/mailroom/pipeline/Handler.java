package com.mimecast.mailroom.pipeline;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;

/**
 * Handler interface.
 *
 * <p>Handlers transform the message and metadata in place and decide what happens next.
 * The executor skips handlers already marked complete in metadata, so a handler runs at most
 * once per entry unless the process dies between its side effect and the following checkpoint.
 */
public interface Handler {

    /**
     * Gets handler name as referenced by pipeline definitions.
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
     * Processes the message.
     *
     * @param message  Message.
     * @param metadata Metadata.
     * @param list     Target list.
     * @return HandlerResult.
     * @throws TransientHandlerException Retry later.
     * @throws PermanentHandlerException Give up and notify the sender.
     * @throws HandlerException          Unexpected failure.
     */
    HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws HandlerException;
}
