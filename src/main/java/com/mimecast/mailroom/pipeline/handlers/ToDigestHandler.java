package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.StorageException;

/**
 * Queues a copy of the posting for digest collection when the list has digest members.
 */
public class ToDigestHandler implements Handler {

    private final QueueStore store;

    public ToDigestHandler(QueueStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "to-digest";
    }

    @Override
    public String getDescription() {
        return "Add the message to the digest, possibly sending it.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws TransientHandlerException {
        if (list.isDigestsEnabled() && !list.getDigestMembers().isEmpty()) {
            try {
                store.enqueue(QueueNames.DIGEST, message.copy(), Metadata.forList(list.getName()));
            } catch (StorageException e) {
                throw new TransientHandlerException("Unable to queue digest copy: " + e.getMessage(), e);
            }
        }
        return HandlerResult.proceed();
    }
}
