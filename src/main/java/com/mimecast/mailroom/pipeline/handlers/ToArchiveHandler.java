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
 * Queues a copy of the posting for archiving.
 */
public class ToArchiveHandler implements Handler {

    private final QueueStore store;

    public ToArchiveHandler(QueueStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "to-archive";
    }

    @Override
    public String getDescription() {
        return "Send messages to the archive queue.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws TransientHandlerException {
        if (list.isArchive()) {
            try {
                store.enqueue(QueueNames.ARCHIVE, message.copy(), Metadata.forList(list.getName()));
            } catch (StorageException e) {
                throw new TransientHandlerException("Unable to queue archive copy: " + e.getMessage(), e);
            }
        }
        return HandlerResult.proceed();
    }
}
