package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;

/**
 * Forwards the entry to the outgoing queue.
 */
public class ToOutgoingHandler implements Handler {

    @Override
    public String getName() {
        return "to-outgoing";
    }

    @Override
    public String getDescription() {
        return "Send posts to the outgoing queue.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        return HandlerResult.forward(QueueNames.OUT);
    }
}
