package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.notice.NoticeGenerator;
import com.mimecast.mailroom.notice.QueueNotifier;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.pipeline.PermanentHandlerException;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes the notice described by a notice request and queues it to the virgin queue.
 * <p>The queued notice is flagged so no notice is ever sent about it.
 */
public class NoticeHandler implements Handler {
    private static final Logger log = LogManager.getLogger(NoticeHandler.class);

    private final NoticeGenerator generator;
    private final QueueStore store;

    public NoticeHandler(NoticeGenerator generator, QueueStore store) {
        this.generator = generator;
        this.store = store;
    }

    @Override
    public String getName() {
        return "notice";
    }

    @Override
    public String getDescription() {
        return "Send rejection and delivery failure notices.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list)
            throws TransientHandlerException, PermanentHandlerException {
        String type = metadata.getString(Metadata.NOTICE_TYPE);
        String recipient = metadata.getString(Metadata.ORIGINAL_SENDER);
        String reason = metadata.getString(Metadata.NOTICE_REASON);
        if (type == null || recipient == null) {
            throw new PermanentHandlerException("Incomplete notice request for " + message.getMessageId());
        }

        MailMessage notice;
        try {
            if (QueueNotifier.TYPE_REJECT.equals(type)) {
                notice = generator.rejection(list, message, recipient, reason);
            } else {
                List<String> failed = metadata.getStringList(Metadata.FAILED_RECIPIENTS);
                notice = generator.deliveryFailure(list, message, recipient, reason, failed);
            }
        } catch (IOException e) {
            throw new PermanentHandlerException("Unable to compose " + type + " notice: " + e.getMessage(), e);
        }

        Metadata noticeMetadata = Metadata.forList(list.getName())
                .put(Metadata.NOTICE, true)
                .put(Metadata.RECIPIENTS, new ArrayList<>(List.of(recipient)))
                .put(Metadata.ENVELOPE_SENDER, "");
        try {
            store.enqueue(QueueNames.VIRGIN, notice, noticeMetadata);
        } catch (StorageException e) {
            throw new TransientHandlerException("Unable to queue notice: " + e.getMessage(), e);
        }
        log.info("Notice queued: type={}, list={}, to={}", type, list.getName(), recipient);
        return HandlerResult.stop();
    }
}
