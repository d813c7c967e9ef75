package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.delivery.DeliveryAgent;
import com.mimecast.mailroom.delivery.DeliveryResult;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.metrics.QueueMetrics;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.pipeline.PermanentHandlerException;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Hands the message to the delivery agent.
 * <p>Failed recipients of a permanent failure are recorded in metadata for the notice.
 */
public class DeliverHandler implements Handler {
    private static final Logger log = LogManager.getLogger(DeliverHandler.class);

    private final DeliveryAgent agent;

    public DeliverHandler(DeliveryAgent agent) {
        this.agent = agent;
    }

    @Override
    public String getName() {
        return "deliver";
    }

    @Override
    public String getDescription() {
        return "Deliver the message to its recipients.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list)
            throws TransientHandlerException, PermanentHandlerException {
        List<String> recipients = metadata.getStringList(Metadata.RECIPIENTS);
        String envelopeSender = metadata.containsKey(Metadata.ENVELOPE_SENDER)
                ? metadata.getString(Metadata.ENVELOPE_SENDER)
                : list.getBouncesAddress();

        DeliveryResult result = agent.deliver(message, recipients, envelopeSender);
        switch (result.getStatus()) {
            case SUCCESS:
                QueueMetrics.incrementDelivered(QueueNames.OUT);
                log.info("Delivered: messageId={}, list={}, recipients={}", message.getMessageId(), list.getName(), recipients.size());
                return HandlerResult.stop();
            case TRANSIENT_FAILURE:
                throw new TransientHandlerException("Delivery failed: " + result.getDetail());
            default:
                metadata.put(Metadata.FAILED_RECIPIENTS, result.getFailedRecipients().isEmpty()
                        ? recipients : result.getFailedRecipients());
                throw new PermanentHandlerException("Delivery failed permanently: " + result.getDetail());
        }
    }
}
