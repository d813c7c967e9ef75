package com.mimecast.mailroom.delivery;

import com.mimecast.mailroom.mime.MailMessage;

import java.util.List;

/**
 * Outbound delivery boundary.
 */
public interface DeliveryAgent {

    /**
     * Hands a message over for delivery.
     * <p>Implementations report failures through the result rather than by throwing.
     *
     * @param message        Message.
     * @param recipients     Envelope recipients.
     * @param envelopeSender Envelope sender.
     * @return DeliveryResult.
     */
    DeliveryResult deliver(MailMessage message, List<String> recipients, String envelopeSender);
}
