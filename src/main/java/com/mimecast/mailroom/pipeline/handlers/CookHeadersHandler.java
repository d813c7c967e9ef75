package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;

/**
 * Adds the headers every list posting carries.
 * <p>{@code X-BeenThere} is what the loop rule looks for.
 */
public class CookHeadersHandler implements Handler {

    @Override
    public String getName() {
        return "cook-headers";
    }

    @Override
    public String getDescription() {
        return "Modify message headers.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        if (!message.getAddresses("X-BeenThere").contains(list.getPostingAddress())) {
            message.addHeader("X-BeenThere", list.getPostingAddress());
        }
        message.setHeader("Precedence", "list");
        if (!message.hasHeader("Message-ID")) {
            message.setHeader("Message-ID", message.getMessageId());
        }
        return HandlerResult.proceed();
    }
}
