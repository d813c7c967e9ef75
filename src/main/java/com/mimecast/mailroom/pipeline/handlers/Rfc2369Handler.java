package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;

import java.util.List;

/**
 * Adds RFC 2369 List-* headers and the RFC 2919 List-Id.
 * <p>Existing values are replaced.
 */
public class Rfc2369Handler implements Handler {

    private static final List<String> HEADERS = List.of(
            "List-Id", "List-Help", "List-Post", "List-Subscribe", "List-Unsubscribe", "List-Owner", "List-Archive");

    @Override
    public String getName() {
        return "rfc-2369";
    }

    @Override
    public String getDescription() {
        return "Add the RFC 2369 List-* headers.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        for (String header : HEADERS) {
            message.removeHeader(header);
        }
        message.setHeader("List-Id", list.getDisplayName() + " <" + list.getListId() + ">");
        if (!list.isIncludeRfc2369Headers()) {
            return HandlerResult.proceed();
        }

        String request = list.getRequestAddress();
        message.setHeader("List-Help", "<mailto:" + request + "?subject=help>");
        message.setHeader("List-Post", "<mailto:" + list.getPostingAddress() + ">");
        message.setHeader("List-Subscribe", "<mailto:" + list.getListName() + "-join@" + list.getMailHost() + ">");
        message.setHeader("List-Unsubscribe", "<mailto:" + list.getListName() + "-leave@" + list.getMailHost() + ">");
        message.setHeader("List-Owner", "<mailto:" + list.getOwnerAddress() + ">");
        return HandlerResult.proceed();
    }
}
