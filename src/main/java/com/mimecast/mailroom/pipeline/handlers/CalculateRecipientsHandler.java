package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Sets the recipients of a posting to the list's regular delivery members.
 * <p>Recipients already present in metadata are kept.
 */
public class CalculateRecipientsHandler implements Handler {

    @Override
    public String getName() {
        return "calculate-recipients";
    }

    @Override
    public String getDescription() {
        return "Calculate the regular recipients of the message.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        if (!metadata.containsKey(Metadata.RECIPIENTS)) {
            List<String> recipients = new ArrayList<>(metadata.getBoolean(Metadata.TO_OWNER)
                    ? list.getModerators()
                    : list.getMembers());
            metadata.put(Metadata.RECIPIENTS, recipients);
        }
        return HandlerResult.proceed();
    }
}
