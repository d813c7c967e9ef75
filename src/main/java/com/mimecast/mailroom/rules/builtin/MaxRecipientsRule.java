package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

import java.util.LinkedHashSet;

/**
 * Hits when the message names too many explicit recipients.
 */
public class MaxRecipientsRule implements Rule {

    @Override
    public String getName() {
        return "max-recipients";
    }

    @Override
    public String getDescription() {
        return "Catch messages with too many explicit recipients.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        int max = list.getMaxNumRecipients();
        if (max <= 0) {
            return false;
        }
        int count = new LinkedHashSet<>(message.getRecipients()).size();
        if (count >= max) {
            metadata.annotate(getName(), "Message has " + count + " recipients, limit is " + max);
            return true;
        }
        return false;
    }
}
