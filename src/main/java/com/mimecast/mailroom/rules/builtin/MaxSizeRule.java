package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Hits when the message exceeds the list size limit.
 */
public class MaxSizeRule implements Rule {

    @Override
    public String getName() {
        return "max-size";
    }

    @Override
    public String getDescription() {
        return "Catch messages that are bigger than a specified maximum.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        long maxKb = list.getMaxMessageSize();
        if (maxKb <= 0) {
            return false;
        }
        int size = message.size();
        if (size > maxKb * 1024L) {
            metadata.annotate(getName(), "The message is " + size + " bytes, limit is " + maxKb + " KB");
            return true;
        }
        return false;
    }
}
