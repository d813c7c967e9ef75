package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;
import org.apache.commons.lang3.StringUtils;

/**
 * Hits when the subject is missing or empty.
 */
public class NoSubjectRule implements Rule {

    @Override
    public String getName() {
        return "no-subject";
    }

    @Override
    public String getDescription() {
        return "Catch messages with no, or empty, Subject headers.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (StringUtils.isBlank(message.getSubject())) {
            metadata.annotate(getName(), "Message has no subject");
            return true;
        }
        return false;
    }
}
