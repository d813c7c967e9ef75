package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Holds every posting while the list is in emergency moderation.
 * <p>Postings already approved by a moderator pass.
 */
public class EmergencyRule implements Rule {

    @Override
    public String getName() {
        return "emergency";
    }

    @Override
    public String getDescription() {
        return "The mailing list is in emergency hold and this message was not pre-approved by the list administrator.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (list.isEmergency() && !metadata.getBoolean(Metadata.MODERATOR_APPROVED)) {
            metadata.annotate(getName(), "Emergency moderation is in effect for " + list.getName());
            return true;
        }
        return false;
    }
}
