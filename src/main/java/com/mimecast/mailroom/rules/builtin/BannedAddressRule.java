package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Hits when the sender is banned from the list.
 */
public class BannedAddressRule implements Rule {

    @Override
    public String getName() {
        return "banned-address";
    }

    @Override
    public String getDescription() {
        return "Match messages sent by banned addresses.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        String sender = message.getSender();
        String pattern = AddressPatterns.firstMatch(sender, list.getBannedAddresses());
        if (pattern != null) {
            metadata.annotate(getName(), "Sender " + sender + " is banned by " + pattern);
            return true;
        }
        return false;
    }
}
