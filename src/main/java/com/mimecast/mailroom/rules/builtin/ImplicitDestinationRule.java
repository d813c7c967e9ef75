package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Hits when the list is not named explicitly in To or Cc.
 */
public class ImplicitDestinationRule implements Rule {

    @Override
    public String getName() {
        return "implicit-dest";
    }

    @Override
    public String getDescription() {
        return "Catch messages with implicit destination.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (!list.isRequireExplicitDestination()) {
            return false;
        }
        for (String recipient : message.getRecipients()) {
            if (recipient.equalsIgnoreCase(list.getPostingAddress())
                    || AddressPatterns.matches(recipient, list.getAcceptableAliases())) {
                return false;
            }
        }
        metadata.annotate(getName(), "Message has implicit destination");
        return true;
    }
}
