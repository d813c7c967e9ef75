package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Detects messages that already went through this list.
 * <p>Looks for the posting address in {@code X-BeenThere} headers added on the way out.
 */
public class LoopRule implements Rule {

    @Override
    public String getName() {
        return "loop";
    }

    @Override
    public String getDescription() {
        return "Look for a posting loop.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        for (String address : message.getAddresses("X-BeenThere")) {
            if (address.equalsIgnoreCase(list.getPostingAddress())) {
                metadata.annotate(getName(), "Message has already been posted to " + list.getPostingAddress());
                return true;
            }
        }
        return false;
    }
}
