package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Hits when any earlier rule in the chain hit.
 */
public class AnyRule implements Rule {

    @Override
    public String getName() {
        return "any";
    }

    @Override
    public String getDescription() {
        return "Look for any previous rule hit.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        return !metadata.getStringList(Metadata.RULE_HITS).isEmpty();
    }
}
