package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Always hits.
 */
public class TruthRule implements Rule {

    @Override
    public String getName() {
        return "truth";
    }

    @Override
    public String getDescription() {
        return "A rule which always matches.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        return true;
    }
}
