package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;

/**
 * Hits on postings from moderated members.
 * <p>Records the list's default member action as the moderation action.
 */
public class MemberModerationRule implements Rule {

    @Override
    public String getName() {
        return "member-moderation";
    }

    @Override
    public String getDescription() {
        return "Match messages sent by moderated members.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (metadata.getBoolean(Metadata.MODERATOR_APPROVED)) {
            return false;
        }
        String sender = message.getSender();
        if (sender != null && list.getModeratedMembers().contains(sender)) {
            String reason = "The message comes from a moderated member";
            metadata.annotate(getName(), reason);
            metadata.put(Metadata.MODERATION_ACTION, list.getDefaultMemberAction().toString());
            metadata.put(Metadata.MODERATION_REASON, reason);
            return true;
        }
        return false;
    }
}
