package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.ChainAction;
import com.mimecast.mailroom.rules.Rule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hits on postings from senders who are neither members nor moderators.
 * <p>The moderation action comes from the first matching nonmember address list,
 * in the order accept, hold, reject, discard, falling back to the list default.
 */
public class NonmemberModerationRule implements Rule {

    private static final Map<String, ChainAction> PATTERN_KEYS = new LinkedHashMap<>();

    static {
        PATTERN_KEYS.put("acceptTheseNonmembers", ChainAction.ACCEPT);
        PATTERN_KEYS.put("holdTheseNonmembers", ChainAction.HOLD);
        PATTERN_KEYS.put("rejectTheseNonmembers", ChainAction.REJECT);
        PATTERN_KEYS.put("discardTheseNonmembers", ChainAction.DISCARD);
    }

    @Override
    public String getName() {
        return "nonmember-moderation";
    }

    @Override
    public String getDescription() {
        return "Match messages sent by nonmembers.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (metadata.getBoolean(Metadata.MODERATOR_APPROVED)) {
            return false;
        }
        String sender = message.getSender();
        if (sender != null && (list.isMember(sender) || list.getModerators().contains(sender))) {
            return false;
        }

        ChainAction action = list.getDefaultNonmemberAction();
        String reason = "The message is not from a list member";
        for (Map.Entry<String, ChainAction> entry : PATTERN_KEYS.entrySet()) {
            String pattern = AddressPatterns.firstMatch(sender, list.getNonmemberPatterns(entry.getKey()));
            if (pattern != null) {
                action = entry.getValue();
                reason = "The sender matches " + entry.getKey() + " pattern " + pattern;
                break;
            }
        }

        metadata.annotate(getName(), reason);
        metadata.put(Metadata.MODERATION_ACTION, action.toString());
        metadata.put(Metadata.MODERATION_REASON, reason);
        return true;
    }
}
