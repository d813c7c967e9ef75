package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hits on messages an upstream scanner marked as spam.
 * <p>Honours {@code X-Spam-Flag: YES} and an {@code X-Spam-Score} at or above the list threshold.
 */
public class SpamCheckRule implements Rule {
    private static final Logger log = LogManager.getLogger(SpamCheckRule.class);

    @Override
    public String getName() {
        return "spam-check";
    }

    @Override
    public String getDescription() {
        return "Catch messages flagged as spam by the upstream scanner.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        String flag = message.getHeader("X-Spam-Flag");
        if (flag != null && flag.toUpperCase().startsWith("YES")) {
            metadata.annotate(getName(), "Message flagged as spam");
            return true;
        }

        String score = message.getHeader("X-Spam-Score");
        if (score != null) {
            try {
                double value = Double.parseDouble(score.trim().split("[\\s/]+")[0]);
                if (value >= list.getSpamScoreThreshold()) {
                    metadata.annotate(getName(), "Spam score " + value + " over threshold " + list.getSpamScoreThreshold());
                    return true;
                }
            } catch (NumberFormatException e) {
                log.debug("Unparsable X-Spam-Score: {}", score);
            }
        }
        return false;
    }
}
