package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Hits when a header matches one of the list's header match definitions.
 * <p>When the matching definition names an {@code action} it is recorded as the moderation action,
 * so a {@code moderation} chain link applies it.
 */
public class HeaderMatchRule implements Rule {
    private static final Logger log = LogManager.getLogger(HeaderMatchRule.class);

    @Override
    public String getName() {
        return "header-match";
    }

    @Override
    public String getDescription() {
        return "Match message headers against the list's header patterns.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        for (Map<String, Object> match : list.getHeaderMatches()) {
            Object header = match.get("header");
            Object regex = match.get("pattern");
            if (header == null || regex == null) {
                continue;
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(String.valueOf(regex), Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid header match for list {}: {}", list.getName(), regex);
                continue;
            }
            for (String value : message.getHeaders(String.valueOf(header))) {
                if (pattern.matcher(value).find()) {
                    String note = "Header " + header + " matched " + regex;
                    metadata.annotate(getName(), note);
                    if (match.get("action") != null) {
                        metadata.put(Metadata.MODERATION_ACTION, String.valueOf(match.get("action")));
                        metadata.put(Metadata.MODERATION_REASON, note);
                    }
                    return true;
                }
            }
        }
        return false;
    }
}
