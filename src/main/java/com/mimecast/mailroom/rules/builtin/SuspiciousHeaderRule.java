package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Hits when a header matches one of the list's {@code header: regex} lines.
 */
public class SuspiciousHeaderRule implements Rule {
    private static final Logger log = LogManager.getLogger(SuspiciousHeaderRule.class);

    @Override
    public String getName() {
        return "suspicious-header";
    }

    @Override
    public String getDescription() {
        return "Catch messages with suspicious headers.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        for (String line : list.getBounceMatchingHeaders()) {
            String trimmed = line.trim();
            int colon = trimmed.indexOf(':');
            if (trimmed.isEmpty() || trimmed.startsWith("#") || colon <= 0) {
                continue;
            }
            String header = trimmed.substring(0, colon).trim();
            String regex = trimmed.substring(colon + 1).trim();

            Pattern pattern;
            try {
                pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid suspicious header pattern for list {}: {}", list.getName(), line);
                continue;
            }
            for (String value : message.getHeaders(header)) {
                if (pattern.matcher(value).find()) {
                    metadata.annotate(getName(), "Header " + header + " matches " + regex);
                    return true;
                }
            }
        }
        return false;
    }
}
