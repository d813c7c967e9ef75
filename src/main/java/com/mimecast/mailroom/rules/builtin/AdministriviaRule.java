package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.rules.Rule;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Catches mis-addressed email commands.
 * <p>Checks the first word of the subject and of the first few body lines
 * against the list of known request commands.
 */
public class AdministriviaRule implements Rule {

    private static final Set<String> COMMANDS = Set.of(
            "confirm", "help", "join", "leave", "remove", "set",
            "subscribe", "unsubscribe", "who");

    // Only short messages are inspected; longer ones are real postings.
    private static final int MAX_BODY_BYTES = 2048;
    private static final int MAX_LINES = 5;

    @Override
    public String getName() {
        return "administrivia";
    }

    @Override
    public String getDescription() {
        return "Catch mis-addressed email commands.";
    }

    @Override
    public boolean check(MailMessage message, Metadata metadata, MailingList list) {
        if (!list.isAdministrivia()) {
            return false;
        }

        String command = command(message.getSubject());
        if (command == null && message.getBody().length <= MAX_BODY_BYTES) {
            int seen = 0;
            for (String line : new String(message.getBody(), StandardCharsets.UTF_8).split("\\r?\\n")) {
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                command = command(line);
                if (command != null || ++seen >= MAX_LINES) {
                    break;
                }
            }
        }

        if (command != null) {
            metadata.annotate(getName(), "Message contains administrivia command: " + command);
            return true;
        }
        return false;
    }

    private static String command(String line) {
        String[] words = StringUtils.split(StringUtils.defaultString(line).trim().toLowerCase(Locale.ROOT));
        return words != null && words.length > 0 && COMMANDS.contains(words[0]) ? words[0] : null;
    }
}
