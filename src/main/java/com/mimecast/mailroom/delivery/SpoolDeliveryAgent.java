package com.mimecast.mailroom.delivery;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mimecast.mailroom.mime.MailMessage;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivery agent writing messages to a spool directory for an external MTA to pick up.
 *
 * <p>Each delivery is a pair of files: {@code <name>.eml} with the message and
 * {@code <name>.json} with the envelope. The envelope file is written last; the MTA must
 * only pick up names that have one.
 * <p>The name is derived from the Message-ID, sender and recipients so redelivering the same
 * message overwrites the earlier spool entry instead of duplicating it.
 */
public class SpoolDeliveryAgent implements DeliveryAgent {
    private static final Logger log = LogManager.getLogger(SpoolDeliveryAgent.class);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Path spoolDir;

    public SpoolDeliveryAgent(Path spoolDir) {
        this.spoolDir = spoolDir;
    }

    @Override
    public DeliveryResult deliver(MailMessage message, List<String> recipients, String envelopeSender) {
        if (recipients.isEmpty()) {
            log.info("No recipients for {}, nothing to deliver", message.getMessageId());
            return DeliveryResult.success();
        }

        List<String> invalid = new ArrayList<>();
        for (String recipient : recipients) {
            try {
                new InternetAddress(recipient, true);
            } catch (AddressException e) {
                invalid.add(recipient);
            }
        }
        if (!invalid.isEmpty()) {
            return DeliveryResult.permanentFailure("Invalid recipient address", invalid);
        }

        String name = DigestUtils.sha1Hex(message.getMessageId() + "\n" + envelopeSender + "\n" + String.join(",", recipients));
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("mailFrom", envelopeSender);
        envelope.put("rcptTo", recipients);
        envelope.put("messageId", message.getMessageId());

        try {
            Files.createDirectories(spoolDir);
            write(spoolDir.resolve(name + ".eml"), message.toBytes());
            write(spoolDir.resolve(name + ".json"), GSON.toJson(envelope).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Spool write failed for {}: {}", message.getMessageId(), e.getMessage());
            return DeliveryResult.transientFailure("Spool unavailable: " + e.getMessage());
        }

        log.info("Spooled: messageId={}, name={}, recipients={}", message.getMessageId(), name, recipients.size());
        return DeliveryResult.success();
    }

    private static void write(Path path, byte[] bytes) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
