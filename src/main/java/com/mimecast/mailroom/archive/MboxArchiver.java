package com.mimecast.mailroom.archive;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Appends postings to a per-list mbox file.
 *
 * <p>{@code <archiveDir>/<list>.mbox} holds the messages and {@code <list>.ids} the archived
 * Message-IDs, one per line, used to skip duplicates on redelivery.
 * Appends hold an exclusive lock on the index so concurrent archivers serialise.
 */
public class MboxArchiver implements Archiver {
    private static final Logger log = LogManager.getLogger(MboxArchiver.class);

    private static final DateTimeFormatter FROM_LINE_DATE =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final Path archiveDir;
    private final Clock clock;

    public MboxArchiver(Path archiveDir, Clock clock) {
        this.archiveDir = archiveDir;
        this.clock = clock;
    }

    @Override
    public void archive(MailingList list, MailMessage message) throws IOException {
        Files.createDirectories(archiveDir);
        Path mbox = getMboxPath(list);
        Path index = archiveDir.resolve(list.getName() + ".ids");
        String messageId = message.getMessageId();

        try (FileChannel indexChannel = FileChannel.open(index, StandardOpenOption.CREATE,
                StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = indexChannel.lock()) {

            if (readIndex(indexChannel).contains(messageId)) {
                log.debug("Already archived: list={}, messageId={}", list.getName(), messageId);
                return;
            }

            try (FileChannel mboxChannel = FileChannel.open(mbox, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                mboxChannel.write(ByteBuffer.wrap(toMboxEntry(message)));
                mboxChannel.force(true);
            }
            // READ and APPEND cannot be combined so the index is appended at its current size.
            ByteBuffer line = ByteBuffer.wrap((messageId + "\n").getBytes(StandardCharsets.UTF_8));
            long position = indexChannel.size();
            while (line.hasRemaining()) {
                position += indexChannel.write(line, position);
            }
            indexChannel.force(true);
        }
        log.info("Archived: list={}, messageId={}", list.getName(), messageId);
    }

    /**
     * Gets the mbox file of a list.
     *
     * @param list List.
     * @return Path.
     */
    public Path getMboxPath(MailingList list) {
        return archiveDir.resolve(list.getName() + ".mbox");
    }

    private static List<String> readIndex(FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) channel.size());
        long position = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        return text.isEmpty() ? List.of() : Arrays.asList(text.split("\n"));
    }

    private byte[] toMboxEntry(MailMessage message) {
        String sender = message.getSender() != null ? message.getSender() : "MAILER-DAEMON";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(("From " + sender + " " + FROM_LINE_DATE.format(clock.instant()) + "\n").getBytes(StandardCharsets.UTF_8));

        String text = new String(message.toBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        for (String line : text.split("\n", -1)) {
            // mboxrd quoting.
            if (line.matches("^>*From .*")) {
                out.writeBytes(">".getBytes(StandardCharsets.UTF_8));
            }
            out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
            out.writeBytes("\n".getBytes(StandardCharsets.UTF_8));
        }
        out.writeBytes("\n".getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }
}
