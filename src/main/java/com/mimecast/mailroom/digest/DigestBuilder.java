package com.mimecast.mailroom.digest;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Collects postings per list and assembles them into {@code multipart/digest} messages.
 *
 * <p>Collected messages live in {@code <digestDir>/<list>/} as {@code <time>-<hash>.eml},
 * the hash being derived from the Message-ID so collecting the same message twice is harmless.
 */
public class DigestBuilder {
    private static final Logger log = LogManager.getLogger(DigestBuilder.class);

    private static final String EXTENSION = ".eml";

    private final Path digestDir;
    private final Clock clock;

    public DigestBuilder(Path digestDir, Clock clock) {
        this.digestDir = digestDir;
        this.clock = clock;
    }

    /**
     * Adds a message to the list's collection.
     *
     * @param list    List.
     * @param message Message.
     * @return True once the collection exceeds the list's digest size threshold.
     * @throws IOException Unable to write.
     */
    public boolean add(MailingList list, MailMessage message) throws IOException {
        Path dir = listDir(list);
        Files.createDirectories(dir);
        String hash = DigestUtils.sha1Hex(message.getMessageId());

        if (!alreadyCollected(dir, hash)) {
            Path target = dir.resolve(String.format("%013d-%s%s", clock.millis(), hash, EXTENSION));
            Path tmp = dir.resolve(hash + ".tmp");
            Files.write(tmp, message.toBytes());
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Collected for digest: list={}, messageId={}", list.getName(), message.getMessageId());
        }

        return size(list) > list.getDigestSizeThreshold() * 1024D;
    }

    /**
     * Gets the collection size.
     *
     * @param list List.
     * @return Bytes.
     * @throws IOException Unable to read.
     */
    public long size(MailingList list) throws IOException {
        long size = 0;
        for (Path path : collected(list)) {
            size += Files.size(path);
        }
        return size;
    }

    /**
     * Builds a digest of everything collected.
     *
     * @param list List.
     * @return Digest or null when nothing was collected.
     * @throws IOException Unable to read or compose.
     */
    public Digest build(MailingList list) throws IOException {
        List<Path> files = collected(list);
        if (files.isEmpty()) {
            return null;
        }
        long volume = readVolume(list);

        try {
            Session session = Session.getInstance(new Properties());
            MimeMultipart digest = new MimeMultipart("digest");
            for (Path file : files) {
                MimeBodyPart part = new MimeBodyPart();
                try (InputStream stream = Files.newInputStream(file)) {
                    part.setContent(new MimeMessage(session, stream), "message/rfc822");
                }
                digest.addBodyPart(part);
            }

            MimeMultipart mixed = new MimeMultipart();
            MimeBodyPart intro = new MimeBodyPart();
            intro.setText("Today's topics: " + files.size() + " messages\n\n"
                    + "To unsubscribe send a message to " + list.getRequestAddress() + "\n", "UTF-8");
            mixed.addBodyPart(intro);
            MimeBodyPart body = new MimeBodyPart();
            body.setContent(digest);
            mixed.addBodyPart(body);

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(list.getRequestAddress()));
            message.setRecipient(MimeMessage.RecipientType.TO, new InternetAddress(list.getPostingAddress()));
            message.setSubject(list.getDisplayName() + " Digest, Vol " + volume, "UTF-8");
            message.setSentDate(Date.from(clock.instant()));
            message.setContent(mixed);
            message.saveChanges();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            log.info("Built digest: list={}, volume={}, messages={}", list.getName(), volume, files.size());
            return new Digest(MailMessage.parse(out.toByteArray()), files, volume);
        } catch (MessagingException e) {
            throw new IOException("Unable to compose digest for " + list.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Removes the messages included in a digest and advances the volume number.
     *
     * @param list   List.
     * @param digest Digest.
     * @throws IOException Unable to delete.
     */
    public void clear(MailingList list, Digest digest) throws IOException {
        for (Path path : digest.getFiles()) {
            Files.deleteIfExists(path);
        }
        Path tmp = digestDir.resolve(list.getName() + ".volume.tmp");
        Files.writeString(tmp, Long.toString(digest.getVolume() + 1));
        Files.move(tmp, volumePath(list), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private long readVolume(MailingList list) throws IOException {
        Path path = volumePath(list);
        if (!Files.exists(path)) {
            return 1L;
        }
        try {
            return Long.parseLong(Files.readString(path).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid digest volume file {}, restarting at 1", path);
            return 1L;
        }
    }

    private Path volumePath(MailingList list) {
        return digestDir.resolve(list.getName() + ".volume");
    }

    private List<Path> collected(MailingList list) throws IOException {
        List<Path> files = new ArrayList<>();
        Path dir = listDir(list);
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path path : stream) {
                files.add(path);
            }
        }
        Collections.sort(files);
        return files;
    }

    private static boolean alreadyCollected(Path dir, String hash) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*-" + hash + EXTENSION)) {
            return stream.iterator().hasNext();
        }
    }

    private Path listDir(MailingList list) {
        return digestDir.resolve(list.getName());
    }

    /**
     * Assembled digest and the collected files it contains.
     */
    public static final class Digest {
        private final MailMessage message;
        private final List<Path> files;
        private final long volume;

        Digest(MailMessage message, List<Path> files, long volume) {
            this.message = message;
            this.files = List.copyOf(files);
            this.volume = volume;
        }

        public long getVolume() {
            return volume;
        }

        public MailMessage getMessage() {
            return message;
        }

        public List<Path> getFiles() {
            return files;
        }
    }
}
