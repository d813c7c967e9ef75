package com.mimecast.mailroom.moderation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.CorruptEntryException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueRecordCodec;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Directory based hold ledger.
 *
 * <p>Layout: {@code <root>/<list>/<requestId>.json} holds the record and
 * {@code <root>/<list>/<requestId>.msg} the held message in queue record format.
 * The message file is removed once the record is resolved.
 * <p>Only a pending record is reused for the same Message-ID; a message held again after its
 * record was resolved gets a new request id.
 */
public class FileHoldLedger implements HoldLedger {
    private static final Logger log = LogManager.getLogger(FileHoldLedger.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final String RECORD = ".json";
    private static final String MESSAGE = ".msg";

    private final Path root;
    private final Clock clock;

    /**
     * Constructs a new FileHoldLedger.
     *
     * @param root  Ledger directory.
     * @param clock Clock for hold and resolution times.
     */
    public FileHoldLedger(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    @Override
    public synchronized HoldId record(String listName, MailMessage message, Metadata metadata,
                                      String reason, String rule) throws StorageException {
        HoldId id;
        Path recordPath;
        for (int generation = 0; ; generation++) {
            id = HoldId.of(listName, message.getMessageId(), generation);
            recordPath = recordPath(id);
            if (!Files.exists(recordPath)) {
                break;
            }
            Optional<HoldRecord> existing = get(id);
            if (existing.isEmpty() || existing.get().isPending()) {
                log.debug("Message already held: id={}, messageId={}", id, message.getMessageId());
                return id;
            }
            // Resolved earlier, e.g. approved and then held by another rule.
        }

        HoldRecord record = new HoldRecord(id, message.getMessageId(), reason, rule, clock.instant())
                .setSender(message.getSender())
                .setSubject(message.getSubject());
        try {
            Files.createDirectories(recordPath.getParent());
            write(messagePath(id), QueueRecordCodec.encode(message, metadata));

            // The record is published last so a visible record always has its message.
            Path tmp = recordPath.resolveSibling(id.getRequestId() + ".tmp");
            Files.write(tmp, GSON.toJson(record).getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(tmp, recordPath);
            } catch (FileAlreadyExistsException e) {
                Files.deleteIfExists(tmp);
                log.debug("Concurrent hold of the same message: {}", id);
                return id;
            }
        } catch (IOException e) {
            throw new StorageException("Unable to record hold " + id + ": " + e.getMessage(), e);
        }

        log.info("Held message: id={}, rule={}, reason={}, sender={}", id, rule, reason, record.getSender());
        return id;
    }

    @Override
    public Optional<HoldRecord> get(HoldId id) throws StorageException {
        Path path = recordPath(id);
        try {
            return Optional.ofNullable(GSON.fromJson(Files.readString(path, StandardCharsets.UTF_8), HoldRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Unable to read hold " + id + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new CorruptEntryException("Corrupt hold record " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<QueueRecordCodec.Record> getMessage(HoldId id) throws StorageException {
        try {
            return Optional.of(QueueRecordCodec.decode(Files.readAllBytes(messagePath(id))));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (e instanceof StorageException) {
                throw (StorageException) e;
            }
            throw new StorageException("Unable to read held message " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<HoldRecord> pending(String listName) throws StorageException {
        List<HoldRecord> records = new ArrayList<>();
        Path dir = root.resolve(listName.toLowerCase());
        if (!Files.isDirectory(dir)) {
            return records;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                Optional<HoldRecord> record = get(new HoldId(listName, name.substring(0, name.length() - RECORD.length())));
                if (record.isPresent() && record.get().isPending()) {
                    records.add(record.get());
                }
            }
        } catch (IOException e) {
            if (e instanceof StorageException) {
                throw (StorageException) e;
            }
            throw new StorageException("Unable to list holds of " + listName + ": " + e.getMessage(), e);
        }
        records.sort(Comparator.comparing(HoldRecord::getHeldAt));
        return records;
    }

    @Override
    public synchronized HoldRecord resolve(HoldId id, HoldDisposition disposition) throws StorageException {
        if (!disposition.isTerminal()) {
            throw new IllegalArgumentException("Cannot resolve to " + disposition);
        }
        HoldRecord record = get(id).orElseThrow(() -> new IllegalArgumentException("No such hold: " + id));
        if (!record.isPending()) {
            if (record.getDisposition() == disposition) {
                return record;
            }
            throw new IllegalStateException("Hold " + id + " already " + record.getDisposition());
        }

        record.resolve(disposition, clock.instant());
        try {
            write(recordPath(id), GSON.toJson(record).getBytes(StandardCharsets.UTF_8));
            Files.deleteIfExists(messagePath(id));
        } catch (IOException e) {
            throw new StorageException("Unable to resolve hold " + id + ": " + e.getMessage(), e);
        }
        log.info("Resolved hold: id={}, disposition={}", id, disposition);
        return record;
    }

    private Path recordPath(HoldId id) {
        return root.resolve(id.getListName()).resolve(id.getRequestId() + RECORD);
    }

    private Path messagePath(HoldId id) {
        return root.resolve(id.getListName()).resolve(id.getRequestId() + MESSAGE);
    }

    private static void write(Path path, byte[] bytes) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
