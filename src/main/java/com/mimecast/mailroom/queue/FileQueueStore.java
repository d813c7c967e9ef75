package com.mimecast.mailroom.queue;

import com.mimecast.mailroom.mime.MailMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Directory based queue store.
 *
 * <p>Layout under the root directory:
 * <pre>
 * &lt;root&gt;/&lt;queue&gt;/&lt;id&gt;.pck                      ready entry
 * &lt;root&gt;/&lt;queue&gt;/&lt;id&gt;.tmp                      entry being written, never listed
 * &lt;root&gt;/&lt;queue&gt;/.staged/&lt;process&gt;/&lt;id&gt;.bak   claimed entry
 * &lt;root&gt;/bad/&lt;queue&gt;+&lt;name&gt;.psv                  quarantined record
 * </pre>
 * <p>Every ownership transfer is a single atomic rename inside the root, which must therefore
 * live on one filesystem. Files are fsync'd before they are renamed into place.
 * <p>The claim time of a staged entry is its modification time; recovery compares it against
 * the grace period.
 */
public class FileQueueStore implements QueueStore {
    private static final Logger log = LogManager.getLogger(FileQueueStore.class);

    static final String READY = ".pck";
    static final String TEMP = ".tmp";
    static final String STAGED = ".bak";
    static final String QUARANTINED = ".psv";
    static final String STAGING_DIR = ".staged";

    private static final Pattern QUEUE_NAME = Pattern.compile("^[a-z0-9][a-z0-9_-]*$");

    private final Path root;
    private final String processTag;
    private final Clock clock;

    /**
     * Constructs a new FileQueueStore with a generated process tag.
     *
     * @param root Root directory.
     */
    public FileQueueStore(Path root) {
        this(root, defaultProcessTag(), Clock.systemUTC());
    }

    /**
     * Constructs a new FileQueueStore.
     *
     * @param root       Root directory.
     * @param processTag Name of this process' staging directory.
     * @param clock      Clock used for receipt times and claim times.
     */
    public FileQueueStore(Path root, String processTag, Clock clock) {
        this.root = root;
        this.processTag = processTag;
        this.clock = clock;
    }

    /**
     * Builds a process tag unique to this JVM instance.
     *
     * @return String.
     */
    static String defaultProcessTag() {
        String jvm = ManagementFactory.getRuntimeMXBean().getName().replaceAll("[^A-Za-z0-9_-]", "_");
        return jvm + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Path getRoot() {
        return root;
    }

    public String getProcessTag() {
        return processTag;
    }

    @Override
    public EntryId enqueue(String queue, MailMessage message, Metadata metadata) throws StorageException {
        long now = clock.millis();
        if (!metadata.containsKey(Metadata.RECEIVED_TIME)) {
            metadata.put(Metadata.RECEIVED_TIME, now);
        }

        Path dir = queueDir(queue);
        byte[] bytes = QueueRecordCodec.encode(message, metadata);
        while (true) {
            EntryId id = EntryId.create(metadata.getListName(), now);
            Path tmp = dir.resolve(id + TEMP);
            Path ready = dir.resolve(id + READY);
            try {
                writeDurably(tmp, bytes);
                if (Files.exists(ready)) {
                    Files.deleteIfExists(tmp);
                    continue; // Random part collided, draw again.
                }
                atomicMove(tmp, ready);
                log.debug("Enqueued: queue={}, id={}, list={}", queue, id, metadata.getListName());
                return id;
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Unable to enqueue into " + queue + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public List<EntryId> listReady(String queue, ShardAssignment shard, Instant now) throws StorageException {
        long cutoff = now.toEpochMilli();
        List<EntryId> ready = new ArrayList<>();
        for (EntryId id : listReady(queue)) {
            if (id.getWhen() <= cutoff && shard.claims(id)) {
                ready.add(id);
            }
        }
        return ready;
    }

    @Override
    public List<EntryId> listReady(String queue) throws StorageException {
        return listIds(queueDir(queue), READY);
    }

    @Override
    public QueueEntry dequeue(String queue, EntryId id) throws StorageException {
        Path ready = queueDir(queue).resolve(id + READY);
        Path staged = stagingDir(queue).resolve(id + STAGED);

        try {
            // Stamped before the move so a staged file never carries a stale claim time.
            Files.setLastModifiedTime(ready, FileTime.fromMillis(clock.millis()));
            atomicMove(ready, staged);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(queue, id);
        } catch (IOException e) {
            throw new StorageException("Unable to claim " + queue + "/" + id + ": " + e.getMessage(), e);
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(staged);
        } catch (IOException e) {
            // Left staged; recovery makes it ready again after the grace period.
            throw new StorageException("Unable to read " + queue + "/" + id + ": " + e.getMessage(), e);
        }

        try {
            QueueRecordCodec.Record record = QueueRecordCodec.decode(bytes);
            log.trace("Dequeued: queue={}, id={}", queue, id);
            return new QueueEntry(queue, id, record.getMessage(), record.getMetadata());
        } catch (CorruptEntryException e) {
            quarantine(queue, staged, id + STAGED);
            throw e;
        }
    }

    @Override
    public void checkpoint(QueueEntry entry) throws StorageException {
        Path staged = stagedPath(entry.getQueue(), entry.getId());
        Path tmp = stagingDir(entry.getQueue()).resolve(entry.getId() + TEMP);
        try {
            writeDurably(tmp, QueueRecordCodec.encode(entry.getMessage(), entry.getMetadata()));
            Files.setLastModifiedTime(tmp, FileTime.fromMillis(clock.millis()));
            atomicMove(tmp, staged);
            log.trace("Checkpointed: queue={}, id={}", entry.getQueue(), entry.getId());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Unable to checkpoint " + entry + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void finish(String queue, EntryId id) throws StorageException {
        try {
            Files.delete(stagedPath(queue, id));
            log.trace("Finished: queue={}, id={}", queue, id);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(queue, id);
        } catch (IOException e) {
            throw new StorageException("Unable to finish " + queue + "/" + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public EntryId requeue(String queue, EntryId id, MailMessage message, Metadata metadata,
                           String targetQueue, Instant notBefore) throws StorageException {
        Path staged = stagedPath(queue, id);
        if (!Files.exists(staged)) {
            throw new EntryNotFoundException(queue, id);
        }

        Path tmp = stagingDir(queue).resolve(id + TEMP);
        EntryId target = notBefore != null ? id.withWhen(Math.max(id.getWhen(), notBefore.toEpochMilli())) : id;
        Path ready = queueDir(targetQueue).resolve(target + READY);
        try {
            // 1. Replace the staged record with the new state; still owned by this process.
            writeDurably(tmp, QueueRecordCodec.encode(message, metadata));
            atomicMove(tmp, staged);

            // 2. Hand it over. A single rename: ready in the target or staged here, never both.
            atomicMove(staged, ready);
            log.debug("Requeued: {}/{} -> {}/{}", queue, id, targetQueue, target);
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Unable to requeue " + queue + "/" + id + " to " + targetQueue + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int recover(String queue, ShardAssignment shard, Duration grace, Instant now) throws StorageException {
        Path dir = queueDir(queue);
        Path staging = dir.resolve(STAGING_DIR);
        long cutoff = now.minus(grace).toEpochMilli();
        int recovered = 0;

        try {
            if (Files.isDirectory(staging)) {
                try (DirectoryStream<Path> processes = Files.newDirectoryStream(staging)) {
                    for (Path process : processes) {
                        if (!Files.isDirectory(process)) {
                            continue;
                        }
                        for (EntryId id : listIds(process, STAGED)) {
                            Path file = process.resolve(id + STAGED);
                            if (!shard.claims(id) || !isOlderThan(file, cutoff)) {
                                continue;
                            }
                            try {
                                atomicMove(file, dir.resolve(id + READY));
                                recovered++;
                                log.warn("Recovered abandoned entry: queue={}, id={}, process={}",
                                        queue, id, process.getFileName());
                            } catch (NoSuchFileException e) {
                                log.debug("Entry recovered or committed concurrently: {}", id);
                            }
                        }
                        cleanTemp(process, cutoff);
                    }
                }
            }
            cleanTemp(dir, cutoff);
        } catch (IOException e) {
            throw new StorageException("Unable to recover " + queue + ": " + e.getMessage(), e);
        }
        return recovered;
    }

    @Override
    public long size(String queue) throws StorageException {
        return listReady(queue).size();
    }

    /**
     * Lists quarantined file names.
     *
     * @return File names.
     * @throws StorageException I/O failure.
     */
    public List<String> listQuarantined() throws StorageException {
        List<String> names = new ArrayList<>();
        Path dir = queueDir(QueueNames.BAD);
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + QUARANTINED)) {
            for (Path path : stream) {
                names.add(path.getFileName().toString());
            }
        } catch (IOException e) {
            throw new StorageException("Unable to list quarantine: " + e.getMessage(), e);
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Gets the ready file path of an entry.
     *
     * @param queue Queue name.
     * @param id    Entry id.
     * @return Path.
     * @throws StorageException Queue directory unusable.
     */
    public Path readyPath(String queue, EntryId id) throws StorageException {
        return queueDir(queue).resolve(id + READY);
    }

    /**
     * Gets this process' staged file path of an entry.
     *
     * @param queue Queue name.
     * @param id    Entry id.
     * @return Path.
     * @throws StorageException Queue directory unusable.
     */
    public Path stagedPath(String queue, EntryId id) throws StorageException {
        return stagingDir(queue).resolve(id + STAGED);
    }

    private void quarantine(String queue, Path file, String name) {
        try {
            Path target = queueDir(QueueNames.BAD).resolve(queue + "+" + name + QUARANTINED);
            atomicMove(file, target);
            log.error("Quarantined corrupt entry: queue={}, file={}", queue, target);
        } catch (IOException e) {
            log.error("Unable to quarantine corrupt entry {} in {}: {}", name, queue, e.getMessage());
        }
    }

    private Path queueDir(String queue) throws StorageException {
        if (queue == null || !QUEUE_NAME.matcher(queue).matches()) {
            throw new StorageException("Invalid queue name: " + queue);
        }
        Path dir = root.resolve(queue);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Unable to create queue directory " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    private Path stagingDir(String queue) throws StorageException {
        Path dir = queueDir(queue).resolve(STAGING_DIR).resolve(processTag);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Unable to create staging directory " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    /**
     * Lists entry ids of files with the given extension, oldest first.
     * <p>Anything that does not parse as an entry id is ignored.
     */
    private static List<EntryId> listIds(Path dir, String extension) throws StorageException {
        List<EntryId> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + extension)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                String base = name.substring(0, name.length() - extension.length());
                if (EntryId.isValid(base)) {
                    ids.add(EntryId.parse(base));
                } else {
                    log.debug("Ignoring foreign file in queue: {}", path);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Unable to list " + dir + ": " + e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    private static boolean isOlderThan(Path file, long cutoffMillis) throws IOException {
        try {
            return Files.getLastModifiedTime(file).toMillis() <= cutoffMillis;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    private static void cleanTemp(Path dir, long cutoffMillis) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + TEMP)) {
            for (Path tmp : stream) {
                if (isOlderThan(tmp, cutoffMillis)) {
                    Files.deleteIfExists(tmp);
                    log.info("Removed stale partial write: {}", tmp);
                }
            }
        }
    }

    private static void writeDurably(Path path, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            // Some providers refuse to replace on atomic move; staged replacements are ours to overwrite.
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("Queue root must be on a single filesystem supporting atomic rename", e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Unable to remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
