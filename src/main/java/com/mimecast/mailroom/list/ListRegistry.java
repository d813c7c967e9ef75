package com.mimecast.mailroom.list;

import com.mimecast.mailroom.config.ConfigFoundation;
import com.mimecast.mailroom.queue.EntryId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the list configuration feed.
 *
 * <p>Loaded from one {@code *.json5} file per list. Files that cannot be read or lack a valid
 * fully qualified name are logged and skipped.
 */
public class ListRegistry {
    private static final Logger log = LogManager.getLogger(ListRegistry.class);

    private final Map<String, MailingList> byName;
    private final Map<String, MailingList> byDigest;

    /**
     * Constructs a new ListRegistry.
     *
     * @param lists Lists.
     */
    public ListRegistry(Collection<MailingList> lists) {
        Map<String, MailingList> names = new LinkedHashMap<>();
        Map<String, MailingList> digests = new LinkedHashMap<>();
        for (MailingList list : lists) {
            names.put(list.getName(), list);
            digests.put(EntryId.digest(list.getName()), list);
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byDigest = Collections.unmodifiableMap(digests);
    }

    /**
     * Loads every list file in a directory.
     *
     * @param dir Lists directory.
     * @return ListRegistry.
     * @throws IOException Directory unreadable.
     */
    public static ListRegistry load(Path dir) throws IOException {
        List<MailingList> lists = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            log.warn("Lists directory not found: {}", dir);
            return new ListRegistry(lists);
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json5")) {
            stream.forEach(files::add);
        }
        Collections.sort(files);

        for (Path file : files) {
            try {
                MailingList list = new MailingList(ConfigFoundation.readMap(file));
                if (!list.getName().matches("^[^@\\s/]+@[^@\\s/]+$")) {
                    log.error("List file {} has no valid fully qualified name, skipped", file);
                    continue;
                }
                lists.add(list);
            } catch (IOException e) {
                log.error("Unable to load list file {}: {}", file, e.getMessage());
            }
        }
        log.info("Loaded {} lists from {}", lists.size(), dir);
        return new ListRegistry(lists);
    }

    public Optional<MailingList> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name.toLowerCase()));
    }

    /**
     * Gets a list by the name digest carried in entry ids.
     *
     * @param digest List name digest.
     * @return Optional of MailingList.
     */
    public Optional<MailingList> getByDigest(String digest) {
        return Optional.ofNullable(byDigest.get(digest));
    }

    public Collection<MailingList> getLists() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }
}
