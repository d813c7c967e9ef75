package com.mimecast.mailroom.list;

import com.mimecast.mailroom.queue.EntryId;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ListRegistryTest {

    private static ListRegistry lists;

    @BeforeAll
    static void before() throws IOException {
        lists = ListRegistry.load(Paths.get("src/test/resources/cfg/lists"));
    }

    @Test
    void loadsValidListsOnly() {
        assertEquals(3, lists.size());
        assertEquals(List.of("ant@example.com", "bee@example.com", "wasp@example.com"),
                lists.getLists().stream().map(MailingList::getName).sorted().collect(Collectors.toList()));
        assertTrue(lists.get("invalid").isEmpty());
    }

    @Test
    void lookupIsCaseInsensitive() {
        assertTrue(lists.get("ANT@Example.com").isPresent());
        assertTrue(lists.get(null).isEmpty());
    }

    @Test
    void lookupByDigest() {
        Optional<MailingList> list = lists.getByDigest(EntryId.digest("bee@example.com"));

        assertTrue(list.isPresent());
        assertEquals("bee@example.com", list.get().getName());
        assertTrue(lists.getByDigest(EntryId.digest("nobody@example.com")).isEmpty());
    }

    @Test
    void listProperties() {
        MailingList ant = lists.get("ant@example.com").orElseThrow();
        assertEquals("Ant", ant.getDisplayName());
        assertEquals("ant-owner@example.com", ant.getOwnerAddress());
        assertEquals("ant-bounces@example.com", ant.getBouncesAddress());
        assertEquals("ant.example.com", ant.getListId());
        assertEquals(Optional.of(2), ant.getMaxRetries());
        assertEquals(7, ant.getMaxDaysToHold());
        assertTrue(ant.isMember("Anne@Example.com"));
        assertTrue(ant.isArchive());

        MailingList bee = lists.get("bee@example.com").orElseThrow();
        assertEquals("strict-chain", bee.getPostingChain());
        assertEquals("announce-pipeline", bee.getPostingPipeline());
        assertEquals(Optional.empty(), bee.getMaxRetries());
        assertFalse(bee.isIncludeRfc2369Headers());
        assertFalse(bee.isArchive());
    }

    @Test
    void missingDirectoryIsEmpty(@TempDir Path tempDir) throws IOException {
        assertEquals(0, ListRegistry.load(tempDir.resolve("missing")).size());
    }

    @Test
    void unreadableFileIsSkipped(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("a.json5"), "{name: \"a@example.com\"}");
        Files.writeString(tempDir.resolve("b.json5"), "{name: ");

        ListRegistry loaded = ListRegistry.load(tempDir);

        assertEquals(1, loaded.size());
        assertTrue(loaded.get("a@example.com").isPresent());
    }
}
