package com.mimecast.mailroom.archive;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.util.MutableClock;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MboxArchiverTest {

    @TempDir
    Path tempDir;

    private MboxArchiver archiver;
    private final MailingList list = TestMessages.list();

    @BeforeEach
    void setUp() {
        archiver = new MboxArchiver(tempDir.resolve("archives"), new MutableClock(Instant.parse("2026-10-19T10:00:00Z")));
    }

    @Test
    void appendsWithFromLine() throws IOException {
        archiver.archive(list, TestMessages.memberPosting("one@example.com"));

        Path mbox = archiver.getMboxPath(list);
        assertEquals(tempDir.resolve("archives").resolve("ant@example.com.mbox"), mbox);
        List<String> lines = Files.readAllLines(mbox, StandardCharsets.UTF_8);
        assertEquals("From anne@example.com Mon Oct 19 10:00:00 2026", lines.get(0));
        assertTrue(lines.contains("Subject: Weekly meeting"));
        assertTrue(lines.contains("this is a test posting."));
    }

    @Test
    void quotesFromLinesInBody() throws IOException {
        MailMessage message = TestMessages.memberPosting("quoted@example.com");
        message.setBody("From the desk of Anne\r\n>From earlier\r\nFromage\r\n");

        archiver.archive(list, message);

        List<String> lines = Files.readAllLines(archiver.getMboxPath(list), StandardCharsets.UTF_8);
        assertTrue(lines.contains(">From the desk of Anne"));
        assertTrue(lines.contains(">>From earlier"));
        assertTrue(lines.contains("Fromage"));
    }

    @Test
    void redeliveryIsArchivedOnce() throws IOException {
        archiver.archive(list, TestMessages.memberPosting("dup@example.com"));
        archiver.archive(list, TestMessages.memberPosting("dup@example.com"));
        archiver.archive(list, TestMessages.memberPosting("other@example.com"));

        long fromLines = Files.readAllLines(archiver.getMboxPath(list), StandardCharsets.UTF_8).stream()
                .filter(line -> line.startsWith("From "))
                .count();
        assertEquals(2, fromLines);
        assertEquals(2, Files.readAllLines(tempDir.resolve("archives").resolve("ant@example.com.ids")).size());
    }

    @Test
    void indexIsAppendedAcrossArchivers() throws IOException {
        // Given: Two postings archived by one archiver.
        archiver.archive(list, TestMessages.memberPosting("first@example.com"));
        archiver.archive(list, TestMessages.memberPosting("second@example.com"));

        // When: A new archiver over the same directory sees a redelivery and a new posting.
        MboxArchiver restarted = new MboxArchiver(tempDir.resolve("archives"), new MutableClock(Instant.parse("2026-10-19T11:00:00Z")));
        restarted.archive(list, TestMessages.memberPosting("first@example.com"));
        restarted.archive(list, TestMessages.memberPosting("third@example.com"));

        // Then: The index keeps every Message-ID once, in archive order.
        assertEquals(List.of("<first@example.com>", "<second@example.com>", "<third@example.com>"),
                Files.readAllLines(tempDir.resolve("archives").resolve("ant@example.com.ids"), StandardCharsets.UTF_8));
        List<String> lines = Files.readAllLines(archiver.getMboxPath(list), StandardCharsets.UTF_8);
        assertEquals(3, lines.stream().filter(line -> line.startsWith("From ")).count());
        assertEquals("From anne@example.com Mon Oct 19 11:00:00 2026",
                lines.stream().filter(line -> line.startsWith("From ")).reduce((a, b) -> b).orElseThrow());
    }
}
