package com.mimecast.mailroom.digest;

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
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DigestBuilderTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
    private DigestBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DigestBuilder(tempDir.resolve("digests"), clock);
    }

    @Test
    void collectsUntilThreshold() throws IOException {
        MailingList list = TestMessages.list("digestSizeThreshold", 1);

        // given a collection under one kilobyte
        assertFalse(builder.add(list, TestMessages.memberPosting("small@example.com")));

        // when a large posting is collected
        MailMessage large = TestMessages.memberPosting("large@example.com");
        large.setBody("x".repeat(2048) + "\r\n");
        clock.advance(Duration.ofSeconds(1));

        // then the threshold is crossed
        assertTrue(builder.add(list, large));
        assertTrue(builder.size(list) > 1024);
    }

    @Test
    void duplicateIsCollectedOnce() throws IOException {
        MailingList list = TestMessages.list();
        builder.add(list, TestMessages.memberPosting("dup@example.com"));
        long size = builder.size(list);

        clock.advance(Duration.ofSeconds(1));
        builder.add(list, TestMessages.memberPosting("dup@example.com"));

        assertEquals(size, builder.size(list));
    }

    @Test
    void emptyCollectionBuildsNothing() throws IOException {
        assertNull(builder.build(TestMessages.list()));
    }

    @Test
    void buildAndClearAdvanceVolume() throws IOException {
        MailingList list = TestMessages.list();
        builder.add(list, TestMessages.memberPosting("first@example.com"));
        clock.advance(Duration.ofSeconds(1));
        builder.add(list, TestMessages.posting("bart@example.com", "ant@example.com", "Agenda", "second@example.com"));

        // when
        DigestBuilder.Digest digest = builder.build(list);

        // then
        assertNotNull(digest);
        assertEquals(1L, digest.getVolume());
        assertEquals(2, digest.getFiles().size());
        assertEquals("Ant Digest, Vol 1", digest.getMessage().getSubject());
        String body = new String(digest.getMessage().getBody(), StandardCharsets.UTF_8);
        assertTrue(body.contains("multipart/digest"));
        assertTrue(body.contains("Subject: Weekly meeting"));
        assertTrue(body.contains("Subject: Agenda"));

        // when cleared
        builder.clear(list, digest);

        // then the collection is empty and the next digest is volume 2
        assertEquals(0L, builder.size(list));
        assertTrue(Files.exists(tempDir.resolve("digests").resolve("ant@example.com.volume")));
        builder.add(list, TestMessages.memberPosting("third@example.com"));
        assertEquals(2L, builder.build(list).getVolume());
    }
}
