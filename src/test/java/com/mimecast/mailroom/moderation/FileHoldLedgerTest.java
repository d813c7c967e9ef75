package com.mimecast.mailroom.moderation;

import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueRecordCodec;
import com.mimecast.mailroom.util.MutableClock;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileHoldLedgerTest {

    private static final String LIST = "ant@example.com";

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
    private FileHoldLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new FileHoldLedger(tempDir.resolve("held"), clock);
    }

    private HoldId hold(String messageId) throws IOException {
        MailMessage message = TestMessages.posting("zed@example.net", LIST, "Question " + messageId, messageId);
        return ledger.record(LIST, message, Metadata.forList(LIST), "The message is not from a list member", "nonmember-moderation");
    }

    @Test
    void recordAndRead() throws IOException {
        // Given: A held message.
        HoldId id = hold("one@example.com");

        // When: Reading it back.
        HoldRecord record = ledger.get(id).orElseThrow();
        Optional<QueueRecordCodec.Record> held = ledger.getMessage(id);

        // Then: The record and the message are complete.
        assertEquals(LIST, id.getListName());
        assertTrue(record.isPending());
        assertEquals(HoldDisposition.PENDING, record.getDisposition());
        assertEquals("nonmember-moderation", record.getRule());
        assertEquals("zed@example.net", record.getSender());
        assertEquals("Question one@example.com", record.getSubject());
        assertEquals(clock.instant(), record.getHeldAt());
        assertTrue(held.isPresent());
        assertEquals("<one@example.com>", held.get().getMessage().getMessageId());
        assertEquals(LIST, held.get().getMetadata().getListName());
    }

    @Test
    void recordingSameMessageIsIdempotent() throws IOException {
        HoldId first = hold("dup@example.com");
        clock.advance(Duration.ofMinutes(5));
        HoldId second = hold("dup@example.com");

        assertEquals(first, second);
        List<HoldRecord> pending = ledger.pending(LIST);
        assertEquals(1, pending.size());
        assertEquals(Instant.parse("2026-10-19T10:00:00Z"), pending.get(0).getHeldAt());
    }

    @Test
    void recordingAfterResolutionStartsNewHold() throws IOException {
        // Given: A hold that was approved.
        HoldId first = hold("again@example.com");
        ledger.resolve(first, HoldDisposition.APPROVED);
        clock.advance(Duration.ofMinutes(5));

        // When: The same message is held again, twice.
        HoldId second = hold("again@example.com");
        HoldId third = hold("again@example.com");

        // Then: One new pending record exists next to the resolved one.
        assertNotEquals(first, second);
        assertEquals(second, third);
        assertEquals(HoldDisposition.APPROVED, ledger.get(first).orElseThrow().getDisposition());
        List<HoldRecord> pending = ledger.pending(LIST);
        assertEquals(1, pending.size());
        assertEquals(second, pending.get(0).getId());
        assertEquals(clock.instant(), pending.get(0).getHeldAt());
        assertTrue(ledger.getMessage(second).isPresent());
        assertEquals(HoldId.of(LIST, "<again@example.com>", 1), second);
    }

    @Test
    void pendingIsOldestFirst() throws IOException {
        HoldId early = hold("early@example.com");
        clock.advance(Duration.ofMinutes(1));
        HoldId late = hold("late@example.com");

        List<HoldRecord> pending = ledger.pending(LIST);

        assertEquals(List.of(early, late), List.of(pending.get(0).getId(), pending.get(1).getId()));
        assertTrue(ledger.pending("bee@example.com").isEmpty());
    }

    @Test
    void resolveIsTerminalAndIdempotent() throws IOException {
        // Given: A pending hold.
        HoldId id = hold("resolve@example.com");
        clock.advance(Duration.ofHours(1));

        // When: Approving it twice.
        HoldRecord first = ledger.resolve(id, HoldDisposition.APPROVED);
        HoldRecord second = ledger.resolve(id, HoldDisposition.APPROVED);

        // Then: The same terminal record, the message is dropped and the hold no longer pending.
        assertEquals(HoldDisposition.APPROVED, first.getDisposition());
        assertEquals(clock.instant(), first.getResolvedAt());
        assertEquals(first.getResolvedAt(), second.getResolvedAt());
        assertTrue(ledger.getMessage(id).isEmpty());
        assertTrue(ledger.pending(LIST).isEmpty());

        // And a different disposition is refused.
        assertThrows(IllegalStateException.class, () -> ledger.resolve(id, HoldDisposition.REJECTED));
    }

    @Test
    void resolveRejectsBadRequests() throws IOException {
        HoldId id = hold("bad@example.com");

        assertThrows(IllegalArgumentException.class, () -> ledger.resolve(id, HoldDisposition.PENDING));
        assertThrows(IllegalArgumentException.class, () -> ledger.resolve(new HoldId(LIST, "0123456789abcdef"), HoldDisposition.DISCARDED));
        assertTrue(ledger.get(new HoldId(LIST, "0123456789abcdef")).isEmpty());
    }

    @Test
    void holdIdParsing() {
        HoldId id = HoldId.of(LIST, "<abc@example.com>");

        assertEquals(id, HoldId.parse(id.toString()));
        assertEquals(LIST, HoldId.parse(id.toString()).getListName());
        assertThrows(IllegalArgumentException.class, () -> HoldId.parse("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> HoldId.parse(LIST + "/../../etc"));
    }

    @Test
    void dispositionParsing() {
        assertEquals(HoldDisposition.APPROVED, HoldDisposition.fromString("approve"));
        assertEquals(HoldDisposition.REJECTED, HoldDisposition.fromString("REJECTED"));
        assertEquals(HoldDisposition.DISCARDED, HoldDisposition.fromString("discard"));
        assertThrows(IllegalArgumentException.class, () -> HoldDisposition.fromString("defer"));
    }
}
