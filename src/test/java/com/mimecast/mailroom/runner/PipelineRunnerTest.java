package com.mimecast.mailroom.runner;

import com.mimecast.mailroom.delivery.DeliveryAgent;
import com.mimecast.mailroom.delivery.DeliveryResult;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.metrics.MetricsRegistry;
import com.mimecast.mailroom.metrics.QueueMetrics;
import com.mimecast.mailroom.notice.QueueNotifier;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.FileQueueStore;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueEntry;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.queue.StorageException;
import com.mimecast.mailroom.util.MutableClock;
import com.mimecast.mailroom.util.TestContexts;
import com.mimecast.mailroom.util.TestMessages;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PipelineRunnerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
    private DeliveryAgent agent;

    @BeforeEach
    void setUp() {
        agent = mock(DeliveryAgent.class);
    }

    private EngineContext context(MailingList... lists) {
        return TestContexts.builder(tempDir, clock, lists).deliveryAgent(agent).build();
    }

    private static PipelineRunner runner(EngineContext context, String queue) {
        return new PipelineRunner(context, queue, ShardAssignment.ALL, 10L, 0);
    }

    private static void enqueueOutgoing(EngineContext context, MailingList list, String messageId) throws IOException {
        Metadata metadata = Metadata.forList(list.getName())
                .put(Metadata.RECIPIENTS, new ArrayList<>(List.of("bart@example.com", "cris@example.com")));
        context.getStore().enqueue(QueueNames.OUT, TestMessages.memberPosting(messageId), metadata);
    }

    private static QueueEntry single(QueueStore store, String queue) throws IOException {
        List<EntryId> ids = store.listReady(queue);
        assertEquals(1, ids.size(), "entries in " + queue);
        return store.dequeue(queue, ids.get(0));
    }

    @Test
    void deliverySucceeds() throws IOException {
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "ok@example.com");
        when(agent.deliver(any(), anyList(), anyString())).thenReturn(DeliveryResult.success());

        assertEquals(1, runner(context, QueueNames.OUT).runOnce());

        assertEquals(0, context.getStore().size(QueueNames.OUT));
        verify(agent).deliver(any(), eq(List.of("bart@example.com", "cris@example.com")), eq("ant-bounces@example.com"));
    }

    @Test
    void transientFailuresAreRetriedWithBackoff() throws IOException {
        // Given: Delivery failing twice before succeeding.
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "retry@example.com");
        when(agent.deliver(any(), anyList(), anyString()))
                .thenReturn(DeliveryResult.transientFailure("421 busy"))
                .thenReturn(DeliveryResult.transientFailure("421 busy"))
                .thenReturn(DeliveryResult.success());
        PipelineRunner runner = runner(context, QueueNames.OUT);

        // When: The first attempt fails.
        runner.runOnce();

        // Then: The entry waits one base delay.
        QueueEntry waiting = peek(context, QueueNames.OUT);
        assertEquals(1, waiting.getMetadata().getRetryCount());
        assertEquals("Delivery failed: 421 busy", waiting.getMetadata().getString(Metadata.LAST_ERROR));
        assertEquals(0, runner.runOnce());

        // When: The delay passes and the second attempt fails.
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, runner.runOnce());

        // Then: The next delay doubles.
        clock.advance(Duration.ofSeconds(1));
        assertEquals(0, runner.runOnce());
        clock.advance(Duration.ofSeconds(1));

        // When: The third attempt succeeds.
        assertEquals(1, runner.runOnce());

        // Then: Nothing is left.
        assertEquals(0, context.getStore().size(QueueNames.OUT));
        assertEquals(0, context.getStore().size(QueueNames.SHUNT));
        verify(agent, times(3)).deliver(any(), anyList(), anyString());
    }

    @Test
    void exhaustedRetriesAreShunted() throws IOException {
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "shunt@example.com");
        when(agent.deliver(any(), anyList(), anyString())).thenReturn(DeliveryResult.transientFailure("421 busy"));
        PipelineRunner runner = runner(context, QueueNames.OUT);

        for (int i = 0; i < 3; i++) {
            runner.runOnce();
            clock.advance(Duration.ofMinutes(1));
        }

        assertEquals(0, context.getStore().size(QueueNames.OUT));
        QueueEntry shunted = single(context.getStore(), QueueNames.SHUNT);
        assertEquals(3, shunted.getMetadata().getRetryCount());
        assertEquals(QueueNames.OUT, shunted.getMetadata().getString(Metadata.SHUNTED_FROM));
        verify(agent, times(3)).deliver(any(), anyList(), anyString());
    }

    @Test
    void listRetryLimitOverridesPolicy() throws IOException {
        MailingList list = TestMessages.list("maxRetries", 1);
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "override@example.com");
        when(agent.deliver(any(), anyList(), anyString())).thenReturn(DeliveryResult.transientFailure("421 busy"));

        runner(context, QueueNames.OUT).runOnce();

        assertEquals(1, context.getStore().size(QueueNames.SHUNT));
    }

    @Test
    void storeFailuresAreReleasedWithBackoffThenEscalated() throws IOException {
        // Given: A store that cannot finish outgoing entries.
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(registry);
        QueueMetrics.resetCounters();
        try {
            FileQueueStore store = spy(new FileQueueStore(tempDir.resolve("queue"), "test", clock));
            doThrow(new StorageException("disk full")).when(store).finish(eq(QueueNames.OUT), any(EntryId.class));
            MailingList list = TestMessages.list();
            EngineContext context = TestContexts.builder(tempDir, clock, list).store(store).deliveryAgent(agent).build();
            enqueueOutgoing(context, list, "stuck@example.com");
            when(agent.deliver(any(), anyList(), anyString())).thenReturn(DeliveryResult.success());
            PipelineRunner runner = runner(context, QueueNames.OUT);

            // When: The first commit fails.
            runner.runOnce();

            // Then: The entry is back in its queue behind a backoff delay.
            QueueEntry waiting = peek(context, QueueNames.OUT);
            assertEquals(1, waiting.getMetadata().getStorageFailures());
            assertEquals("disk full", waiting.getMetadata().getString(Metadata.LAST_ERROR));
            assertEquals(clock.instant().plusSeconds(1).toEpochMilli(), waiting.getMetadata().getLong(Metadata.NOT_BEFORE, 0L));
            assertEquals(0, runner.runOnce());

            // When: The commit keeps failing.
            clock.advance(Duration.ofMinutes(1));
            runner.runOnce();
            clock.advance(Duration.ofMinutes(1));
            runner.runOnce();

            // Then: The third failure is escalated and the entry shunted, delivered only once.
            assertEquals(0, context.getStore().size(QueueNames.OUT));
            QueueEntry shunted = single(context.getStore(), QueueNames.SHUNT);
            assertEquals(3, shunted.getMetadata().getStorageFailures());
            assertEquals(QueueNames.OUT, shunted.getMetadata().getString(Metadata.SHUNTED_FROM));
            verify(agent, times(1)).deliver(any(), anyList(), anyString());
            assertEquals(3.0, registry.find("mailroom.queue.storage.failures").tag("queue", QueueNames.OUT).counter().count(), 0.001);
            assertEquals(1.0, registry.find("mailroom.queue.storage.escalated").tag("queue", QueueNames.OUT).counter().count(), 0.001);
        } finally {
            MetricsRegistry.register(null);
            QueueMetrics.resetCounters();
        }
    }

    @Test
    void storeFailuresOfStagedEntriesAreCountedAcrossRecovery() throws IOException {
        // Given: A store that can neither finish nor release outgoing entries.
        FileQueueStore store = spy(new FileQueueStore(tempDir.resolve("queue"), "test", clock));
        doThrow(new StorageException("disk full")).when(store).finish(eq(QueueNames.OUT), any(EntryId.class));
        doThrow(new StorageException("disk full")).when(store)
                .requeue(eq(QueueNames.OUT), any(EntryId.class), any(), any(), eq(QueueNames.OUT), any());
        MailingList list = TestMessages.list();
        EngineContext context = TestContexts.builder(tempDir, clock, list).store(store).deliveryAgent(agent).build();
        enqueueOutgoing(context, list, "staged@example.com");
        when(agent.deliver(any(), anyList(), anyString())).thenReturn(DeliveryResult.success());
        PipelineRunner runner = runner(context, QueueNames.OUT);

        // When: The entry fails, stays staged and is recovered twice.
        runner.runOnce();
        assertEquals(0, context.getStore().size(QueueNames.OUT));
        clock.advance(context.getGrace().plusSeconds(1));
        runner.runOnce();
        clock.advance(context.getGrace().plusSeconds(1));
        runner.runOnce();

        // Then: The third failure still escalates.
        QueueEntry shunted = single(context.getStore(), QueueNames.SHUNT);
        assertEquals(3, shunted.getMetadata().getStorageFailures());
        assertEquals(QueueNames.OUT, shunted.getMetadata().getString(Metadata.SHUNTED_FROM));
    }

    @Test
    void permanentFailureNotifiesSender() throws IOException {
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "permanent@example.com");
        when(agent.deliver(any(), anyList(), anyString()))
                .thenReturn(DeliveryResult.permanentFailure("550 no such user", List.of("cris@example.com")));

        runner(context, QueueNames.OUT).runOnce();

        assertEquals(0, context.getStore().size(QueueNames.OUT));
        assertEquals(0, context.getStore().size(QueueNames.SHUNT));
        QueueEntry notice = single(context.getStore(), QueueNames.BOUNCES);
        assertEquals(QueueNotifier.TYPE_FAILURE, notice.getMetadata().getString(Metadata.NOTICE_TYPE));
        assertEquals("anne@example.com", notice.getMetadata().getString(Metadata.ORIGINAL_SENDER));
        assertEquals(List.of("cris@example.com"), notice.getMetadata().getStringList(Metadata.FAILED_RECIPIENTS));
    }

    @Test
    void unexpectedFailureIsShunted() throws IOException {
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        enqueueOutgoing(context, list, "bug@example.com");
        when(agent.deliver(any(), anyList(), anyString())).thenThrow(new IllegalStateException("bug"));

        runner(context, QueueNames.OUT).runOnce();

        QueueEntry shunted = single(context.getStore(), QueueNames.SHUNT);
        assertEquals(QueueNames.OUT, shunted.getMetadata().getString(Metadata.SHUNTED_FROM));
        assertTrue(shunted.getMetadata().getString(Metadata.LAST_ERROR).contains("bug"));
    }

    @Test
    void failureNoticeTravelsToOutgoing() throws IOException {
        // Given: A failure notice request in the bounces queue.
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        context.getNotifier().notifyFailure(list, TestMessages.memberPosting("bounced@example.com"),
                Metadata.forList(list.getName()), "550 no such user", List.of("cris@example.com"));

        // When: The bounces and virgin runners poll.
        runner(context, QueueNames.BOUNCES).runOnce();
        runner(context, QueueNames.VIRGIN).runOnce();

        // Then: The notice waits in the outgoing queue with a null envelope sender.
        QueueEntry out = single(context.getStore(), QueueNames.OUT);
        assertEquals(List.of("anne@example.com"), out.getMetadata().getStringList(Metadata.RECIPIENTS));
        assertEquals("", out.getMetadata().getString(Metadata.ENVELOPE_SENDER));
        assertTrue(out.getMetadata().getBoolean(Metadata.NOTICE));
    }

    @Test
    void noticeFailureIsNotNotifiedAgain() throws IOException {
        // Given: A notice that cannot be delivered.
        MailingList list = TestMessages.list();
        EngineContext context = context(list);
        Metadata metadata = Metadata.forList(list.getName())
                .put(Metadata.NOTICE, true)
                .put(Metadata.RECIPIENTS, new ArrayList<>(List.of("anne@example.com")))
                .put(Metadata.ENVELOPE_SENDER, "");
        context.getStore().enqueue(QueueNames.OUT, TestMessages.memberPosting("notice@example.com"), metadata);
        when(agent.deliver(any(), anyList(), anyString()))
                .thenReturn(DeliveryResult.permanentFailure("550 gone", List.of("anne@example.com")));

        // When: Delivery fails permanently.
        runner(context, QueueNames.OUT).runOnce();

        // Then: No notice about the notice.
        assertEquals(0, context.getStore().size(QueueNames.BOUNCES));
        assertEquals(0, context.getStore().size(QueueNames.OUT));
    }

    @Test
    void validateRequiresQueuePipeline() {
        EngineContext context = context(TestMessages.list());

        assertNull(runner(context, QueueNames.OUT).validate(TestMessages.list()));
    }

    private static QueueEntry peek(EngineContext context, String queue) throws IOException {
        QueueEntry entry = single(context.getStore(), queue);
        context.getStore().requeue(queue, entry.getId(), entry.getMessage(), entry.getMetadata(), queue,
                Instant.ofEpochMilli(entry.getMetadata().getLong(Metadata.NOT_BEFORE, 0L)));
        return entry;
    }
}
