package com.mimecast.mailroom.pipeline;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.StorageException;
import com.mimecast.mailroom.util.MutableClock;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PipelineExecutorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
    private PipelineExecutor executor;
    private MailingList list;
    private MailMessage message;
    private Metadata metadata;
    private final List<String> calls = new ArrayList<>();
    private final AtomicInteger checkpoints = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        executor = new PipelineExecutor(Duration.ofMillis(500), clock, "test-handler");
        list = TestMessages.list();
        message = TestMessages.memberPosting("pipe@example.com");
        metadata = Metadata.forList(list.getName());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private Handler handler(String name, HandlerResult result) {
        return new Handler() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return name;
            }

            @Override
            public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
                calls.add(name);
                return result;
            }
        };
    }

    private Handler failing(String name, Exception exception) {
        return new Handler() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return name;
            }

            @Override
            public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws HandlerException {
                calls.add(name);
                if (exception instanceof HandlerException) {
                    throw (HandlerException) exception;
                }
                throw (RuntimeException) exception;
            }
        };
    }

    private PipelineOutcome run(Handler... handlers) throws HandlerException, StorageException {
        return executor.run(new Pipeline("test", List.of(handlers)), message, metadata, list, checkpoints::incrementAndGet);
    }

    @Test
    void runsAllHandlersInOrder() throws Exception {
        PipelineOutcome outcome = run(handler("a", HandlerResult.proceed()), handler("b", HandlerResult.proceed()));

        assertTrue(outcome.isTerminal());
        assertEquals(List.of("a", "b"), calls);
        assertTrue(metadata.isCompleted("a"));
        assertTrue(metadata.isCompleted("b"));
        assertEquals(2, checkpoints.get());
        assertEquals(2, metadata.getDecisions().size());
    }

    @Test
    void stopEndsProcessing() throws Exception {
        PipelineOutcome outcome = run(handler("a", HandlerResult.stop()), handler("b", HandlerResult.proceed()));

        assertTrue(outcome.isTerminal());
        assertEquals(List.of("a"), calls);
        assertEquals(0, checkpoints.get());
    }

    @Test
    void forwardNamesTargetQueue() throws Exception {
        PipelineOutcome outcome = run(handler("a", HandlerResult.forward(QueueNames.OUT)), handler("b", HandlerResult.proceed()));

        assertFalse(outcome.isTerminal());
        assertEquals(QueueNames.OUT, outcome.getTargetQueue());
        assertEquals(List.of("a"), calls);
    }

    @Test
    void nullResultContinues() throws Exception {
        run(handler("a", null), handler("b", HandlerResult.proceed()));

        assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void completedHandlersAreSkipped() throws Exception {
        // Given: A previous run completed the first handler.
        metadata.markCompleted("a");

        // When: Running the pipeline again.
        run(handler("a", HandlerResult.proceed()), handler("b", HandlerResult.proceed()));

        // Then: Only the remaining handler runs.
        assertEquals(List.of("b"), calls);
    }

    @Test
    void failureKeepsEarlierMarkers() {
        TransientHandlerException failure = new TransientHandlerException("smtp down");

        TransientHandlerException thrown = assertThrows(TransientHandlerException.class,
                () -> run(handler("a", HandlerResult.proceed()), failing("b", failure), handler("c", HandlerResult.proceed())));

        assertSame(failure, thrown);
        assertTrue(metadata.isCompleted("a"));
        assertFalse(metadata.isCompleted("b"));
        assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void permanentFailurePropagates() {
        assertThrows(PermanentHandlerException.class,
                () -> run(failing("a", new PermanentHandlerException("no such user"))));
    }

    @Test
    void unexpectedExceptionIsWrapped() {
        HandlerException thrown = assertThrows(HandlerException.class,
                () -> run(failing("a", new IllegalStateException("bug"))));

        assertFalse(thrown instanceof TransientHandlerException);
        assertFalse(thrown instanceof PermanentHandlerException);
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void timeoutIsTransientAndExecutorRecovers() throws Exception {
        // Given: A handler blocking past the deadline.
        CountDownLatch release = new CountDownLatch(1);
        Handler slow = new Handler() {
            @Override
            public String getName() {
                return "slow";
            }

            @Override
            public String getDescription() {
                return "slow";
            }

            @Override
            public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return HandlerResult.proceed();
            }
        };

        // When: Running it.
        TransientHandlerException thrown = assertThrows(TransientHandlerException.class, () -> run(slow));

        // Then: It times out and the next run uses a fresh worker.
        assertTrue(thrown.getMessage().contains("timed out"));
        assertFalse(metadata.isCompleted("slow"));
        release.countDown();

        run(handler("after", HandlerResult.proceed()));
        assertEquals(List.of("after"), calls);
    }

    @Test
    void checkpointFailurePropagates() {
        Pipeline pipeline = new Pipeline("test", List.of(handler("a", HandlerResult.proceed())));

        assertThrows(StorageException.class, () -> executor.run(pipeline, message, metadata, list, () -> {
            throw new StorageException("disk full");
        }));
    }
}
