package com.mimecast.mailroom.pipeline;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs pipelines.
 *
 * <p>Handlers run strictly in order. Handlers carrying a completion marker are skipped; a handler
 * that returns is marked complete and the entry checkpointed before the next one runs.
 * <p>Each handler call runs under a deadline on a worker thread; overrunning it is a transient failure.
 * The worker is interrupted but the runner moves on regardless.
 */
public class PipelineExecutor implements Closeable {
    private static final Logger log = LogManager.getLogger(PipelineExecutor.class);

    /**
     * Persists progress after each handler.
     */
    @FunctionalInterface
    public interface Checkpoint {
        void save() throws StorageException;
    }

    private final Duration timeout;
    private final Clock clock;
    private final String threadName;
    private ExecutorService executor;

    /**
     * Constructs a new PipelineExecutor.
     *
     * @param timeout    Handler deadline.
     * @param clock      Clock for the decision log.
     * @param threadName Worker thread name.
     */
    public PipelineExecutor(Duration timeout, Clock clock, String threadName) {
        this.timeout = timeout;
        this.clock = clock;
        this.threadName = threadName;
        this.executor = newExecutor();
    }

    /**
     * Runs a pipeline.
     *
     * @param pipeline   Pipeline.
     * @param message    Message, mutated by handlers.
     * @param metadata   Metadata, mutated by handlers.
     * @param list       Target list.
     * @param checkpoint Called after each completed handler.
     * @return PipelineOutcome.
     * @throws HandlerException Handler failure; completed handlers stay marked.
     * @throws StorageException Checkpoint failure.
     */
    public PipelineOutcome run(Pipeline pipeline, MailMessage message, Metadata metadata, MailingList list,
                               Checkpoint checkpoint) throws HandlerException, StorageException {
        for (Handler handler : pipeline.getHandlers()) {
            if (metadata.isCompleted(handler.getName())) {
                log.debug("Skipping completed handler {} for {}", handler.getName(), message.getMessageId());
                continue;
            }

            HandlerResult result = call(handler, message, metadata, list);
            log.debug("Handler {} on {}: {}", handler.getName(), message.getMessageId(), result);

            metadata.markCompleted(handler.getName());
            metadata.recordDecision(handler.getName(), result.toString(), null, clock.instant());

            switch (result.getType()) {
                case STOP:
                    return PipelineOutcome.terminal();
                case FORWARD:
                    return PipelineOutcome.forward(result.getQueue());
                default:
                    checkpoint.save();
            }
        }
        return PipelineOutcome.terminal();
    }

    private HandlerResult call(Handler handler, MailMessage message, Metadata metadata, MailingList list) throws HandlerException {
        Future<HandlerResult> future = submit(() -> handler.process(message, metadata, list));
        try {
            HandlerResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : HandlerResult.proceed();
        } catch (TimeoutException e) {
            future.cancel(true);
            recycle();
            throw new TransientHandlerException("Handler " + handler.getName() + " timed out after " + timeout.getSeconds() + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientHandlerException("Interrupted while running handler " + handler.getName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HandlerException) {
                throw (HandlerException) cause;
            }
            throw new HandlerException("Handler " + handler.getName() + " failed: " + cause, cause);
        }
    }

    private synchronized Future<HandlerResult> submit(Callable<HandlerResult> task) {
        return executor.submit(task);
    }

    /**
     * Replaces the worker so a wedged handler thread does not block the next call.
     */
    private synchronized void recycle() {
        executor.shutdownNow();
        executor = newExecutor();
    }

    private ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void close() {
        executor.shutdownNow();
    }
}
