package com.mimecast.mailroom.runner;

import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.metrics.QueueMetrics;
import com.mimecast.mailroom.pipeline.HandlerException;
import com.mimecast.mailroom.pipeline.PermanentHandlerException;
import com.mimecast.mailroom.pipeline.PipelineExecutor;
import com.mimecast.mailroom.pipeline.PipelineOutcome;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.CorruptEntryException;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.EntryNotFoundException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueEntry;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Queue runner.
 *
 * <p>Polls one queue shard, claims ready entries one at a time and hands each to
 * {@link #processEntry(QueueEntry, MailingList)}. The outcome is committed through the store:
 * a terminal outcome finishes the entry, a forward re-homes it.
 * <p>Failures are classified here:
 * <ul>
 *     <li>Transient: retried in the same queue after a backoff delay, shunted once retries run out.</li>
 *     <li>Permanent: the sender is notified where appropriate and the entry finished.</li>
 *     <li>Anything else: shunted with the error recorded.</li>
 * </ul>
 * <p>A store failure while processing releases the entry back to its queue after a backoff delay.
 * Once store failures reach the retry limit the failure is escalated and the entry shunted. When the
 * store cannot take the entry back it stays staged and recovery makes it ready again; failures of
 * such entries are remembered in memory so escalation still happens.
 * <p>Abandoned claims are recovered when the runner starts and then once per grace period.
 */
public abstract class Runner implements Runnable {
    protected final Logger log = LogManager.getLogger(getClass());

    protected final EngineContext context;
    protected final QueueStore store;
    protected final String queue;
    protected final ShardAssignment shard;
    protected final Clock clock;
    protected final PipelineExecutor executor;

    private final long pollIntervalMillis;
    private final int batchSize;
    private final Object sleeper = new Object();

    private volatile RunnerState state = RunnerState.STOPPED;
    private volatile boolean stopRequested = false;
    private volatile boolean reloadRequested = false;

    private Map<String, MailingList> lists;
    private final Map<EntryId, Integer> stalled = new HashMap<>();
    private Instant lastRecovery;

    /**
     * Constructs a new Runner.
     *
     * @param context            Engine context.
     * @param queue              Queue to process.
     * @param shard              Shard assignment.
     * @param pollIntervalMillis Idle sleep between polls.
     * @param batchSize          Maximum entries per pass, 0 for no limit.
     */
    protected Runner(EngineContext context, String queue, ShardAssignment shard, long pollIntervalMillis, int batchSize) {
        this.context = context;
        this.store = context.getStore();
        this.queue = queue;
        this.shard = shard;
        this.clock = context.getClock();
        this.pollIntervalMillis = pollIntervalMillis;
        this.batchSize = batchSize;
        this.executor = new PipelineExecutor(context.getHandlerTimeout(), clock, "mailroom-" + queue + "-" + shard.getShard() + "-handler");
    }

    /**
     * Processes one claimed entry.
     *
     * @param entry Claimed entry; message and metadata may be mutated.
     * @param list  Target list.
     * @return PipelineOutcome.
     * @throws HandlerException Handler failure.
     * @throws StorageException Store failure.
     */
    protected abstract PipelineOutcome processEntry(QueueEntry entry, MailingList list) throws HandlerException, StorageException;

    /**
     * Checks this runner has what it needs to process entries of a list.
     *
     * @param list List.
     * @return Error description or null when usable.
     */
    protected abstract String validate(MailingList list);

    @Override
    public void run() {
        state = RunnerState.STARTING;
        log.info("Runner {} starting on shard {}", queue, shard);
        try {
            loadLists();
            recover();

            while (!stopRequested) {
                if (reloadRequested) {
                    reloadRequested = false;
                    loadLists();
                }

                int processed = runOnce();
                if (processed == 0 && !stopRequested) {
                    idle();
                }
            }
        } catch (RuntimeException e) {
            log.fatal("Runner {} on shard {} crashed: {}", queue, shard, e.getMessage(), e);
        } finally {
            state = RunnerState.STOPPING;
            executor.close();
            state = RunnerState.STOPPED;
            log.info("Runner {} on shard {} stopped", queue, shard);
        }
    }

    /**
     * Runs a single polling pass.
     *
     * @return Number of entries processed.
     */
    public int runOnce() {
        if (lists == null) {
            loadLists();
        }
        if (lastRecovery == null || !clock.instant().isBefore(lastRecovery.plus(context.getGrace()))) {
            recover();
        }

        state = RunnerState.POLLING;
        List<EntryId> ready;
        try {
            ready = store.listReady(queue, shard, clock.instant());
        } catch (StorageException e) {
            log.error("Unable to list queue {}: {}", queue, e.getMessage());
            return 0;
        }

        int processed = 0;
        for (EntryId id : ready) {
            if (stopRequested || (batchSize > 0 && processed >= batchSize)) {
                break;
            }
            if (process(id)) {
                processed++;
            }
        }
        state = RunnerState.POLLING;
        return processed;
    }

    /**
     * Requests the runner to stop after the entry in progress.
     */
    public void stop() {
        stopRequested = true;
        synchronized (sleeper) {
            sleeper.notifyAll();
        }
    }

    /**
     * Requests a list configuration reload before the next pass.
     */
    public void requestReload() {
        reloadRequested = true;
    }

    public RunnerState getState() {
        return state;
    }

    public String getQueue() {
        return queue;
    }

    public ShardAssignment getShard() {
        return shard;
    }

    /**
     * Claims and processes one entry.
     *
     * @param id Entry id.
     * @return True if the entry was claimed.
     */
    private boolean process(EntryId id) {
        MailingList list = lists.get(id.getListDigest());
        if (list == null) {
            log.debug("Skipping {}/{}: list unknown or disabled", queue, id);
            return false;
        }

        QueueEntry entry;
        try {
            entry = store.dequeue(queue, id);
        } catch (EntryNotFoundException e) {
            log.debug("Entry {}/{} claimed elsewhere", queue, id);
            return false;
        } catch (CorruptEntryException e) {
            log.error("Entry {}/{} quarantined: {}", queue, id, e.getMessage());
            QueueMetrics.incrementQuarantined(queue);
            return true;
        } catch (StorageException e) {
            log.error("Unable to claim {}/{}: {}", queue, id, e.getMessage());
            return false;
        }

        state = RunnerState.PROCESSING;
        try {
            PipelineOutcome outcome = processEntry(entry, list);
            commit(entry, outcome);
            stalled.remove(entry.getId());
            QueueMetrics.incrementProcessed(queue);
        } catch (TransientHandlerException e) {
            retry(entry, list, e);
        } catch (PermanentHandlerException e) {
            fail(entry, list, e);
        } catch (HandlerException | RuntimeException e) {
            shunt(entry, e);
        } catch (StorageException e) {
            storageFailure(entry, list, e);
        } finally {
            state = RunnerState.POLLING;
        }
        return true;
    }

    private void commit(QueueEntry entry, PipelineOutcome outcome) throws StorageException {
        if (outcome.isTerminal()) {
            store.finish(queue, entry.getId());
            log.debug("Finished {}", entry);
        } else {
            EntryId next = store.requeue(queue, entry.getId(), entry.getMessage(), entry.getMetadata(), outcome.getTargetQueue());
            log.debug("Moved {} to {}/{}", entry, outcome.getTargetQueue(), next);
        }
    }

    private void retry(QueueEntry entry, MailingList list, TransientHandlerException e) {
        Metadata metadata = entry.getMetadata();
        int attempts = metadata.incrementRetryCount();
        int maxRetries = list.getMaxRetries().orElse(context.getRetryPolicy().getMaxRetries());
        metadata.put(Metadata.LAST_ERROR, e.getMessage());

        try {
            if (attempts >= maxRetries) {
                log.warn("Retries exhausted for {} after {} attempts, shunting: {}", entry, attempts, e.getMessage());
                metadata.recordDecision(queue, "shunt", "retries exhausted: " + e.getMessage(), clock.instant());
                metadata.put(Metadata.SHUNTED_FROM, queue);
                store.requeue(queue, entry.getId(), entry.getMessage(), metadata, QueueNames.SHUNT);
                QueueMetrics.incrementShunted(queue);
                return;
            }

            long delay = context.getRetryPolicy().computeDelayMs(attempts);
            Instant notBefore = clock.instant().plusMillis(delay);
            metadata.put(Metadata.NOT_BEFORE, notBefore.toEpochMilli());
            metadata.recordDecision(queue, "retry", e.getMessage(), clock.instant());
            store.requeue(queue, entry.getId(), entry.getMessage(), metadata, queue, notBefore);
            QueueMetrics.incrementRetried(queue);
            log.info("Transient failure on {}, attempt {} of {}, retry after {}: {}", entry, attempts, maxRetries, notBefore, e.getMessage());
        } catch (StorageException se) {
            storageFailure(entry, list, se);
        }
    }

    private void fail(QueueEntry entry, MailingList list, PermanentHandlerException e) {
        Metadata metadata = entry.getMetadata();
        log.warn("Permanent failure on {}: {}", entry, e.getMessage());
        metadata.put(Metadata.LAST_ERROR, e.getMessage());
        metadata.recordDecision(queue, "failed", e.getMessage(), clock.instant());

        try {
            List<String> failed = metadata.getStringList(Metadata.FAILED_RECIPIENTS);
            if (failed.isEmpty()) {
                failed = metadata.getStringList(Metadata.RECIPIENTS);
            }
            context.getNotifier().notifyFailure(list, entry.getMessage(), metadata, e.getMessage(), failed);
            store.finish(queue, entry.getId());
        } catch (StorageException se) {
            storageFailure(entry, list, se);
        }
    }

    private void shunt(QueueEntry entry, Exception e) {
        log.error("Unexpected failure on {}, shunting: {}", entry, e.getMessage(), e);
        Metadata metadata = entry.getMetadata();
        metadata.put(Metadata.LAST_ERROR, String.valueOf(e));
        metadata.put(Metadata.SHUNTED_FROM, queue);
        metadata.recordDecision(queue, "shunt", String.valueOf(e), clock.instant());
        try {
            store.requeue(queue, entry.getId(), entry.getMessage(), metadata, QueueNames.SHUNT);
            QueueMetrics.incrementShunted(queue);
        } catch (StorageException se) {
            log.error("Unable to shunt {}, left staged for recovery: {}", entry, se.getMessage());
        }
    }

    private void storageFailure(QueueEntry entry, MailingList list, StorageException e) {
        Metadata metadata = entry.getMetadata();
        int failures = metadata.getStorageFailures() + stalled.getOrDefault(entry.getId(), 0) + 1;
        metadata.put(Metadata.STORAGE_FAILURES, (long) failures);
        int maxRetries = list.getMaxRetries().orElse(context.getRetryPolicy().getMaxRetries());
        metadata.put(Metadata.LAST_ERROR, e.getMessage());
        QueueMetrics.incrementStorageFailure(queue);

        try {
            if (failures >= maxRetries) {
                log.error("Store failures on {} escalated after {} attempts, shunting: {}", entry, failures, e.getMessage());
                QueueMetrics.incrementStorageEscalated(queue);
                metadata.recordDecision(queue, "shunt", "store failures: " + e.getMessage(), clock.instant());
                metadata.put(Metadata.SHUNTED_FROM, queue);
                store.requeue(queue, entry.getId(), entry.getMessage(), metadata, QueueNames.SHUNT);
                QueueMetrics.incrementShunted(queue);
            } else {
                Instant notBefore = clock.instant().plusMillis(context.getRetryPolicy().computeDelayMs(failures));
                metadata.put(Metadata.NOT_BEFORE, notBefore.toEpochMilli());
                store.requeue(queue, entry.getId(), entry.getMessage(), metadata, queue, notBefore);
                log.warn("Store failure on {}, attempt {} of {}, released until {}: {}", entry, failures, maxRetries, notBefore, e.getMessage());
            }
            stalled.remove(entry.getId());
        } catch (StorageException se) {
            stalled.merge(entry.getId(), 1, Integer::sum);
            log.error("Unable to release {} after store failure {}, left staged for recovery: {}", entry, failures, se.getMessage());
        }
    }

    private void recover() {
        lastRecovery = clock.instant();
        try {
            int recovered = store.recover(queue, shard, context.getGrace(), lastRecovery);
            if (recovered > 0) {
                log.warn("Recovered {} abandoned entries in {} on shard {}", recovered, queue, shard);
                QueueMetrics.incrementRecovered(queue, recovered);
            }
        } catch (StorageException e) {
            log.error("Recovery of {} failed: {}", queue, e.getMessage());
        }
    }

    /**
     * Loads list configurations, disabling lists this runner cannot process.
     * <p>On failure the previous configuration is kept.
     */
    private void loadLists() {
        ListRegistry registry;
        try {
            registry = context.loadLists();
        } catch (IOException e) {
            log.error("Unable to load lists for runner {}: {}", queue, e.getMessage());
            if (lists == null) {
                lists = Collections.emptyMap();
            }
            return;
        }

        Map<String, MailingList> usable = new HashMap<>();
        for (MailingList list : registry.getLists()) {
            String error = validate(list);
            if (error != null) {
                log.error("List {} disabled in runner {}: {}", list.getName(), queue, error);
                continue;
            }
            usable.put(EntryId.digest(list.getName()), list);
        }
        lists = usable;
        log.info("Runner {} on shard {} serving {} lists", queue, shard, usable.size());
    }

    private void idle() {
        synchronized (sleeper) {
            if (stopRequested) {
                return;
            }
            try {
                sleeper.wait(pollIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested = true;
            }
        }
    }
}
