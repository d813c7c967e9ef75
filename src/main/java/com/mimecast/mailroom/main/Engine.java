package com.mimecast.mailroom.main;

import com.mimecast.mailroom.config.EngineConfig;
import com.mimecast.mailroom.config.RunnerConfig;
import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.metrics.MetricsEndpoint;
import com.mimecast.mailroom.metrics.QueueMetrics;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.moderation.ModerationService;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.EntryNotFoundException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueEntry;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.queue.StorageException;
import com.mimecast.mailroom.runner.IncomingRunner;
import com.mimecast.mailroom.runner.PipelineRunner;
import com.mimecast.mailroom.runner.Runner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sun.misc.Signal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Engine lifecycle.
 *
 * <p>Starts one thread per configured runner, the hold expiry cron and the optional metrics endpoint.
 * <p>Stops gracefully on JVM shutdown; each runner finishes the entry in progress.
 * SIGHUP requests every runner to reload list configuration between passes.
 */
public class Engine {
    private static final Logger log = LogManager.getLogger(Engine.class);

    private final EngineContext context;
    private final List<Runner> runners = new ArrayList<>();
    private ExecutorService runnerExecutor;
    private ScheduledExecutorService scheduler;
    private MetricsEndpoint metricsEndpoint;

    /**
     * Constructs a new Engine.
     *
     * @param context Engine context.
     */
    public Engine(EngineContext context) {
        this.context = context;
    }

    /**
     * Creates a runner for a queue.
     *
     * @param context            Engine context.
     * @param queue              Queue name.
     * @param shard              Shard assignment.
     * @param pollIntervalMillis Idle sleep between polls.
     * @param batchSize          Maximum entries per pass.
     * @return Runner instance.
     * @throws IllegalArgumentException Queue is not processed by runners.
     */
    public static Runner createRunner(EngineContext context, String queue, ShardAssignment shard,
                                      long pollIntervalMillis, int batchSize) {
        if (QueueNames.IN.equals(queue)) {
            return new IncomingRunner(context, shard, pollIntervalMillis, batchSize);
        }
        if (QueueNames.PROCESSED.contains(queue)) {
            return new PipelineRunner(context, queue, shard, pollIntervalMillis, batchSize);
        }
        throw new IllegalArgumentException("No runner for queue: " + queue);
    }

    /**
     * Creates the configured runners.
     * <p>Without runner configuration one unsharded runner is created per processed queue.
     *
     * @return List of Runner.
     */
    public List<Runner> createRunners() {
        EngineConfig config = context.getConfig();
        List<Runner> created = new ArrayList<>();
        List<RunnerConfig> configured = config.getRunners();

        if (configured.isEmpty()) {
            for (String queue : QueueNames.PROCESSED) {
                created.add(createRunner(context, queue, ShardAssignment.ALL, config.getPollIntervalMillis(), config.getBatchSize()));
            }
            return created;
        }

        for (RunnerConfig runner : configured) {
            ShardAssignment shard = new ShardAssignment(config.getShardStrategy(), runner.getShard(), runner.getShards());
            created.add(createRunner(context, runner.getQueue(), shard,
                    runner.getPollIntervalMillis(config.getPollIntervalMillis()),
                    runner.getBatchSize(config.getBatchSize())));
        }
        return created;
    }

    /**
     * Starts the given runners and the background services.
     *
     * @param toStart Runners.
     */
    public void start(List<Runner> toStart) {
        runners.addAll(toStart);
        startMetrics();
        registerShutdownHook();
        registerReloadSignal();

        runnerExecutor = Executors.newFixedThreadPool(Math.max(1, runners.size()), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("mailroom-runner-" + thread.getId());
            return thread;
        });
        for (Runner runner : runners) {
            runnerExecutor.submit(runner);
            log.info("Started runner {} on shard {}", runner.getQueue(), runner.getShard());
        }

        ModerationService moderation = new ModerationService(context.getLedger(), context.getStore(),
                context.getNotifier(), context.getClock());
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mailroom-hold-expiry");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> expireHolds(moderation), 1, 60, TimeUnit.MINUTES);
    }

    /**
     * Stops runners and background services and waits for in-flight entries to finish.
     */
    public void shutdown() {
        log.info("Engine is shutting down.");
        for (Runner runner : runners) {
            runner.stop();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (runnerExecutor != null) {
            runnerExecutor.shutdown();
            try {
                if (!runnerExecutor.awaitTermination(context.getHandlerTimeout().getSeconds() + 5, TimeUnit.SECONDS)) {
                    runnerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                runnerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (metricsEndpoint != null) {
            metricsEndpoint.stop();
        }
        log.info("Shutdown complete.");
    }

    /**
     * Requests every runner to reload list configuration.
     */
    public void reload() {
        for (Runner runner : runners) {
            runner.requestReload();
        }
    }

    /**
     * Gets runner states keyed by queue and shard.
     *
     * @return Map of runner to state.
     */
    public Map<String, String> getRunnerStates() {
        Map<String, String> states = new LinkedHashMap<>();
        for (Runner runner : runners) {
            states.put(runner.getQueue() + "/" + runner.getShard(), runner.getState().name());
        }
        return Collections.unmodifiableMap(states);
    }

    /**
     * Enqueues a raw message into the incoming queue.
     *
     * @param message  Message.
     * @param listName List name.
     * @param toOwner  Addressed to the list owner instead of the members.
     * @return Entry id.
     * @throws StorageException I/O failure.
     */
    public EntryId inject(MailMessage message, String listName, boolean toOwner) throws StorageException {
        Metadata metadata = Metadata.forList(listName.toLowerCase());
        if (toOwner) {
            metadata.put(Metadata.TO_OWNER, true);
        }
        EntryId id = context.getStore().enqueue(QueueNames.IN, message, metadata);
        log.info("Injected {} for {} as {}/{}", message.getMessageId(), listName, QueueNames.IN, id);
        return id;
    }

    /**
     * Moves every shunted entry back to the queue it was shunted from with retries reset.
     *
     * @return Number of entries moved.
     * @throws StorageException I/O failure listing the shunt queue.
     */
    public int unshunt() throws StorageException {
        int moved = 0;
        for (EntryId id : context.getStore().listReady(QueueNames.SHUNT)) {
            QueueEntry entry;
            try {
                entry = context.getStore().dequeue(QueueNames.SHUNT, id);
            } catch (EntryNotFoundException e) {
                continue;
            }
            Metadata metadata = entry.getMetadata();
            String target = metadata.getString(Metadata.SHUNTED_FROM);
            if (target == null || !QueueNames.PROCESSED.contains(target)) {
                target = QueueNames.IN;
            }
            metadata.remove(Metadata.SHUNTED_FROM)
                    .remove(Metadata.RETRY_COUNT)
                    .remove(Metadata.NOT_BEFORE);
            context.getStore().requeue(QueueNames.SHUNT, id, entry.getMessage(), metadata, target);
            log.info("Unshunted {} to {}", id, target);
            moved++;
        }
        return moved;
    }

    private void expireHolds(ModerationService moderation) {
        try {
            ListRegistry lists = context.loadLists();
            int expired = moderation.expire(lists);
            if (expired > 0) {
                log.info("Expired {} holds", expired);
            }
        } catch (IOException e) {
            log.error("Hold expiry skipped, unable to load lists: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Hold expiry failed: {}", e.getMessage(), e);
        }
    }

    private void startMetrics() {
        int port = Math.toIntExact(context.getConfig().getMetrics().getLongProperty("port", 0L));
        if (port <= 0) {
            log.info("Metrics endpoint disabled");
            return;
        }
        try {
            metricsEndpoint = new MetricsEndpoint(this::getRunnerStates);
            metricsEndpoint.start(port);
            QueueMetrics.initialize();
        } catch (IOException e) {
            log.error("Unable to start metrics endpoint: {}", e.getMessage());
        }
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
    }

    private void registerReloadSignal() {
        try {
            Signal.handle(new Signal("HUP"), signal -> {
                log.info("Received SIGHUP signal, reloading list configuration...");
                reload();
            });
            log.info("SIGHUP signal handler registered for configuration reload");
        } catch (IllegalArgumentException e) {
            log.warn("SIGHUP signal not supported on this platform: {}", e.getMessage());
        }
    }
}
