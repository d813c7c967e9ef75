package com.mimecast.mailroom.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queue and chain Micrometer metrics.
 *
 * <p>Chain verdict counters are registered once; per queue counters carry a {@code queue} tag.
 */
public final class QueueMetrics {
    private static final Logger log = LogManager.getLogger(QueueMetrics.class);

    private static volatile Counter heldCounter;
    private static volatile Counter discardedCounter;
    private static volatile Counter rejectedCounter;
    private static volatile Counter acceptedCounter;

    /**
     * Private constructor for utility class.
     */
    private QueueMetrics() {
    }

    /**
     * Initialize verdict counters with zero values so they show up before any traffic.
     */
    public static void initialize() {
        try {
            if (MetricsRegistry.getPrometheusRegistry() != null) {
                initializeCounters();
                log.info("Queue metrics initialized");
            } else {
                log.warn("Cannot initialize queue metrics - Prometheus registry is null");
            }
        } catch (Exception e) {
            log.error("Failed to initialize queue metrics: {}", e.getMessage(), e);
        }
    }

    public static void incrementHeld() {
        increment("hold");
    }

    public static void incrementDiscarded() {
        increment("discard");
    }

    public static void incrementRejected() {
        increment("reject");
    }

    public static void incrementAccepted() {
        increment("accept");
    }

    /**
     * Entry processed to completion by a runner.
     *
     * @param queue Queue name.
     */
    public static void incrementProcessed(String queue) {
        incrementTagged("mailroom.queue.processed", "Number of entries processed", queue);
    }

    /**
     * Entry requeued after a transient failure.
     *
     * @param queue Queue name.
     */
    public static void incrementRetried(String queue) {
        incrementTagged("mailroom.queue.retried", "Number of entries requeued for retry", queue);
    }

    /**
     * Entry moved to the shunt queue.
     *
     * @param queue Queue name the entry was shunted from.
     */
    public static void incrementShunted(String queue) {
        incrementTagged("mailroom.queue.shunted", "Number of entries shunted", queue);
    }

    /**
     * Store operation failed while an entry was being processed.
     *
     * @param queue Queue name.
     */
    public static void incrementStorageFailure(String queue) {
        incrementTagged("mailroom.queue.storage.failures", "Number of store failures while processing entries", queue);
    }

    /**
     * Entry whose store failures reached the retry limit.
     *
     * @param queue Queue name.
     */
    public static void incrementStorageEscalated(String queue) {
        incrementTagged("mailroom.queue.storage.escalated", "Number of entries escalated after repeated store failures", queue);
    }

    /**
     * Corrupt entry moved to quarantine.
     *
     * @param queue Queue name.
     */
    public static void incrementQuarantined(String queue) {
        incrementTagged("mailroom.queue.quarantined", "Number of corrupt entries quarantined", queue);
    }

    /**
     * Abandoned staged entries made ready again.
     *
     * @param queue Queue name.
     * @param count Number recovered.
     */
    public static void incrementRecovered(String queue, int count) {
        try {
            PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null && count > 0) {
                Counter.builder("mailroom.queue.recovered")
                        .description("Number of abandoned staged entries recovered")
                        .tag("queue", queue)
                        .register(registry)
                        .increment(count);
            }
        } catch (Exception e) {
            log.warn("Failed to increment recovered counter: {}", e.getMessage());
        }
    }

    /**
     * Message handed to the delivery agent successfully.
     *
     * @param queue Queue name.
     */
    public static void incrementDelivered(String queue) {
        incrementTagged("mailroom.queue.delivered", "Number of messages delivered", queue);
    }

    private static void increment(String verdict) {
        try {
            if (heldCounter == null) {
                synchronized (QueueMetrics.class) {
                    if (heldCounter == null) {
                        initializeCounters();
                    }
                }
            }
            Counter counter = lookup(verdict);
            if (counter != null) {
                counter.increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} verdict counter: {}", verdict, e.getMessage());
        }
    }

    private static Counter lookup(String verdict) {
        switch (verdict) {
            case "hold":
                return heldCounter;
            case "discard":
                return discardedCounter;
            case "reject":
                return rejectedCounter;
            default:
                return acceptedCounter;
        }
    }

    private static void incrementTagged(String name, String description, String queue) {
        try {
            PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                Counter.builder(name)
                        .description(description)
                        .tag("queue", queue)
                        .register(registry)
                        .increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    private static void initializeCounters() {
        PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        discardedCounter = verdictCounter(registry, "discard");
        rejectedCounter = verdictCounter(registry, "reject");
        acceptedCounter = verdictCounter(registry, "accept");
        heldCounter = verdictCounter(registry, "hold");
    }

    private static Counter verdictCounter(PrometheusMeterRegistry registry, String verdict) {
        return Counter.builder("mailroom.chain.verdicts")
                .description("Number of rule chain verdicts")
                .tag("verdict", verdict)
                .register(registry);
    }

    /**
     * Reset cached counters, used when the registry changes.
     */
    public static void resetCounters() {
        synchronized (QueueMetrics.class) {
            heldCounter = null;
            discardedCounter = null;
            rejectedCounter = null;
            acceptedCounter = null;
        }
    }
}
