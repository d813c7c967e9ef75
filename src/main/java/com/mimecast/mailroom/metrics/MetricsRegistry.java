package com.mimecast.mailroom.metrics;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Holder of the registry that {@link QueueMetrics} counters are published to.
 *
 * <p>Runners, the chain evaluator and handlers update counters unconditionally. Until
 * {@link MetricsEndpoint} registers its Prometheus registry those updates are dropped, so an engine
 * run without the endpoint, or a test, needs no metrics setup. Registering null drops them again.
 */
public final class MetricsRegistry {
    private static volatile PrometheusMeterRegistry prometheusRegistry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Publishes queue and chain counters to a registry.
     * <p>Callers replacing a registry also call {@link QueueMetrics#resetCounters()}.
     *
     * @param registry Prometheus registry, null to drop counter updates.
     */
    public static void register(PrometheusMeterRegistry registry) {
        prometheusRegistry = registry;
    }

    /**
     * Gets the registry counters are published to.
     *
     * @return PrometheusMeterRegistry or null when counters are dropped.
     */
    public static PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }
}
