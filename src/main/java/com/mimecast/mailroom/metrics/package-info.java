/**
 * Collects and exposes engine metrics.
 *
 * <p>The {@link com.mimecast.mailroom.metrics.MetricsRegistry} holds the Prometheus registry;
 * <br>metrics are no-ops until the {@link com.mimecast.mailroom.metrics.MetricsEndpoint} registers one.
 */
package com.mimecast.mailroom.metrics;
