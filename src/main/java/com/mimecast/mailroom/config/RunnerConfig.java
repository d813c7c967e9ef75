package com.mimecast.mailroom.config;

import java.util.Map;

/**
 * Configuration for a single runner instance.
 *
 * <p>Disjoint {@code shard} values over the same {@code shards} count partition a queue
 * between runner instances without coordination.
 */
public class RunnerConfig extends BasicConfig {

    /**
     * Constructs a new RunnerConfig instance.
     *
     * @param map Configuration map.
     */
    public RunnerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets queue name.
     *
     * @return String.
     */
    public String getQueue() {
        return getStringProperty("queue");
    }

    /**
     * Gets the shard this runner serves.
     *
     * @return Zero based shard index.
     */
    public int getShard() {
        return Math.toIntExact(getLongProperty("shard", 0L));
    }

    /**
     * Gets the total shard count.
     *
     * @return Integer, 1 means no sharding.
     */
    public int getShards() {
        return Math.toIntExact(getLongProperty("shards", 1L));
    }

    /**
     * Gets the poll interval override.
     *
     * @param defaultValue Engine wide value.
     * @return Milliseconds.
     */
    public long getPollIntervalMillis(long defaultValue) {
        return getLongProperty("pollIntervalMillis", defaultValue);
    }

    /**
     * Gets the batch size override.
     *
     * @param defaultValue Engine wide value.
     * @return Maximum entries claimed per polling pass, 0 for no limit.
     */
    public int getBatchSize(int defaultValue) {
        return Math.toIntExact(getLongProperty("batchSize", (long) defaultValue));
    }
}
