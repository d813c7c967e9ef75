package com.mimecast.mailroom.config;

import com.mimecast.mailroom.queue.ShardStrategy;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration.
 *
 * <p>This class provides type safe access to the engine configuration file {@code mailroom.json5}.
 * <p>Rule chains and handler pipelines may live inline or in their own files next to it,
 * in which case they are loaded lazily on first access.
 *
 * @see RetryConfig
 * @see RunnerConfig
 */
@SuppressWarnings("unchecked")
public class EngineConfig extends ConfigFoundation {

    /**
     * Configuration directory.
     */
    private String configDir;

    /**
     * Mapping of configuration keys to their filenames for lazy loading.
     */
    private static final Map<String, String> CONFIG_FILENAMES = new HashMap<>();

    static {
        CONFIG_FILENAMES.put("chains", "chains.json5");
        CONFIG_FILENAMES.put("pipelines", "pipelines.json5");
        CONFIG_FILENAMES.put("metrics", "metrics.json5");
    }

    /**
     * Constructs a new EngineConfig instance with defaults.
     */
    public EngineConfig() {
        super();
        this.configDir = null;
    }

    /**
     * Constructs a new EngineConfig instance.
     *
     * @param map Configuration map.
     */
    public EngineConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new EngineConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public EngineConfig(String path) throws IOException {
        super(path);
        this.configDir = new File(path).getAbsoluteFile().getParent();
    }

    /**
     * Gets configuration directory.
     *
     * @return Directory path or null if built from a map.
     */
    public String getConfigDir() {
        return configDir;
    }

    /**
     * Gets hostname used in generated notices.
     *
     * @return Hostname.
     */
    public String getHostname() {
        return getStringProperty("hostname", "example.com");
    }

    /**
     * Gets the queue root directory.
     *
     * @return Path.
     */
    public Path getQueueDir() {
        return Paths.get(getStringProperty("queueDir", "/var/spool/mailroom/queue"));
    }

    /**
     * Gets the hold ledger directory.
     *
     * @return Path.
     */
    public Path getLedgerDir() {
        return Paths.get(getStringProperty("ledgerDir", "/var/spool/mailroom/held"));
    }

    /**
     * Gets the archive directory.
     *
     * @return Path.
     */
    public Path getArchiveDir() {
        return Paths.get(getStringProperty("archiveDir", "/var/spool/mailroom/archives"));
    }

    /**
     * Gets the digest collection directory.
     *
     * @return Path.
     */
    public Path getDigestDir() {
        return Paths.get(getStringProperty("digestDir", "/var/spool/mailroom/digests"));
    }

    /**
     * Gets the outbound spool directory picked up by the MTA.
     *
     * @return Path.
     */
    public Path getSpoolDir() {
        return Paths.get(getStringProperty("spoolDir", "/var/spool/mailroom/outbound"));
    }

    /**
     * Gets the list configuration feed directory.
     * <p>Defaults to {@code lists} next to the configuration file.
     *
     * @return Path.
     */
    public Path getListsDir() {
        String fallback = configDir != null ? configDir + File.separator + "lists" : "lists";
        return Paths.get(getStringProperty("listsDir", fallback));
    }

    /**
     * Gets the age after which a staged entry is considered abandoned and recovered.
     *
     * @return Seconds.
     */
    public long getGraceSeconds() {
        return getLongProperty("graceSeconds", 900L);
    }

    /**
     * Gets the idle poll interval.
     *
     * @return Milliseconds.
     */
    public long getPollIntervalMillis() {
        return getLongProperty("pollIntervalMillis", 1000L);
    }

    /**
     * Gets the handler deadline.
     *
     * @return Seconds.
     */
    public long getHandlerTimeoutSeconds() {
        return getLongProperty("handlerTimeoutSeconds", 60L);
    }

    /**
     * Gets the maximum number of entries claimed per polling pass.
     *
     * @return Integer, 0 for no limit.
     */
    public int getBatchSize() {
        return Math.toIntExact(getLongProperty("batchSize", 0L));
    }

    /**
     * Gets the shard strategy.
     *
     * @return ShardStrategy.
     */
    public ShardStrategy getShardStrategy() {
        return ShardStrategy.fromString(getStringProperty("shardStrategy", "modulo"));
    }

    /**
     * Gets retry configuration.
     *
     * @return RetryConfig instance.
     */
    public RetryConfig getRetry() {
        return new RetryConfig(getMapProperty("retry"));
    }

    /**
     * Gets runner configurations.
     *
     * @return List of RunnerConfig.
     */
    public List<RunnerConfig> getRunners() {
        List<RunnerConfig> runners = new ArrayList<>();
        for (Object object : getListProperty("runners")) {
            if (object instanceof Map) {
                runners.add(new RunnerConfig((Map<String, Object>) object));
            }
        }
        return runners;
    }

    /**
     * Gets named rule chain definitions.
     *
     * @return Map of chain name to raw link list.
     */
    public Map<String, Object> getChains() {
        loadExternalIfAbsent("chains", Map.class);
        return getMapProperty("chains");
    }

    /**
     * Gets named pipeline definitions.
     *
     * @return Map of pipeline name to raw handler name list.
     */
    public Map<String, Object> getPipelines() {
        loadExternalIfAbsent("pipelines", Map.class);
        return getMapProperty("pipelines");
    }

    /**
     * Gets metrics configuration.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getMetrics() {
        loadExternalIfAbsent("metrics", Map.class);
        return new BasicConfig(getMapProperty("metrics"));
    }

    /**
     * Helper to lazily load an external JSON5 file into the root config map under the given key
     * if the key is absent and a config directory is available.
     *
     * @param key   Root key to populate in the map.
     * @param clazz Class to parse the JSON into (e.g., Map.class, List.class).
     */
    private void loadExternalIfAbsent(String key, Class<?> clazz) {
        if (!map.containsKey(key) && configDir != null && CONFIG_FILENAMES.containsKey(key)) {
            Path path = Paths.get(configDir, CONFIG_FILENAMES.get(key));
            if (Files.isRegularFile(path)) {
                try {
                    map.put(key, readFile(path, clazz));
                } catch (IOException e) {
                    log.error("Failed to load {} from {}: {}", key, path, e.getMessage());
                }
            }
        }
    }
}
