package com.mimecast.mailroom.config;

import com.mimecast.mailroom.queue.ShardStrategy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static EngineConfig config;

    @BeforeAll
    static void before() throws IOException {
        config = new EngineConfig("src/test/resources/cfg/mailroom.json5");
    }

    @Test
    void paths() {
        assertEquals("lists.example.com", config.getHostname());
        assertEquals(Paths.get("/tmp/mailroom/queue"), config.getQueueDir());
        assertEquals(Paths.get("/tmp/mailroom/held"), config.getLedgerDir());
        assertEquals(Paths.get("/tmp/mailroom/archives"), config.getArchiveDir());
        assertEquals(Paths.get("/tmp/mailroom/digests"), config.getDigestDir());
        assertEquals(Paths.get("/tmp/mailroom/outbound"), config.getSpoolDir());
        assertEquals(Paths.get(config.getConfigDir(), "lists"), config.getListsDir());
    }

    @Test
    void timings() {
        assertEquals(600L, config.getGraceSeconds());
        assertEquals(250L, config.getPollIntervalMillis());
        assertEquals(30L, config.getHandlerTimeoutSeconds());
        assertEquals(50, config.getBatchSize());
        assertEquals(ShardStrategy.RANGE, config.getShardStrategy());
    }

    @Test
    void retry() {
        RetryConfig retry = config.getRetry();
        assertEquals(3, retry.getMaxRetries());
        assertEquals(30L, retry.getBaseDelaySeconds());
        assertEquals(2.0D, retry.getMultiplier());
        assertEquals(600L, retry.getMaxDelaySeconds());
        assertEquals(0.0D, retry.getJitter());
    }

    @Test
    void runners() {
        List<RunnerConfig> runners = config.getRunners();
        assertEquals(7, runners.size());

        assertEquals("in", runners.get(1).getQueue());
        assertEquals(1, runners.get(1).getShard());
        assertEquals(2, runners.get(1).getShards());

        RunnerConfig out = runners.get(2);
        assertEquals("out", out.getQueue());
        assertEquals(0, out.getShard());
        assertEquals(1, out.getShards());
        assertEquals(10, out.getBatchSize(config.getBatchSize()));
        assertEquals(250L, out.getPollIntervalMillis(config.getPollIntervalMillis()));
    }

    @Test
    void externalDefinitions() {
        Map<String, Object> chains = config.getChains();
        assertTrue(chains.containsKey("strict-chain"));
        assertTrue(chains.containsKey("broken-chain"));
        assertEquals(7, ((List<?>) chains.get("strict-chain")).size());

        Map<String, Object> pipelines = config.getPipelines();
        assertEquals(List.of("moderation", "calculate-recipients", "subject-prefix", "cook-headers", "rfc-2369", "to-outgoing"),
                pipelines.get("announce-pipeline"));
    }

    @Test
    void missingExternalFileIsEmpty() {
        assertTrue(config.getMetrics().getMap().isEmpty());
        assertEquals(0L, config.getMetrics().getLongProperty("port", 0L));
    }

    @Test
    void defaults() {
        EngineConfig empty = new EngineConfig(new HashMap<>());

        assertNull(empty.getConfigDir());
        assertEquals(Paths.get("lists"), empty.getListsDir());
        assertEquals(900L, empty.getGraceSeconds());
        assertEquals(60L, empty.getHandlerTimeoutSeconds());
        assertEquals(0, empty.getBatchSize());
        assertEquals(ShardStrategy.MODULO, empty.getShardStrategy());
        assertTrue(empty.getRunners().isEmpty());
        assertTrue(empty.getChains().isEmpty());
        assertTrue(empty.getPipelines().isEmpty());
    }
}
