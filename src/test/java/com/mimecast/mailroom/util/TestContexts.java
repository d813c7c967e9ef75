package com.mimecast.mailroom.util;

import com.mimecast.mailroom.config.EngineConfig;
import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.queue.FileQueueStore;
import com.mimecast.mailroom.runner.ExponentialBackoffRetryPolicy;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine context fixtures rooted in a temporary directory.
 */
public final class TestContexts {

    private TestContexts() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets an engine configuration with every directory under root.
     *
     * @param root Root directory.
     * @return EngineConfig instance.
     */
    public static EngineConfig config(Path root) {
        Map<String, Object> map = new HashMap<>();
        map.put("hostname", "lists.example.com");
        map.put("queueDir", root.resolve("queue").toString());
        map.put("ledgerDir", root.resolve("held").toString());
        map.put("archiveDir", root.resolve("archives").toString());
        map.put("digestDir", root.resolve("digests").toString());
        map.put("spoolDir", root.resolve("outbound").toString());
        map.put("listsDir", root.resolve("lists").toString());
        map.put("graceSeconds", 600L);
        map.put("handlerTimeoutSeconds", 5L);
        return new EngineConfig(map);
    }

    /**
     * Gets a context builder with a store on the given clock, no retry jitter and fixed lists.
     * <p>Retries: 3 attempts, 1s base delay doubling.
     *
     * @param root  Root directory.
     * @param clock Clock.
     * @param lists Lists served.
     * @return EngineContext.Builder instance.
     */
    public static EngineContext.Builder builder(Path root, Clock clock, MailingList... lists) {
        ListRegistry registry = new ListRegistry(List.of(lists));
        return EngineContext.builder(config(root))
                .clock(clock)
                .store(new FileQueueStore(root.resolve("queue"), "test", clock))
                .retryPolicy(new ExponentialBackoffRetryPolicy(3, 1000L, 2.0D, 60000L, 0.0D, () -> 0.5D))
                .listLoader(() -> registry);
    }
}
