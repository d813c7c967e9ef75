package com.mimecast.mailroom.pipeline;

import com.mimecast.mailroom.archive.Archiver;
import com.mimecast.mailroom.delivery.DeliveryAgent;
import com.mimecast.mailroom.digest.DigestBuilder;
import com.mimecast.mailroom.notice.NoticeGenerator;
import com.mimecast.mailroom.pipeline.handlers.*;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named handlers.
 *
 * <p>Built once at startup with the collaborators the handlers need; there is no runtime discovery.
 */
public class HandlerRegistry {
    private static final Logger log = LogManager.getLogger(HandlerRegistry.class);

    public static final String DEFAULT_POSTING_PIPELINE = "default-posting-pipeline";
    public static final String DEFAULT_OWNER_PIPELINE = "default-owner-pipeline";

    /**
     * Built in pipeline definitions, used when not configured.
     * <p>Queue named pipelines are run by the runner of that queue.
     */
    private static final Map<String, List<String>> DEFAULT_PIPELINES = new LinkedHashMap<>();

    static {
        DEFAULT_PIPELINES.put(DEFAULT_POSTING_PIPELINE, List.of(
                "moderation", "calculate-recipients", "subject-prefix", "cook-headers",
                "rfc-2369", "to-archive", "to-digest", "to-outgoing"));
        DEFAULT_PIPELINES.put(DEFAULT_OWNER_PIPELINE, List.of("calculate-recipients", "to-outgoing"));
        DEFAULT_PIPELINES.put(QueueNames.OUT, List.of("deliver"));
        DEFAULT_PIPELINES.put(QueueNames.ARCHIVE, List.of("archive"));
        DEFAULT_PIPELINES.put(QueueNames.DIGEST, List.of("digest"));
        DEFAULT_PIPELINES.put(QueueNames.BOUNCES, List.of("notice"));
        DEFAULT_PIPELINES.put(QueueNames.VIRGIN, List.of("to-outgoing"));
    }

    private final Map<String, Handler> handlers = new LinkedHashMap<>();

    /**
     * Builds a registry holding every builtin handler.
     *
     * @param store     Queue store for handlers queueing copies.
     * @param agent     Delivery agent.
     * @param archiver  Archiver.
     * @param digests   Digest builder.
     * @param generator Notice generator.
     * @return HandlerRegistry instance.
     */
    public static HandlerRegistry withBuiltins(QueueStore store, DeliveryAgent agent, Archiver archiver,
                                               DigestBuilder digests, NoticeGenerator generator) {
        return new HandlerRegistry()
                .register(new ModerationHandler())
                .register(new CalculateRecipientsHandler())
                .register(new SubjectPrefixHandler())
                .register(new CookHeadersHandler())
                .register(new Rfc2369Handler())
                .register(new ToArchiveHandler(store))
                .register(new ToDigestHandler(store))
                .register(new ToOutgoingHandler())
                .register(new DeliverHandler(agent))
                .register(new ArchiveHandler(archiver))
                .register(new DigestHandler(digests, store))
                .register(new NoticeHandler(generator, store));
    }

    /**
     * Registers a handler, replacing any handler of the same name.
     *
     * @param handler Handler instance.
     * @return Self.
     */
    public HandlerRegistry register(Handler handler) {
        handlers.put(handler.getName(), handler);
        return this;
    }

    public Optional<Handler> get(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public Map<String, Handler> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Builds all configured pipelines plus any built in pipeline not configured.
     *
     * @param config Map of pipeline name to handler name list.
     * @return Map of pipeline name to Pipeline.
     */
    public Map<String, Pipeline> buildPipelines(Map<String, Object> config) {
        Map<String, Pipeline> pipelines = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            try {
                pipelines.put(entry.getKey(), buildPipeline(entry.getKey(), entry.getValue()));
            } catch (ConfigurationException e) {
                log.error("Invalid pipeline definition skipped, lists using it are disabled: {}", e.getExplanation());
            }
        }
        for (Map.Entry<String, List<String>> entry : DEFAULT_PIPELINES.entrySet()) {
            if (!pipelines.containsKey(entry.getKey())) {
                try {
                    pipelines.put(entry.getKey(), buildPipeline(entry.getKey(), entry.getValue()));
                } catch (ConfigurationException e) {
                    log.error("Built in pipeline {} unavailable: {}", entry.getKey(), e.getExplanation());
                }
            }
        }
        return pipelines;
    }

    /**
     * Builds one pipeline.
     *
     * @param name       Pipeline name.
     * @param definition List of handler names.
     * @return Pipeline.
     * @throws ConfigurationException Unknown handler or malformed definition.
     */
    public Pipeline buildPipeline(String name, Object definition) throws ConfigurationException {
        if (!(definition instanceof List)) {
            throw new ConfigurationException("Pipeline " + name + " must be a list of handler names");
        }
        List<Handler> list = new ArrayList<>();
        for (Object raw : (List<?>) definition) {
            Handler handler = raw != null ? handlers.get(String.valueOf(raw)) : null;
            if (handler == null) {
                throw new ConfigurationException("Pipeline " + name + " references unknown handler: " + raw);
            }
            list.add(handler);
        }
        return new Pipeline(name, list);
    }
}
