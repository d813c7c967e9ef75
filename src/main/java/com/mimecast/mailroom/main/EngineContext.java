package com.mimecast.mailroom.main;

import com.mimecast.mailroom.archive.Archiver;
import com.mimecast.mailroom.archive.MboxArchiver;
import com.mimecast.mailroom.config.EngineConfig;
import com.mimecast.mailroom.delivery.DeliveryAgent;
import com.mimecast.mailroom.delivery.SpoolDeliveryAgent;
import com.mimecast.mailroom.digest.DigestBuilder;
import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.moderation.FileHoldLedger;
import com.mimecast.mailroom.moderation.HoldLedger;
import com.mimecast.mailroom.notice.NoticeGenerator;
import com.mimecast.mailroom.notice.Notifier;
import com.mimecast.mailroom.notice.QueueNotifier;
import com.mimecast.mailroom.pipeline.HandlerRegistry;
import com.mimecast.mailroom.pipeline.Pipeline;
import com.mimecast.mailroom.queue.FileQueueStore;
import com.mimecast.mailroom.queue.QueueStore;
import com.mimecast.mailroom.rules.Chain;
import com.mimecast.mailroom.rules.RuleRegistry;
import com.mimecast.mailroom.runner.ExponentialBackoffRetryPolicy;
import com.mimecast.mailroom.runner.RetryPolicy;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Everything a runner needs, wired once per process.
 *
 * <p>Collaborators are passed explicitly instead of being looked up from static configuration,
 * so tests can build a context around temporary directories and mocks.
 *
 * @see Builder
 */
public class EngineContext {

    private final EngineConfig config;
    private final Clock clock;
    private final QueueStore store;
    private final HoldLedger ledger;
    private final Notifier notifier;
    private final RetryPolicy retryPolicy;
    private final Map<String, Chain> chains;
    private final Map<String, Pipeline> pipelines;
    private final Callable<ListRegistry> listLoader;

    private EngineContext(Builder builder, Map<String, Chain> chains, Map<String, Pipeline> pipelines) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.store = builder.store;
        this.ledger = builder.ledger;
        this.notifier = builder.notifier;
        this.retryPolicy = builder.retryPolicy;
        this.listLoader = builder.listLoader;
        this.chains = Collections.unmodifiableMap(chains);
        this.pipelines = Collections.unmodifiableMap(pipelines);
    }

    /**
     * Starts a builder.
     *
     * @param config Engine configuration.
     * @return Builder instance.
     */
    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public QueueStore getStore() {
        return store;
    }

    public HoldLedger getLedger() {
        return ledger;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Map<String, Chain> getChains() {
        return chains;
    }

    public Map<String, Pipeline> getPipelines() {
        return pipelines;
    }

    public Duration getGrace() {
        return Duration.ofSeconds(config.getGraceSeconds());
    }

    public Duration getHandlerTimeout() {
        return Duration.ofSeconds(config.getHandlerTimeoutSeconds());
    }

    /**
     * Loads the current list configurations.
     * <p>Called at runner start and on every reload request.
     *
     * @return ListRegistry instance.
     * @throws IOException Unable to read the list feed.
     */
    public ListRegistry loadLists() throws IOException {
        try {
            return listLoader.call();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Unable to load lists: " + e.getMessage(), e);
        }
    }

    /**
     * EngineContext builder.
     * <p>Anything not set explicitly is derived from the configuration.
     */
    public static class Builder {
        private final EngineConfig config;
        private Clock clock = Clock.systemUTC();
        private QueueStore store;
        private HoldLedger ledger;
        private Notifier notifier;
        private RetryPolicy retryPolicy;
        private DeliveryAgent deliveryAgent;
        private Archiver archiver;
        private DigestBuilder digestBuilder;
        private NoticeGenerator noticeGenerator;
        private RuleRegistry rules;
        private HandlerRegistry handlers;
        private Callable<ListRegistry> listLoader;

        private Builder(EngineConfig config) {
            this.config = config;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder store(QueueStore store) {
            this.store = store;
            return this;
        }

        public Builder ledger(HoldLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder deliveryAgent(DeliveryAgent deliveryAgent) {
            this.deliveryAgent = deliveryAgent;
            return this;
        }

        public Builder archiver(Archiver archiver) {
            this.archiver = archiver;
            return this;
        }

        public Builder digestBuilder(DigestBuilder digestBuilder) {
            this.digestBuilder = digestBuilder;
            return this;
        }

        public Builder rules(RuleRegistry rules) {
            this.rules = rules;
            return this;
        }

        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        /**
         * Sets the list loader.
         * <p>Defaults to reading the configured lists directory.
         *
         * @param listLoader ListRegistry callable.
         * @return Self.
         */
        public Builder listLoader(Callable<ListRegistry> listLoader) {
            this.listLoader = listLoader;
            return this;
        }

        /**
         * Wires the context and builds chains and pipelines.
         * <p>Invalid chain or pipeline definitions are logged and left out.
         *
         * @return EngineContext instance.
         */
        public EngineContext build() {
            if (store == null) {
                store = new FileQueueStore(config.getQueueDir());
            }
            if (ledger == null) {
                ledger = new FileHoldLedger(config.getLedgerDir(), clock);
            }
            if (notifier == null) {
                notifier = new QueueNotifier(store);
            }
            if (retryPolicy == null) {
                retryPolicy = new ExponentialBackoffRetryPolicy(config.getRetry());
            }
            if (deliveryAgent == null) {
                deliveryAgent = new SpoolDeliveryAgent(config.getSpoolDir());
            }
            if (archiver == null) {
                archiver = new MboxArchiver(config.getArchiveDir(), clock);
            }
            if (digestBuilder == null) {
                digestBuilder = new DigestBuilder(config.getDigestDir(), clock);
            }
            if (noticeGenerator == null) {
                noticeGenerator = new NoticeGenerator(config.getHostname(), clock);
            }
            if (rules == null) {
                rules = RuleRegistry.withBuiltins();
            }
            if (handlers == null) {
                handlers = HandlerRegistry.withBuiltins(store, deliveryAgent, archiver, digestBuilder, noticeGenerator);
            }
            if (listLoader == null) {
                listLoader = () -> ListRegistry.load(config.getListsDir());
            }

            return new EngineContext(this,
                    rules.buildChains(config.getChains()),
                    handlers.buildPipelines(config.getPipelines()));
        }
    }
}
