package com.mimecast.mailroom.rules;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.metrics.QueueMetrics;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.moderation.HoldId;
import com.mimecast.mailroom.moderation.HoldLedger;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;

/**
 * Rule chain evaluator.
 *
 * <p>Walks the chain in declared order and applies the action of the first hitting link
 * that is not {@link ChainAction#DEFER}. Rules named in the {@code bypassRules} metadata entry are
 * skipped. A rule throwing is treated as a hold with reason {@code internal error}.
 * <p>Rule hits and misses of the last evaluation are kept in metadata; they are reset at the start
 * of every evaluation so evaluating again on redelivery gives the same outcome.
 * <p>When a ledger is configured, a hold verdict also creates the hold record and stores its id
 * in metadata.
 */
public class ChainEvaluator {
    private static final Logger log = LogManager.getLogger(ChainEvaluator.class);

    public static final String INTERNAL_ERROR = "internal error";

    private final HoldLedger ledger;
    private final Clock clock;

    /**
     * Constructs a new ChainEvaluator without side effects beyond metadata annotations.
     *
     * @param clock Clock for the decision log.
     */
    public ChainEvaluator(Clock clock) {
        this(null, clock);
    }

    /**
     * Constructs a new ChainEvaluator.
     *
     * @param ledger Hold ledger, may be null.
     * @param clock  Clock for the decision log.
     */
    public ChainEvaluator(HoldLedger ledger, Clock clock) {
        this.ledger = ledger;
        this.clock = clock;
    }

    /**
     * Evaluates a chain.
     *
     * @param chain    Chain.
     * @param message  Message, never modified.
     * @param metadata Metadata, receives annotations and the verdict.
     * @param list     Target list.
     * @return Verdict.
     * @throws StorageException Unable to record the hold.
     */
    public Verdict evaluate(Chain chain, MailMessage message, Metadata metadata, MailingList list) throws StorageException {
        metadata.remove(Metadata.RULE_HITS);
        metadata.remove(Metadata.RULE_MISSES);
        metadata.remove(Metadata.MODERATION_ACTION);
        metadata.remove(Metadata.MODERATION_REASON);

        List<String> bypass = metadata.getStringList(Metadata.BYPASS_RULES);
        Verdict verdict = null;

        for (ChainLink link : chain.getLinks()) {
            Rule rule = link.getRule();
            if (bypass.contains(rule.getName())) {
                log.debug("Bypassing rule {} for {}", rule.getName(), message.getMessageId());
                continue;
            }

            boolean hit;
            try {
                hit = rule.check(message, metadata, list);
            } catch (RuntimeException e) {
                log.error("Rule {} failed on {} for list {}: {}", rule.getName(), message.getMessageId(), list.getName(), e.toString());
                metadata.addToList(Metadata.RULE_HITS, rule.getName());
                verdict = Verdict.hold(INTERNAL_ERROR, rule.getName());
                break;
            }

            if (!hit) {
                metadata.addToList(Metadata.RULE_MISSES, rule.getName());
                continue;
            }
            metadata.addToList(Metadata.RULE_HITS, rule.getName());
            log.debug("Rule hit: chain={}, rule={}, action={}", chain.getName(), rule.getName(), link.getAction());

            verdict = apply(link.getAction(), rule.getName(), metadata);
            if (verdict != null) {
                break;
            }
        }

        if (verdict == null) {
            verdict = Verdict.accept();
        }

        metadata.put(Metadata.VERDICT, verdict.toMap());
        metadata.recordDecision("chain:" + chain.getName(), verdict.getType().name().toLowerCase(),
                verdict.getRule() != null ? verdict.getRule() + (verdict.getReason() != null ? ": " + verdict.getReason() : "") : null,
                clock.instant());

        if (verdict.getType() == Verdict.Type.HOLD && ledger != null) {
            HoldId id = ledger.record(list.getName(), message, metadata, verdict.getReason(), verdict.getRule());
            metadata.put(Metadata.HOLD_ID, id.toString());
        }

        count(verdict);
        log.info("Chain {} verdict for {} on {}: {}", chain.getName(), message.getMessageId(), list.getName(), verdict);
        return verdict;
    }

    /**
     * Maps a link action to a verdict.
     *
     * @return Verdict or null to keep evaluating.
     */
    private Verdict apply(ChainAction action, String rule, Metadata metadata) {
        if (action == ChainAction.MODERATION) {
            action = moderationAction(metadata);
        }
        String reason = metadata.getString(Metadata.MODERATION_REASON);
        if (reason == null) {
            reason = metadata.getAnnotation(rule);
        }
        switch (action) {
            case HOLD:
                return Verdict.hold(reason != null ? reason : "Held by rule " + rule, rule);
            case DISCARD:
                return Verdict.discard(rule);
            case REJECT:
                return Verdict.reject(reason != null ? reason : "Rejected by rule " + rule, rule);
            case ACCEPT:
                return Verdict.accept(rule);
            default:
                return null;
        }
    }

    private static ChainAction moderationAction(Metadata metadata) {
        String value = metadata.getString(Metadata.MODERATION_ACTION);
        if (value != null) {
            try {
                ChainAction action = ChainAction.fromString(value);
                if (action != ChainAction.MODERATION && action != ChainAction.DEFER) {
                    return action;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Invalid moderation action {}, holding", value);
            }
        }
        return ChainAction.HOLD;
    }

    private static void count(Verdict verdict) {
        switch (verdict.getType()) {
            case HOLD:
                QueueMetrics.incrementHeld();
                break;
            case DISCARD:
                QueueMetrics.incrementDiscarded();
                break;
            case REJECT:
                QueueMetrics.incrementRejected();
                break;
            default:
                QueueMetrics.incrementAccepted();
        }
    }
}
