package com.mimecast.mailroom.runner;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.pipeline.HandlerException;
import com.mimecast.mailroom.pipeline.HandlerRegistry;
import com.mimecast.mailroom.pipeline.Pipeline;
import com.mimecast.mailroom.pipeline.PipelineOutcome;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueEntry;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.queue.StorageException;
import com.mimecast.mailroom.rules.Chain;
import com.mimecast.mailroom.rules.ChainEvaluator;
import com.mimecast.mailroom.rules.RuleRegistry;
import com.mimecast.mailroom.rules.Verdict;

/**
 * Runner for the incoming queue.
 *
 * <p>Evaluates the list's posting chain and acts on the verdict. Accepted messages run the list's
 * posting pipeline in place; messages addressed to the owner take the owner chain and pipeline.
 * <p>Once a message is accepted the chain is not evaluated again on redelivery, since the pipeline
 * may already have changed the message.
 */
public class IncomingRunner extends Runner {

    /**
     * Completion marker set once the chain accepted the message.
     */
    static final String CHAIN_MARKER = "chain";

    private final ChainEvaluator evaluator;

    /**
     * Constructs a new IncomingRunner.
     *
     * @param context            Engine context.
     * @param shard              Shard assignment.
     * @param pollIntervalMillis Idle sleep between polls.
     * @param batchSize          Maximum entries per pass, 0 for no limit.
     */
    public IncomingRunner(EngineContext context, ShardAssignment shard, long pollIntervalMillis, int batchSize) {
        super(context, QueueNames.IN, shard, pollIntervalMillis, batchSize);
        this.evaluator = new ChainEvaluator(context.getLedger(), context.getClock());
    }

    @Override
    protected String validate(MailingList list) {
        if (!context.getChains().containsKey(list.getPostingChain())) {
            return "unknown posting chain " + list.getPostingChain();
        }
        if (!context.getPipelines().containsKey(list.getPostingPipeline())) {
            return "unknown posting pipeline " + list.getPostingPipeline();
        }
        return null;
    }

    @Override
    protected PipelineOutcome processEntry(QueueEntry entry, MailingList list) throws HandlerException, StorageException {
        Metadata metadata = entry.getMetadata();
        boolean owner = metadata.getBoolean(Metadata.TO_OWNER);

        if (!metadata.isCompleted(CHAIN_MARKER)) {
            Chain chain = context.getChains().get(owner ? RuleRegistry.DEFAULT_OWNER_CHAIN_NAME : list.getPostingChain());
            Verdict verdict = evaluator.evaluate(chain, entry.getMessage(), metadata, list);

            switch (verdict.getType()) {
                case HOLD:
                    log.info("Held {} for {}: {}", entry.getMessage().getMessageId(), list.getName(), verdict.getReason());
                    return PipelineOutcome.terminal();
                case DISCARD:
                    log.info("Discarded {} for {} by rule {}", entry.getMessage().getMessageId(), list.getName(), verdict.getRule());
                    return PipelineOutcome.terminal();
                case REJECT:
                    context.getNotifier().notifyRejection(list, entry.getMessage(), metadata, verdict.getReason());
                    return PipelineOutcome.terminal();
                default:
                    metadata.markCompleted(CHAIN_MARKER);
                    store.checkpoint(entry);
            }
        }

        Pipeline pipeline = context.getPipelines().get(owner ? HandlerRegistry.DEFAULT_OWNER_PIPELINE : list.getPostingPipeline());
        return executor.run(pipeline, entry.getMessage(), metadata, list, () -> store.checkpoint(entry));
    }
}
