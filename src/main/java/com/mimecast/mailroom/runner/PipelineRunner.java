package com.mimecast.mailroom.runner;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.pipeline.HandlerException;
import com.mimecast.mailroom.pipeline.Pipeline;
import com.mimecast.mailroom.pipeline.PipelineOutcome;
import com.mimecast.mailroom.queue.QueueEntry;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.queue.StorageException;

/**
 * Runner for queues served by a single pipeline named after the queue.
 * <p>Used for out, archive, digest, bounces and virgin.
 */
public class PipelineRunner extends Runner {

    /**
     * Constructs a new PipelineRunner.
     *
     * @param context            Engine context.
     * @param queue              Queue name, also the pipeline name.
     * @param shard              Shard assignment.
     * @param pollIntervalMillis Idle sleep between polls.
     * @param batchSize          Maximum entries per pass, 0 for no limit.
     */
    public PipelineRunner(EngineContext context, String queue, ShardAssignment shard, long pollIntervalMillis, int batchSize) {
        super(context, queue, shard, pollIntervalMillis, batchSize);
    }

    @Override
    protected String validate(MailingList list) {
        return context.getPipelines().containsKey(queue) ? null : "no pipeline for queue " + queue;
    }

    @Override
    protected PipelineOutcome processEntry(QueueEntry entry, MailingList list) throws HandlerException, StorageException {
        Pipeline pipeline = context.getPipelines().get(queue);
        return executor.run(pipeline, entry.getMessage(), entry.getMetadata(), list, () -> store.checkpoint(entry));
    }
}
