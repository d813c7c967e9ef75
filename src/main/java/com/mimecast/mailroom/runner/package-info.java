/**
 * Queue runners.
 *
 * <p>One runner serves one queue shard. The {@link com.mimecast.mailroom.runner.IncomingRunner} evaluates
 * the list's rule chain before its pipeline; {@link com.mimecast.mailroom.runner.PipelineRunner} serves
 * every other processed queue.
 * <br>Transient failures are retried per {@link com.mimecast.mailroom.runner.RetryPolicy} and shunted once exhausted.
 */
package com.mimecast.mailroom.runner;
