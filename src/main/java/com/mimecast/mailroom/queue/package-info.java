/**
 * Durable file based message queues.
 *
 * <p>Every queue is a directory under the queue root. An entry is a single file holding the
 * message bytes and its metadata, written by {@link com.mimecast.mailroom.queue.QueueRecordCodec}.
 * <br>Entry names sort by due time, so a directory listing is also the processing order.
 *
 * <h2>Entry lifecycle:</h2>
 * <ol>
 *     <li><b>ready</b> - {@code <queue>/<when>+<list digest>+<random>.pck}</li>
 *     <li><b>staged</b> - claimed by a runner, {@code <queue>/.staged/<process tag>/<name>.bak}</li>
 *     <li><b>finished</b> - deleted, or requeued as a new ready entry elsewhere</li>
 * </ol>
 *
 * <p>Staged entries left behind by a dead process are made ready again by
 * {@link com.mimecast.mailroom.queue.FileQueueStore#recover} after a grace period.
 * <br>Entries that cannot be decoded are moved to the {@code bad} queue.
 *
 * @see com.mimecast.mailroom.queue.QueueStore
 * @see com.mimecast.mailroom.queue.ShardAssignment
 */
package com.mimecast.mailroom.queue;
