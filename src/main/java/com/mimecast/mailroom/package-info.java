/**
 * The main package for Mailroom, a mailing list message transport engine.
 *
 * <p>Postings enter the {@code in} queue, are judged by the list's rule chain and, once accepted,
 * <br>flow through handler pipelines into the outgoing, archive and digest queues.
 * <br>Held postings wait in the moderation ledger until a moderator resolves them.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar mailroom.jar --start
 *      $ java -jar mailroom.jar --runner out --shard 0 --shards 2
 *      $ java -jar mailroom.jar --inject posting.eml --list ant@example.com
 *      $ java -jar mailroom.jar --held ant@example.com
 *      $ java -jar mailroom.jar --resolve ant@example.com/0123456789abcdef --disposition approve
 *      $ java -jar mailroom.jar --unshunt
 * </pre>
 *
 * <p>Configuration is read from {@code cfg/mailroom.json5} unless {@code --config} names another directory.
 */
package com.mimecast.mailroom;
