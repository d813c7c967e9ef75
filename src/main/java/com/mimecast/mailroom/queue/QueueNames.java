package com.mimecast.mailroom.queue;

import java.util.List;

/**
 * Well known queue names.
 */
public final class QueueNames {

    /**
     * Inbound postings awaiting rule evaluation.
     */
    public static final String IN = "in";

    /**
     * Messages awaiting outbound delivery.
     */
    public static final String OUT = "out";

    /**
     * Messages awaiting archiving.
     */
    public static final String ARCHIVE = "archive";

    /**
     * Messages awaiting digest collection.
     */
    public static final String DIGEST = "digest";

    /**
     * Rejection and failure notices awaiting composition.
     */
    public static final String BOUNCES = "bounces";

    /**
     * System generated messages entering the outgoing path.
     */
    public static final String VIRGIN = "virgin";

    /**
     * Entries that exhausted their retries or failed permanently for operator inspection.
     */
    public static final String SHUNT = "shunt";

    /**
     * Quarantine for records that failed to decode.
     */
    public static final String BAD = "bad";

    /**
     * Queues drained by runners.
     */
    public static final List<String> PROCESSED = List.of(IN, OUT, ARCHIVE, DIGEST, BOUNCES, VIRGIN);

    private QueueNames() {
        throw new IllegalStateException("Static class");
    }
}
