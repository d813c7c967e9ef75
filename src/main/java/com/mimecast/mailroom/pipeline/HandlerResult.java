package com.mimecast.mailroom.pipeline;

/**
 * What a handler asks the pipeline to do next.
 */
public final class HandlerResult {

    /**
     * Result types.
     */
    public enum Type {
        CONTINUE, STOP, FORWARD
    }

    private static final HandlerResult CONTINUE = new HandlerResult(Type.CONTINUE, null);
    private static final HandlerResult STOP = new HandlerResult(Type.STOP, null);

    private final Type type;
    private final String queue;

    private HandlerResult(Type type, String queue) {
        this.type = type;
        this.queue = queue;
    }

    /**
     * Run the next handler.
     *
     * @return HandlerResult.
     */
    public static HandlerResult proceed() {
        return CONTINUE;
    }

    /**
     * Skip remaining handlers; processing is complete.
     *
     * @return HandlerResult.
     */
    public static HandlerResult stop() {
        return STOP;
    }

    /**
     * Skip remaining handlers and move the entry to another queue.
     *
     * @param queue Target queue.
     * @return HandlerResult.
     */
    public static HandlerResult forward(String queue) {
        return new HandlerResult(Type.FORWARD, queue);
    }

    public Type getType() {
        return type;
    }

    public String getQueue() {
        return queue;
    }

    @Override
    public String toString() {
        return type == Type.FORWARD ? "forward:" + queue : type.name().toLowerCase();
    }
}
