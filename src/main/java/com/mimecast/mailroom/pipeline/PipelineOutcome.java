package com.mimecast.mailroom.pipeline;

/**
 * Outcome of a pipeline run: terminal or forward to another queue.
 */
public final class PipelineOutcome {

    private static final PipelineOutcome TERMINAL = new PipelineOutcome(null);

    private final String targetQueue;

    private PipelineOutcome(String targetQueue) {
        this.targetQueue = targetQueue;
    }

    public static PipelineOutcome terminal() {
        return TERMINAL;
    }

    public static PipelineOutcome forward(String targetQueue) {
        return new PipelineOutcome(targetQueue);
    }

    public boolean isTerminal() {
        return targetQueue == null;
    }

    /**
     * Gets the target queue.
     *
     * @return Queue name or null when terminal.
     */
    public String getTargetQueue() {
        return targetQueue;
    }

    @Override
    public String toString() {
        return isTerminal() ? "terminal" : "forward:" + targetQueue;
    }
}
