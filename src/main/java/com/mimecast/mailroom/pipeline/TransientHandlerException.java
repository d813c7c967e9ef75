package com.mimecast.mailroom.pipeline;

/**
 * Failure expected to clear up by itself.
 * <p>The entry is retried with backoff until the retry limit is reached.
 */
public class TransientHandlerException extends HandlerException {

    public TransientHandlerException(String message) {
        super(message);
    }

    public TransientHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
