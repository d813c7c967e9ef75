package com.mimecast.mailroom.pipeline;

/**
 * Failure that retrying cannot fix.
 * <p>The entry is dropped and the sender notified.
 */
public class PermanentHandlerException extends HandlerException {

    public PermanentHandlerException(String message) {
        super(message);
    }

    public PermanentHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
