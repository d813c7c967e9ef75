package com.mimecast.mailroom.pipeline;

/**
 * Handler failure.
 * <p>Thrown as is for unexpected failures, which send the entry to the shunt queue.
 *
 * @see TransientHandlerException
 * @see PermanentHandlerException
 */
public class HandlerException extends Exception {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
