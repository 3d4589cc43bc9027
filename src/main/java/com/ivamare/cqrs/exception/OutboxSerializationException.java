package com.ivamare.cqrs.exception;

/**
 * Thrown when an event cannot be written to or read from the outbox payload format.
 */
public class OutboxSerializationException extends CqrsException {

    public OutboxSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
