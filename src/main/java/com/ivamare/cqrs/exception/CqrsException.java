package com.ivamare.cqrs.exception;

/**
 * Base exception for all mediator, outbox and dispatch errors.
 */
public class CqrsException extends RuntimeException {

    public CqrsException(String message) {
        super(message);
    }

    public CqrsException(String message, Throwable cause) {
        super(message, cause);
    }
}
