package com.ivamare.cqrs.exception;

/**
 * Wraps a checked exception thrown by a command or query handler.
 *
 * <p>Unchecked exceptions thrown by handlers propagate unchanged.
 */
public class HandlerExecutionException extends CqrsException {

    private final Class<?> requestType;

    public HandlerExecutionException(Class<?> requestType, Throwable cause) {
        super("Handler for " + requestType.getName() + " failed: " + cause.getMessage(), cause);
        this.requestType = requestType;
    }

    public Class<?> getRequestType() {
        return requestType;
    }
}
