package com.ivamare.cqrs.exception;

/**
 * Thrown when registering a second handler for a request type while the registry
 * rejects duplicates.
 */
public class HandlerAlreadyRegisteredException extends CqrsException {

    private final Class<?> requestType;

    public HandlerAlreadyRegisteredException(Class<?> requestType) {
        super("Handler already registered for " + requestType.getName());
        this.requestType = requestType;
    }

    public Class<?> getRequestType() {
        return requestType;
    }
}
