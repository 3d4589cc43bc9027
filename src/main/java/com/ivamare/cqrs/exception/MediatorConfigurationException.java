package com.ivamare.cqrs.exception;

/**
 * Thrown while building a mediator whose interceptor pipeline is invalid.
 *
 * <p>A mediator that fails with this exception is never handed out, so no request
 * can run through a misordered pipeline.
 */
public class MediatorConfigurationException extends CqrsException {

    public MediatorConfigurationException(String message) {
        super(message);
    }
}
