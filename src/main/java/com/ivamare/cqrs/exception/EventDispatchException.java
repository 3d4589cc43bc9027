package com.ivamare.cqrs.exception;

/**
 * Wraps a checked exception thrown by a projection handler during event dispatch.
 */
public class EventDispatchException extends CqrsException {

    private final String eventId;
    private final Class<?> eventType;

    public EventDispatchException(String eventId, Class<?> eventType, Throwable cause) {
        super("Handler for " + eventType.getSimpleName() + " failed on event " + eventId
            + ": " + cause.getMessage(), cause);
        this.eventId = eventId;
        this.eventType = eventType;
    }

    public String getEventId() {
        return eventId;
    }

    public Class<?> getEventType() {
        return eventType;
    }
}
