package com.ivamare.cqrs.event;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.Set;

/**
 * In-process fan-out of one event to the handlers registered for its exact type.
 */
public interface EventDispatcher {

    /**
     * Append a handler for an event type. Several handlers per type all fire, in
     * registration order.
     *
     * @param eventType exact event class
     * @param handler the handler
     */
    <E extends DomainEvent> void register(Class<E> eventType, DomainEventHandler<? super E> handler);

    /**
     * Register a handler whose event type is resolved from its generic signature.
     *
     * @param handler handler implementing {@code DomainEventHandler<E>} with concrete {@code E}
     * @return the event class it was registered under
     * @throws IllegalArgumentException if the event type cannot be resolved
     */
    Class<?> registerBean(DomainEventHandler<?> handler);

    /**
     * Invoke every handler registered for the event's exact runtime class, in order.
     *
     * <p>The first handler failure stops dispatch of this event; later handlers are not
     * called and the failure propagates. Unchecked exceptions propagate unchanged,
     * checked ones are wrapped in {@link com.ivamare.cqrs.exception.EventDispatchException}.
     *
     * @param event the event
     */
    void dispatch(DomainEvent event);

    int handlerCount(Class<? extends DomainEvent> eventType);

    Set<Class<?>> registeredEventTypes();
}
