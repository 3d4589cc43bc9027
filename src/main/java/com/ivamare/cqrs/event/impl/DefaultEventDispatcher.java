package com.ivamare.cqrs.event.impl;

import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.event.DomainEventHandler;
import com.ivamare.cqrs.event.EventDispatcher;
import com.ivamare.cqrs.exception.EventDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.GenericTypeResolver;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default implementation of EventDispatcher.
 *
 * <p>Handler lists are copy-on-write, so dispatch can run concurrently with registration.
 */
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventDispatcher.class);

    private final Map<Class<?>, List<DomainEventHandler<?>>> handlers = new ConcurrentHashMap<>();

    @Override
    public <E extends DomainEvent> void register(Class<E> eventType, DomainEventHandler<? super E> handler) {
        add(eventType, handler);
    }

    @Override
    public Class<?> registerBean(DomainEventHandler<?> handler) {
        Class<?> eventType = GenericTypeResolver.resolveTypeArgument(handler.getClass(), DomainEventHandler.class);
        if (eventType == null) {
            throw new IllegalArgumentException("Cannot resolve event type of "
                + handler.getClass().getName() + "; register it with an explicit event class");
        }
        add(eventType, handler);
        return eventType;
    }

    private void add(Class<?> eventType, DomainEventHandler<?> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Registered event handler for {}", eventType.getSimpleName());
    }

    @Override
    @SuppressWarnings("unchecked")
    public void dispatch(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        List<DomainEventHandler<?>> registered = handlers.get(event.getClass());
        if (registered == null || registered.isEmpty()) {
            log.trace("No handlers for {} (eventId={})", event.getClass().getSimpleName(), event.getEventId());
            return;
        }

        log.debug("Dispatching {} (eventId={}) to {} handlers",
            event.getClass().getSimpleName(), event.getEventId(), registered.size());

        for (DomainEventHandler<?> handler : registered) {
            try {
                ((DomainEventHandler<DomainEvent>) handler).handle(event);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new EventDispatchException(event.getEventId(), event.getClass(), e);
            }
        }
    }

    @Override
    public int handlerCount(Class<? extends DomainEvent> eventType) {
        List<DomainEventHandler<?>> registered = handlers.get(eventType);
        return registered != null ? registered.size() : 0;
    }

    @Override
    public Set<Class<?>> registeredEventTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
