package com.ivamare.cqrs.handler.impl;

import com.ivamare.cqrs.exception.HandlerAlreadyRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.GenericTypeResolver;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact-type handler map shared by the command and query registries.
 *
 * <p>By default a second registration for the same type replaces the first and logs a
 * warning. With {@code failOnDuplicate} it throws {@link HandlerAlreadyRegisteredException}.
 *
 * @param <H> handler type
 */
public abstract class AbstractHandlerRegistry<H> {

    private static final Logger log = LoggerFactory.getLogger(AbstractHandlerRegistry.class);

    private final Map<Class<?>, H> handlers = new ConcurrentHashMap<>();
    private final boolean failOnDuplicate;
    private final String kind;

    protected AbstractHandlerRegistry(String kind, boolean failOnDuplicate) {
        this.kind = kind;
        this.failOnDuplicate = failOnDuplicate;
    }

    protected void put(Class<?> type, H handler) {
        Objects.requireNonNull(type, kind + "Type");
        Objects.requireNonNull(handler, "handler");
        if (failOnDuplicate) {
            if (handlers.putIfAbsent(type, handler) != null) {
                throw new HandlerAlreadyRegisteredException(type);
            }
        } else {
            H previous = handlers.put(type, handler);
            if (previous != null && previous != handler) {
                log.warn("Replaced {} handler for {}: {} -> {}",
                    kind, type.getName(), previous.getClass().getName(), handler.getClass().getName());
            }
        }
        log.debug("Registered {} handler for {}", kind, type.getSimpleName());
    }

    protected Class<?> resolveRequestType(Object handler, Class<?> handlerInterface) {
        Class<?>[] args = GenericTypeResolver.resolveTypeArguments(handler.getClass(), handlerInterface);
        if (args == null || args[0] == null) {
            throw new IllegalArgumentException("Cannot resolve " + kind + " type of "
                + handler.getClass().getName() + "; register it with an explicit " + kind + " class");
        }
        return args[0];
    }

    public Optional<H> find(Class<?> type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean hasHandler(Class<?> type) {
        return handlers.containsKey(type);
    }

    public Set<Class<?>> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public Map<Class<?>, H> snapshot() {
        return Map.copyOf(handlers);
    }

    public void clear() {
        handlers.clear();
    }
}
