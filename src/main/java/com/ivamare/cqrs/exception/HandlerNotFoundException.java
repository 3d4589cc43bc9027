package com.ivamare.cqrs.exception;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no handler is registered for the exact runtime type of a request.
 */
public class HandlerNotFoundException extends CqrsException {

    private final Class<?> requestType;
    private final List<Class<?>> registeredTypes;

    public HandlerNotFoundException(String kind, Class<?> requestType, Collection<Class<?>> registeredTypes) {
        super(buildMessage(kind, requestType, registeredTypes));
        this.requestType = requestType;
        this.registeredTypes = List.copyOf(registeredTypes);
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public List<Class<?>> getRegisteredTypes() {
        return registeredTypes;
    }

    private static String buildMessage(String kind, Class<?> requestType, Collection<Class<?>> registeredTypes) {
        String known = registeredTypes.isEmpty()
            ? "<none>"
            : registeredTypes.stream().map(Class::getSimpleName).sorted().collect(Collectors.joining(", "));
        return "No handler registered for " + kind + " " + requestType.getName()
            + ". Registered " + kind + " types: " + known;
    }
}
