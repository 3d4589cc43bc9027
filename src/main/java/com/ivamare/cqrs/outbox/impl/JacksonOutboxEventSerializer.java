package com.ivamare.cqrs.outbox.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.exception.OutboxSerializationException;
import com.ivamare.cqrs.outbox.OutboxEventSerializer;

/**
 * JSON payloads via Jackson, with the event's class name as the type discriminator.
 *
 * <p>Event classes must be readable by Jackson (a {@code @JsonCreator} constructor, or
 * parameter names compiled in). Unknown properties are ignored on read so that base
 * metadata not taken by a constructor does not fail deserialization.
 */
public class JacksonOutboxEventSerializer implements OutboxEventSerializer {

    private final ObjectMapper objectMapper;
    private final ClassLoader classLoader;

    public JacksonOutboxEventSerializer(ObjectMapper objectMapper) {
        this(objectMapper, JacksonOutboxEventSerializer.class.getClassLoader());
    }

    public JacksonOutboxEventSerializer(ObjectMapper objectMapper, ClassLoader classLoader) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.classLoader = classLoader;
    }

    @Override
    public String eventType(DomainEvent event) {
        return event.getClass().getName();
    }

    @Override
    public String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new OutboxSerializationException(
                "Failed to serialize " + event.getClass().getName() + " " + event.getEventId(), e);
        }
    }

    @Override
    public DomainEvent deserialize(String eventType, String payload) {
        Class<? extends DomainEvent> type = resolve(eventType);
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new OutboxSerializationException("Failed to deserialize " + eventType, e);
        }
    }

    private Class<? extends DomainEvent> resolve(String eventType) {
        Class<?> type;
        try {
            type = Class.forName(eventType, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new OutboxSerializationException("Unknown event type " + eventType, e);
        }
        if (!DomainEvent.class.isAssignableFrom(type)) {
            throw new OutboxSerializationException(
                eventType + " is not a DomainEvent", new ClassCastException(eventType));
        }
        return type.asSubclass(DomainEvent.class);
    }
}
