package com.ivamare.cqrs.outbox;

import java.util.Objects;

/**
 * Identity of an outbox message, assigned by the store at save time.
 *
 * @param value store-specific id
 */
public record MessageId(String value) {

    public MessageId {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
