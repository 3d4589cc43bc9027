package com.ivamare.cqrs.domain;

import java.util.Objects;

/**
 * Domain object with identity. Two entities of the same class are equal when their ids are.
 *
 * @param <ID> identifier type
 */
public abstract class Entity<ID> {

    public abstract ID getId();

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return Objects.equals(getId(), ((Entity<?>) other).getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(id=" + getId() + ")";
    }
}
