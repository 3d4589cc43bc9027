package com.ivamare.cqrs.domain;

/**
 * Marker for immutable values compared by content. Records are the usual implementation.
 */
public interface ValueObject {
}
