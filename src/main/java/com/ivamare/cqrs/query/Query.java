package com.ivamare.cqrs.query;

/**
 * Marker for a read-only request.
 *
 * @param <R> type of the answer
 */
public interface Query<R> {
}
