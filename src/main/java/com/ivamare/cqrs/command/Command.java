package com.ivamare.cqrs.command;

/**
 * Marker for a request that changes state.
 *
 * <p>Commands are immutable values, usually records. They are dispatched by their exact
 * runtime class.
 *
 * @param <R> type of the value returned on success ({@link Void} when there is none)
 */
public interface Command<R> {
}
