package com.ivamare.cqrs.query;

/**
 * Answers one exact query type.
 *
 * @param <Q> query type
 * @param <R> answer type
 */
@FunctionalInterface
public interface QueryHandler<Q extends Query<R>, R> {

    R handle(Q query) throws Exception;
}
