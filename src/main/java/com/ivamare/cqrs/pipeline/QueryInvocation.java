package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.query.Query;

/**
 * Continuation of a query pipeline.
 *
 * @param <R> answer type
 */
@FunctionalInterface
public interface QueryInvocation<R> {

    R proceed(Query<R> query);
}
