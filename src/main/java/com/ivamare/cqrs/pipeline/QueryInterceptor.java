package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.query.Query;

/**
 * Pipeline stage wrapping query handling.
 */
public interface QueryInterceptor {

    <R> R intercept(Query<R> query, QueryInvocation<R> next);
}
