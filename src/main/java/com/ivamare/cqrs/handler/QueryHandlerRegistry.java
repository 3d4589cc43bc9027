package com.ivamare.cqrs.handler;

import com.ivamare.cqrs.query.Query;
import com.ivamare.cqrs.query.QueryHandler;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping an exact query class to its single handler.
 */
public interface QueryHandlerRegistry {

    <Q extends Query<R>, R> void register(Class<Q> queryType, QueryHandler<Q, R> handler);

    /**
     * Register a handler whose query type is resolved from its generic signature.
     *
     * @param handler handler implementing {@code QueryHandler<Q, R>} with concrete {@code Q}
     * @return the query class it was registered under
     * @throws IllegalArgumentException if the query type cannot be resolved
     */
    Class<?> registerBean(QueryHandler<?, ?> handler);

    Optional<QueryHandler<?, ?>> find(Class<?> queryType);

    boolean hasHandler(Class<?> queryType);

    Set<Class<?>> registeredTypes();

    Map<Class<?>, QueryHandler<?, ?>> snapshot();

    void clear();
}
