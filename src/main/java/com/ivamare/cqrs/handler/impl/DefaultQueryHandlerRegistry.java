package com.ivamare.cqrs.handler.impl;

import com.ivamare.cqrs.handler.QueryHandlerRegistry;
import com.ivamare.cqrs.query.Query;
import com.ivamare.cqrs.query.QueryHandler;

/**
 * Default implementation of QueryHandlerRegistry.
 */
public class DefaultQueryHandlerRegistry extends AbstractHandlerRegistry<QueryHandler<?, ?>>
        implements QueryHandlerRegistry {

    public DefaultQueryHandlerRegistry() {
        this(false);
    }

    public DefaultQueryHandlerRegistry(boolean failOnDuplicate) {
        super("query", failOnDuplicate);
    }

    @Override
    public <Q extends Query<R>, R> void register(Class<Q> queryType, QueryHandler<Q, R> handler) {
        put(queryType, handler);
    }

    @Override
    public Class<?> registerBean(QueryHandler<?, ?> handler) {
        Class<?> queryType = resolveRequestType(handler, QueryHandler.class);
        put(queryType, handler);
        return queryType;
    }
}
