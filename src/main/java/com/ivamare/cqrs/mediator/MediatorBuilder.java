package com.ivamare.cqrs.mediator;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandHandler;
import com.ivamare.cqrs.handler.CommandHandlerRegistry;
import com.ivamare.cqrs.handler.QueryHandlerRegistry;
import com.ivamare.cqrs.handler.impl.DefaultCommandHandlerRegistry;
import com.ivamare.cqrs.handler.impl.DefaultQueryHandlerRegistry;
import com.ivamare.cqrs.mediator.impl.DefaultMediator;
import com.ivamare.cqrs.pipeline.CommandInterceptor;
import com.ivamare.cqrs.pipeline.QueryInterceptor;
import com.ivamare.cqrs.query.Query;
import com.ivamare.cqrs.query.QueryHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for {@link Mediator}.
 */
public class MediatorBuilder {

    private CommandHandlerRegistry commandHandlers;
    private QueryHandlerRegistry queryHandlers;
    private boolean failOnDuplicateHandler = false;
    private final List<CommandInterceptor> commandInterceptors = new ArrayList<>();
    private final List<QueryInterceptor> queryInterceptors = new ArrayList<>();

    MediatorBuilder() {
    }

    /**
     * Reject a second handler for the same request type instead of replacing the first.
     * Must be set before any handler is added.
     */
    public MediatorBuilder failOnDuplicateHandler(boolean failOnDuplicateHandler) {
        if (commandHandlers != null || queryHandlers != null) {
            throw new IllegalStateException("failOnDuplicateHandler must be set before handlers are added");
        }
        this.failOnDuplicateHandler = failOnDuplicateHandler;
        return this;
    }

    /**
     * Use an existing command registry. Handlers added later go into it.
     */
    public MediatorBuilder commandHandlerRegistry(CommandHandlerRegistry registry) {
        this.commandHandlers = registry;
        return this;
    }

    public MediatorBuilder queryHandlerRegistry(QueryHandlerRegistry registry) {
        this.queryHandlers = registry;
        return this;
    }

    public <C extends Command<R>, R> MediatorBuilder commandHandler(Class<C> commandType, CommandHandler<C, R> handler) {
        commandRegistry().register(commandType, handler);
        return this;
    }

    public <Q extends Query<R>, R> MediatorBuilder queryHandler(Class<Q> queryType, QueryHandler<Q, R> handler) {
        queryRegistry().register(queryType, handler);
        return this;
    }

    /**
     * Append a command interceptor. The first one appended is the outermost.
     */
    public MediatorBuilder commandInterceptor(CommandInterceptor interceptor) {
        commandInterceptors.add(interceptor);
        return this;
    }

    public MediatorBuilder commandInterceptors(List<? extends CommandInterceptor> interceptors) {
        commandInterceptors.addAll(interceptors);
        return this;
    }

    public MediatorBuilder queryInterceptor(QueryInterceptor interceptor) {
        queryInterceptors.add(interceptor);
        return this;
    }

    public MediatorBuilder queryInterceptors(List<? extends QueryInterceptor> interceptors) {
        queryInterceptors.addAll(interceptors);
        return this;
    }

    /**
     * Build the mediator.
     *
     * @return a new mediator
     * @throws com.ivamare.cqrs.exception.MediatorConfigurationException if the command
     *     interceptor ordering is invalid
     */
    public Mediator build() {
        return new DefaultMediator(commandRegistry(), commandInterceptors, queryRegistry(), queryInterceptors);
    }

    private CommandHandlerRegistry commandRegistry() {
        if (commandHandlers == null) {
            commandHandlers = new DefaultCommandHandlerRegistry(failOnDuplicateHandler);
        }
        return commandHandlers;
    }

    private QueryHandlerRegistry queryRegistry() {
        if (queryHandlers == null) {
            queryHandlers = new DefaultQueryHandlerRegistry(failOnDuplicateHandler);
        }
        return queryHandlers;
    }
}
