package com.ivamare.cqrs.mediator.impl;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandHandler;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.exception.HandlerExecutionException;
import com.ivamare.cqrs.exception.HandlerNotFoundException;
import com.ivamare.cqrs.exception.MediatorConfigurationException;
import com.ivamare.cqrs.handler.CommandHandlerRegistry;
import com.ivamare.cqrs.handler.QueryHandlerRegistry;
import com.ivamare.cqrs.mediator.Mediator;
import com.ivamare.cqrs.pipeline.CommandInterceptor;
import com.ivamare.cqrs.pipeline.CommandInvocation;
import com.ivamare.cqrs.pipeline.InterceptorRole;
import com.ivamare.cqrs.pipeline.QueryInterceptor;
import com.ivamare.cqrs.pipeline.QueryInvocation;
import com.ivamare.cqrs.query.Query;
import com.ivamare.cqrs.query.QueryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of Mediator.
 *
 * <p>Handler registrations and interceptor lists are copied at construction; later
 * changes to the registries do not affect this instance. Both chains are composed once:
 * the innermost step looks up the handler by the request's exact class, and each
 * interceptor, taken from last to first, wraps the step built so far.
 */
public class DefaultMediator implements Mediator {

    private static final Logger log = LoggerFactory.getLogger(DefaultMediator.class);

    private final Map<Class<?>, CommandHandler<?, ?>> commandHandlers;
    private final Map<Class<?>, QueryHandler<?, ?>> queryHandlers;
    private final List<CommandInterceptor> commandInterceptors;
    private final List<QueryInterceptor> queryInterceptors;
    private final CommandInvocation<Object> commandChain;
    private final QueryInvocation<Object> queryChain;

    /**
     * Creates a new DefaultMediator.
     *
     * @param commandHandlerRegistry command handlers by exact command class
     * @param commandInterceptors command interceptors, outermost first
     * @param queryHandlerRegistry query handlers by exact query class
     * @param queryInterceptors query interceptors, outermost first
     * @throws MediatorConfigurationException if more than one outbox interceptor is present,
     *     or the outbox interceptor precedes the transaction interceptor
     */
    public DefaultMediator(
            CommandHandlerRegistry commandHandlerRegistry,
            List<? extends CommandInterceptor> commandInterceptors,
            QueryHandlerRegistry queryHandlerRegistry,
            List<? extends QueryInterceptor> queryInterceptors) {

        Objects.requireNonNull(commandHandlerRegistry, "commandHandlerRegistry");
        Objects.requireNonNull(queryHandlerRegistry, "queryHandlerRegistry");
        this.commandInterceptors = List.copyOf(Objects.requireNonNull(commandInterceptors, "commandInterceptors"));
        this.queryInterceptors = List.copyOf(Objects.requireNonNull(queryInterceptors, "queryInterceptors"));

        validateCommandInterceptorOrdering(this.commandInterceptors);

        this.commandHandlers = commandHandlerRegistry.snapshot();
        this.queryHandlers = queryHandlerRegistry.snapshot();
        this.commandChain = buildCommandChain();
        this.queryChain = buildQueryChain();

        log.debug("Mediator built: {} command handlers, {} query handlers, command pipeline={}, query pipeline={}",
            commandHandlers.size(), queryHandlers.size(),
            describe(this.commandInterceptors), describe(this.queryInterceptors));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> CommandResult<R> send(Command<R> command) {
        Objects.requireNonNull(command, "command");
        return (CommandResult<R>) (CommandResult<?>) commandChain.proceed((Command<Object>) command);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R ask(Query<R> query) {
        Objects.requireNonNull(query, "query");
        return (R) queryChain.proceed((Query<Object>) query);
    }

    private CommandInvocation<Object> buildCommandChain() {
        CommandInvocation<Object> chain = this::invokeCommandHandler;
        for (int i = commandInterceptors.size() - 1; i >= 0; i--) {
            CommandInterceptor interceptor = commandInterceptors.get(i);
            CommandInvocation<Object> next = chain;
            chain = command -> interceptor.intercept(command, next);
        }
        return chain;
    }

    private QueryInvocation<Object> buildQueryChain() {
        QueryInvocation<Object> chain = this::invokeQueryHandler;
        for (int i = queryInterceptors.size() - 1; i >= 0; i--) {
            QueryInterceptor interceptor = queryInterceptors.get(i);
            QueryInvocation<Object> next = chain;
            chain = query -> interceptor.intercept(query, next);
        }
        return chain;
    }

    @SuppressWarnings("unchecked")
    private CommandResult<Object> invokeCommandHandler(Command<Object> command) {
        Class<?> type = command.getClass();
        CommandHandler<Command<Object>, Object> handler = (CommandHandler<Command<Object>, Object>)
            Optional.ofNullable(commandHandlers.get(type))
                .orElseThrow(() -> new HandlerNotFoundException("command", type, commandHandlers.keySet()));

        log.trace("Dispatching command {}", type.getSimpleName());
        CommandResult<Object> result;
        try {
            result = handler.handle(command);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException(type, e);
        }
        return Objects.requireNonNull(result, () -> "Handler for " + type.getName() + " returned null");
    }

    @SuppressWarnings("unchecked")
    private Object invokeQueryHandler(Query<Object> query) {
        Class<?> type = query.getClass();
        QueryHandler<Query<Object>, Object> handler = (QueryHandler<Query<Object>, Object>)
            Optional.ofNullable(queryHandlers.get(type))
                .orElseThrow(() -> new HandlerNotFoundException("query", type, queryHandlers.keySet()));

        log.trace("Dispatching query {}", type.getSimpleName());
        try {
            return handler.handle(query);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException(type, e);
        }
    }

    /**
     * Enforces that the outbox interceptor appears at most once and, when a transaction
     * interceptor is present too, that the transaction interceptor comes first.
     */
    static void validateCommandInterceptorOrdering(List<CommandInterceptor> interceptors) {
        int outboxCount = 0;
        int firstOutbox = -1;
        int firstTransaction = -1;

        for (int i = 0; i < interceptors.size(); i++) {
            CommandInterceptor interceptor = Objects.requireNonNull(
                interceptors.get(i), "command interceptor at index " + i);
            InterceptorRole role = interceptor.role();
            if (role == InterceptorRole.OUTBOX) {
                outboxCount++;
                if (firstOutbox < 0) {
                    firstOutbox = i;
                }
            } else if (role == InterceptorRole.TRANSACTION && firstTransaction < 0) {
                firstTransaction = i;
            }
        }

        if (outboxCount > 1) {
            throw new MediatorConfigurationException("Outbox interceptor is registered " + outboxCount
                + " times. It must appear at most once.");
        }
        if (firstTransaction >= 0 && firstOutbox >= 0 && firstTransaction > firstOutbox) {
            throw new MediatorConfigurationException("Transaction interceptor (index " + firstTransaction
                + ") must be placed before the outbox interceptor (index " + firstOutbox
                + ") so that outbox writes join the business transaction.");
        }
    }

    private static String describe(List<?> interceptors) {
        return interceptors.stream().map(i -> i.getClass().getSimpleName()).toList().toString();
    }
}
