package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.event.EventDispatcher;

import java.util.Objects;

/**
 * Projects the result's events synchronously after the handler returns.
 *
 * <p>A failing projection handler propagates to the caller of {@code send}.
 */
public class EventDispatchingInterceptor implements CommandInterceptor {

    private final EventDispatcher dispatcher;

    public EventDispatchingInterceptor(EventDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public <R> CommandResult<R> intercept(Command<R> command, CommandInvocation<R> next) {
        CommandResult<R> result = next.proceed(command);
        for (DomainEvent event : result.events()) {
            dispatcher.dispatch(event);
        }
        return result;
    }
}
