package com.ivamare.cqrs.mediator;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.query.Query;

/**
 * Routes commands and queries to their handlers through the configured interceptor
 * pipelines.
 *
 * <p>Example:
 * <pre>
 * Mediator mediator = Mediator.builder()
 *     .commandHandler(OpenAccount.class, new OpenAccountHandler(account))
 *     .queryHandler(GetBalance.class, new GetBalanceHandler(readModel))
 *     .commandInterceptor(new TransactionInterceptor(txManager))
 *     .commandInterceptor(new OutboxInterceptor(outbox))
 *     .build();
 *
 * CommandResult&lt;Void&gt; opened = mediator.send(new OpenAccount(id, 100));
 * long balance = mediator.ask(new GetBalance(id));
 * </pre>
 *
 * <p>Implementations are immutable after construction and safe for concurrent use.
 */
public interface Mediator {

    /**
     * Send a command through the command pipeline.
     *
     * @param command the command
     * @return outcome and events of the command
     * @throws com.ivamare.cqrs.exception.HandlerNotFoundException if no handler is
     *     registered for the command's exact class
     */
    <R> CommandResult<R> send(Command<R> command);

    /**
     * Send a query through the query pipeline.
     *
     * @param query the query
     * @return the answer
     * @throws com.ivamare.cqrs.exception.HandlerNotFoundException if no handler is
     *     registered for the query's exact class
     */
    <R> R ask(Query<R> query);

    static MediatorBuilder builder() {
        return new MediatorBuilder();
    }
}
