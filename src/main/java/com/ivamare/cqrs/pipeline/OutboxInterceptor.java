package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.outbox.MessageOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Saves every event of the handler's result to the outbox, in result order.
 *
 * <p>Placed inside a {@link TransactionInterceptor}, the events are written in the same
 * transaction as the business change.
 */
public class OutboxInterceptor implements CommandInterceptor {

    private static final Logger log = LoggerFactory.getLogger(OutboxInterceptor.class);

    private final MessageOutboxRepository outboxRepository;

    public OutboxInterceptor(MessageOutboxRepository outboxRepository) {
        this.outboxRepository = Objects.requireNonNull(outboxRepository, "outboxRepository");
    }

    @Override
    public <R> CommandResult<R> intercept(Command<R> command, CommandInvocation<R> next) {
        CommandResult<R> result = next.proceed(command);
        for (DomainEvent event : result.events()) {
            outboxRepository.save(event);
        }
        if (!result.events().isEmpty()) {
            log.debug("Saved {} events to outbox for {}", result.events().size(), command.getClass().getSimpleName());
        }
        return result;
    }

    @Override
    public InterceptorRole role() {
        return InterceptorRole.OUTBOX;
    }
}
