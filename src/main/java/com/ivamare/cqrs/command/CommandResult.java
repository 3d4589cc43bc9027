package com.ivamare.cqrs.command;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a command plus the events recorded while handling it.
 *
 * <p>The event order is the order in which the handler recorded them and is kept
 * through every interceptor and through outbox persistence.
 *
 * @param outcome success value or business error
 * @param events events in record order
 * @param <R> success value type
 */
public record CommandResult<R>(
    Outcome<R> outcome,
    List<DomainEvent> events
) {
    public CommandResult {
        Objects.requireNonNull(outcome, "outcome");
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static <R> CommandResult<R> success(R value, List<DomainEvent> events) {
        return new CommandResult<>(Outcome.success(value), events);
    }

    public static <R> CommandResult<R> success(R value) {
        return new CommandResult<>(Outcome.success(value), List.of());
    }

    public static <R> CommandResult<R> failure(CommandError error, List<DomainEvent> events) {
        return new CommandResult<>(Outcome.failure(error), events);
    }

    public static <R> CommandResult<R> failure(CommandError error) {
        return new CommandResult<>(Outcome.failure(error), List.of());
    }

    public static <R> CommandResult<R> of(Outcome<R> outcome, List<DomainEvent> events) {
        return new CommandResult<>(outcome, events);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * Returns a copy with {@code extra} appended after the existing events.
     *
     * @param extra events to append
     * @return new result with the same outcome
     */
    public CommandResult<R> withEvents(List<? extends DomainEvent> extra) {
        List<DomainEvent> combined = new ArrayList<>(events);
        combined.addAll(extra);
        return new CommandResult<>(outcome, combined);
    }
}
