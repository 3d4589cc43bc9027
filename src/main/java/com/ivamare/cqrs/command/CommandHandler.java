package com.ivamare.cqrs.command;

/**
 * Handles one exact command type.
 *
 * <p>Handlers return events in the result instead of publishing them, so interceptors
 * can persist or dispatch them. Business failures go into the result's outcome.
 *
 * @param <C> command type
 * @param <R> success value type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> {

    /**
     * Process a command.
     *
     * @param command the command
     * @return outcome and recorded events
     * @throws Exception on unexpected failure
     */
    CommandResult<R> handle(C command) throws Exception;
}
