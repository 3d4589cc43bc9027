package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;

/**
 * Continuation of a command pipeline: the next interceptor, or the handler itself.
 *
 * @param <R> success value type
 */
@FunctionalInterface
public interface CommandInvocation<R> {

    CommandResult<R> proceed(Command<R> command);
}
