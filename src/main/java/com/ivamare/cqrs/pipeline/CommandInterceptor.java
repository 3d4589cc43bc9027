package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;

/**
 * Pipeline stage wrapping command handling.
 *
 * <p>An interceptor may call {@code next} once (the usual case), not at all to
 * short-circuit with its own result, and may transform the result it gets back. The
 * first interceptor configured on the mediator is the outermost one.
 *
 * <p>Work placed after {@code next.proceed(...)} is skipped when the continuation
 * throws, so it should be idempotent or guarded.
 */
public interface CommandInterceptor {

    <R> CommandResult<R> intercept(Command<R> command, CommandInvocation<R> next);

    default InterceptorRole role() {
        return InterceptorRole.GENERAL;
    }
}
