package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs request type, duration and outcome at DEBUG, and failures at WARN.
 */
public class LoggingInterceptor implements CommandInterceptor, QueryInterceptor {

    private static final Logger log = LoggerFactory.getLogger(LoggingInterceptor.class);

    @Override
    public <R> CommandResult<R> intercept(Command<R> command, CommandInvocation<R> next) {
        String type = command.getClass().getSimpleName();
        long start = System.nanoTime();
        try {
            CommandResult<R> result = next.proceed(command);
            log.debug("Command {} finished in {}ms: {} ({} events)",
                type, elapsedMs(start), result.outcome(), result.events().size());
            return result;
        } catch (RuntimeException e) {
            log.warn("Command {} failed after {}ms: {}", type, elapsedMs(start), e.getMessage());
            throw e;
        }
    }

    @Override
    public <R> R intercept(Query<R> query, QueryInvocation<R> next) {
        String type = query.getClass().getSimpleName();
        long start = System.nanoTime();
        try {
            R answer = next.proceed(query);
            log.debug("Query {} answered in {}ms", type, elapsedMs(start));
            return answer;
        } catch (RuntimeException e) {
            log.warn("Query {} failed after {}ms: {}", type, elapsedMs(start), e.getMessage());
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
