package com.ivamare.cqrs.pipeline;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.transaction.TransactionManager;

import java.util.Objects;

/**
 * Runs the rest of the pipeline inside one transaction.
 */
public class TransactionInterceptor implements CommandInterceptor {

    private final TransactionManager transactionManager;

    public TransactionInterceptor(TransactionManager transactionManager) {
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    }

    @Override
    public <R> CommandResult<R> intercept(Command<R> command, CommandInvocation<R> next) {
        return transactionManager.withinTransaction(() -> next.proceed(command));
    }

    @Override
    public InterceptorRole role() {
        return InterceptorRole.TRANSACTION;
    }
}
