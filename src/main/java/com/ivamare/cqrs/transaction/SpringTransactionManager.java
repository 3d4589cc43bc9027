package com.ivamare.cqrs.transaction;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Adapts a Spring {@link PlatformTransactionManager} with a {@link TransactionTemplate}.
 *
 * <p>A business error in the command's outcome still commits, so events describing
 * rejected operations reach the outbox.
 */
public class SpringTransactionManager implements TransactionManager {

    private final TransactionTemplate transactionTemplate;

    public SpringTransactionManager(PlatformTransactionManager platformTransactionManager) {
        this(new TransactionTemplate(Objects.requireNonNull(platformTransactionManager, "platformTransactionManager")));
    }

    public SpringTransactionManager(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    }

    @Override
    public <T> T withinTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
