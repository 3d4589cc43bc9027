package com.ivamare.cqrs.transaction;

import java.util.function.Supplier;

/**
 * Runs work directly, without a transaction. Used when no transaction manager is available.
 */
public final class NoopTransactionManager implements TransactionManager {

    public static final NoopTransactionManager INSTANCE = new NoopTransactionManager();

    private NoopTransactionManager() {
    }

    @Override
    public <T> T withinTransaction(Supplier<T> work) {
        return work.get();
    }
}
