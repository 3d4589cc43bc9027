package com.ivamare.cqrs.transaction;

import java.util.function.Supplier;

/**
 * Runs work inside a transaction boundary.
 *
 * <p>Unchecked exceptions thrown by the work roll the transaction back and propagate.
 */
public interface TransactionManager {

    <T> T withinTransaction(Supplier<T> work);
}
