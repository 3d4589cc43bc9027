package com.ivamare.cqrs.pipeline;

/**
 * Role of a command interceptor, used to validate pipeline ordering when the mediator
 * is built.
 */
public enum InterceptorRole {
    /** No ordering constraints. */
    GENERAL,
    /** Opens the transaction boundary. Must wrap the outbox interceptor. */
    TRANSACTION,
    /** Persists result events to the outbox. At most one per pipeline. */
    OUTBOX
}
