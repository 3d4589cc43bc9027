package com.ivamare.cqrs.command;

/**
 * A business error returned in the failure branch of an {@link Outcome}.
 *
 * <p>Business errors are expected results and are never thrown.
 */
public interface CommandError {

    /**
     * @return human readable description of the error
     */
    String message();
}
