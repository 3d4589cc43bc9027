package com.ivamare.cqrs.handler;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandHandler;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping an exact command class to its single handler.
 *
 * <p>Lookups never consider supertypes or interfaces of the command class.
 */
public interface CommandHandlerRegistry {

    /**
     * Register a handler for a command type.
     *
     * @param commandType exact command class
     * @param handler the handler
     * @throws com.ivamare.cqrs.exception.HandlerAlreadyRegisteredException if duplicates are
     *     rejected and a handler already exists
     */
    <C extends Command<R>, R> void register(Class<C> commandType, CommandHandler<C, R> handler);

    /**
     * Register a handler whose command type is resolved from its generic signature.
     *
     * @param handler handler implementing {@code CommandHandler<C, R>} with concrete {@code C}
     * @return the command class it was registered under
     * @throws IllegalArgumentException if the command type cannot be resolved (e.g. lambdas)
     */
    Class<?> registerBean(CommandHandler<?, ?> handler);

    /**
     * @param commandType exact command class
     * @return the handler, or empty if none is registered
     */
    Optional<CommandHandler<?, ?>> find(Class<?> commandType);

    boolean hasHandler(Class<?> commandType);

    Set<Class<?>> registeredTypes();

    /**
     * @return immutable copy of the current registrations
     */
    Map<Class<?>, CommandHandler<?, ?>> snapshot();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();
}
