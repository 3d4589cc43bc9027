package com.ivamare.cqrs.handler.impl;

import com.ivamare.cqrs.command.Command;
import com.ivamare.cqrs.command.CommandHandler;
import com.ivamare.cqrs.handler.CommandHandlerRegistry;

/**
 * Default implementation of CommandHandlerRegistry.
 */
public class DefaultCommandHandlerRegistry extends AbstractHandlerRegistry<CommandHandler<?, ?>>
        implements CommandHandlerRegistry {

    /**
     * Creates a registry where duplicate registrations overwrite.
     */
    public DefaultCommandHandlerRegistry() {
        this(false);
    }

    /**
     * @param failOnDuplicate reject a second handler for the same command type
     */
    public DefaultCommandHandlerRegistry(boolean failOnDuplicate) {
        super("command", failOnDuplicate);
    }

    @Override
    public <C extends Command<R>, R> void register(Class<C> commandType, CommandHandler<C, R> handler) {
        put(commandType, handler);
    }

    @Override
    public Class<?> registerBean(CommandHandler<?, ?> handler) {
        Class<?> commandType = resolveRequestType(handler, CommandHandler.class);
        put(commandType, handler);
        return commandType;
    }
}
