package com.ivamare.cqrs.mediator;

import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.exception.HandlerAlreadyRegisteredException;
import com.ivamare.cqrs.exception.MediatorConfigurationException;
import com.ivamare.cqrs.fixture.AccountId;
import com.ivamare.cqrs.fixture.GetAccountBalance;
import com.ivamare.cqrs.fixture.OpenAccount;
import com.ivamare.cqrs.handler.impl.DefaultCommandHandlerRegistry;
import com.ivamare.cqrs.outbox.impl.InMemoryMessageOutboxRepository;
import com.ivamare.cqrs.pipeline.OutboxInterceptor;
import com.ivamare.cqrs.pipeline.TransactionInterceptor;
import com.ivamare.cqrs.transaction.NoopTransactionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediatorBuilder")
class MediatorBuilderTest {

    @Test
    @DisplayName("should build a mediator routing commands and queries")
    void shouldBuildMediator() {
        Mediator mediator = Mediator.builder()
            .commandHandler(OpenAccount.class, cmd -> CommandResult.success(null))
            .queryHandler(GetAccountBalance.class, q -> 7L)
            .build();

        assertTrue(mediator.send(new OpenAccount(new AccountId("a"), 1)).isSuccess());
        assertEquals(7L, mediator.ask(new GetAccountBalance(new AccountId("a"))));
    }

    @Test
    @DisplayName("should validate interceptor ordering on build")
    void shouldValidateOrderingOnBuild() {
        InMemoryMessageOutboxRepository outbox = new InMemoryMessageOutboxRepository();
        MediatorBuilder builder = Mediator.builder()
            .commandInterceptor(new OutboxInterceptor(outbox))
            .commandInterceptor(new TransactionInterceptor(NoopTransactionManager.INSTANCE));

        assertThrows(MediatorConfigurationException.class, builder::build);
    }

    @Test
    @DisplayName("should reject duplicate handlers in fail-fast mode")
    void shouldRejectDuplicatesInFailFastMode() {
        MediatorBuilder builder = Mediator.builder()
            .failOnDuplicateHandler(true)
            .commandHandler(OpenAccount.class, cmd -> CommandResult.success(null));

        assertThrows(HandlerAlreadyRegisteredException.class, () ->
            builder.commandHandler(OpenAccount.class, cmd -> CommandResult.success(null)));
    }

    @Test
    @DisplayName("should not allow fail-fast switch after handlers were added")
    void shouldNotAllowLateFailFastSwitch() {
        MediatorBuilder builder = Mediator.builder()
            .commandHandler(OpenAccount.class, cmd -> CommandResult.success(null));

        assertThrows(IllegalStateException.class, () -> builder.failOnDuplicateHandler(true));
    }

    @Test
    @DisplayName("should add handlers into a supplied registry")
    void shouldUseSuppliedRegistry() {
        DefaultCommandHandlerRegistry registry = new DefaultCommandHandlerRegistry();

        Mediator.builder()
            .commandHandlerRegistry(registry)
            .commandHandler(OpenAccount.class, cmd -> CommandResult.success(null))
            .build();

        assertTrue(registry.hasHandler(OpenAccount.class));
    }
}
