package com.ivamare.cqrs;

import com.ivamare.cqrs.command.CommandResult;
import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.event.DispatchingDomainEventPublisher;
import com.ivamare.cqrs.event.EventDispatcher;
import com.ivamare.cqrs.event.impl.DefaultEventDispatcher;
import com.ivamare.cqrs.fixture.Account;
import com.ivamare.cqrs.fixture.AccountBalanceProjection;
import com.ivamare.cqrs.fixture.AccountId;
import com.ivamare.cqrs.fixture.AccountOpened;
import com.ivamare.cqrs.fixture.DepositHandler;
import com.ivamare.cqrs.fixture.DepositMoney;
import com.ivamare.cqrs.fixture.GetAccountBalance;
import com.ivamare.cqrs.fixture.GetAccountBalanceHandler;
import com.ivamare.cqrs.fixture.MoneyDeposited;
import com.ivamare.cqrs.fixture.MoneyWithdrawn;
import com.ivamare.cqrs.fixture.OpenAccount;
import com.ivamare.cqrs.fixture.OpenAccountHandler;
import com.ivamare.cqrs.fixture.OverdraftRejected;
import com.ivamare.cqrs.fixture.ValidationError;
import com.ivamare.cqrs.fixture.WithdrawHandler;
import com.ivamare.cqrs.fixture.WithdrawMoney;
import com.ivamare.cqrs.mediator.Mediator;
import com.ivamare.cqrs.outbox.OutboxMessage;
import com.ivamare.cqrs.outbox.OutboxPublisher;
import com.ivamare.cqrs.outbox.PublishReport;
import com.ivamare.cqrs.outbox.impl.InMemoryMessageOutboxRepository;
import com.ivamare.cqrs.pipeline.OutboxInterceptor;
import com.ivamare.cqrs.pipeline.TransactionInterceptor;
import com.ivamare.cqrs.transaction.NoopTransactionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Bank account end-to-end")
class BankAccountScenarioTest {

    private static final AccountId ACCOUNT = new AccountId("acc-1");

    private Account account;
    private InMemoryMessageOutboxRepository outbox;
    private AccountBalanceProjection projection;
    private EventDispatcher dispatcher;
    private Mediator mediator;

    @BeforeEach
    void setUp() {
        account = new Account(ACCOUNT);
        outbox = new InMemoryMessageOutboxRepository();
        projection = new AccountBalanceProjection();
        dispatcher = new DefaultEventDispatcher();
        projection.subscribeTo(dispatcher);

        mediator = Mediator.builder()
            .commandHandler(OpenAccount.class, new OpenAccountHandler(account))
            .commandHandler(DepositMoney.class, new DepositHandler(account))
            .commandHandler(WithdrawMoney.class, new WithdrawHandler(account))
            .queryHandler(GetAccountBalance.class, new GetAccountBalanceHandler(projection))
            .commandInterceptor(new TransactionInterceptor(NoopTransactionManager.INSTANCE))
            .commandInterceptor(new OutboxInterceptor(outbox))
            .build();
    }

    @Test
    @DisplayName("should record events, fill the outbox, publish and project the final balance")
    void shouldRunFullScenario() {
        CommandResult<Void> opened = mediator.send(new OpenAccount(ACCOUNT, 100));
        assertThat(opened.isSuccess()).isTrue();
        assertThat(opened.events()).singleElement().isInstanceOfSatisfying(AccountOpened.class,
            e -> assertThat(e.getInitialBalance()).isEqualTo(100));
        assertThat(account.getBalance()).isEqualTo(100);

        CommandResult<Long> deposited = mediator.send(new DepositMoney(ACCOUNT, 50));
        assertThat(deposited.outcome().value()).isEqualTo(150L);
        assertThat(deposited.events()).singleElement().isInstanceOfSatisfying(MoneyDeposited.class, e -> {
            assertThat(e.getAmount()).isEqualTo(50);
            assertThat(e.getNewBalance()).isEqualTo(150);
        });

        CommandResult<Long> withdrawn = mediator.send(new WithdrawMoney(ACCOUNT, 70));
        assertThat(withdrawn.outcome().value()).isEqualTo(80L);
        assertThat(withdrawn.events()).singleElement().isInstanceOfSatisfying(MoneyWithdrawn.class, e -> {
            assertThat(e.getAmount()).isEqualTo(70);
            assertThat(e.getNewBalance()).isEqualTo(80);
        });

        CommandResult<Long> rejected = mediator.send(new WithdrawMoney(ACCOUNT, 1000));
        assertThat(rejected.isSuccess()).isFalse();
        assertThat(rejected.outcome().error()).isEqualTo(new ValidationError("insufficient funds"));
        assertThat(rejected.events()).singleElement().isInstanceOfSatisfying(OverdraftRejected.class, e -> {
            assertThat(e.getAttempted()).isEqualTo(1000);
            assertThat(e.getBalance()).isEqualTo(80);
        });
        assertThat(account.getBalance()).isEqualTo(80);

        List<OutboxMessage> pending = outbox.findUnpublished();
        assertThat(pending).hasSize(4);
        assertThat(pending).<Class<?>>extracting(m -> m.event().getClass()).containsExactly(
            AccountOpened.class, MoneyDeposited.class, MoneyWithdrawn.class, OverdraftRejected.class);

        OutboxPublisher publisher = new OutboxPublisher(outbox, new DispatchingDomainEventPublisher(dispatcher));
        PublishReport report = publisher.publishPendingEvents();

        assertThat(report).isEqualTo(new PublishReport(4, 4, 0));
        assertThat(outbox.findUnpublished()).isEmpty();
        assertThat(outbox.findAll()).allMatch(OutboxMessage::published);

        assertThat(mediator.ask(new GetAccountBalance(ACCOUNT))).isEqualTo(80L);
    }

    @Test
    @DisplayName("should persist rejected withdrawal event even though the outcome is an error")
    void shouldPersistEventsOfBusinessErrors() {
        mediator.send(new OpenAccount(ACCOUNT, 10));
        mediator.send(new WithdrawMoney(ACCOUNT, 20));

        List<DomainEvent> events = outbox.findAll().stream().map(OutboxMessage::event).toList();
        assertThat(events).hasSize(2);
        assertThat(events.get(1)).isInstanceOf(OverdraftRejected.class);
    }

    @Test
    @DisplayName("should answer zero for an account never projected")
    void shouldAnswerZeroBeforePublishing() {
        mediator.send(new OpenAccount(ACCOUNT, 100));

        assertThat(mediator.ask(new GetAccountBalance(ACCOUNT))).isZero();
    }
}
