package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.domain.event.BaseDomainEvent;

public final class AccountOpened extends BaseDomainEvent {

    private final long initialBalance;

    public AccountOpened(String accountId, long initialBalance) {
        super(accountId, Account.AGGREGATE_TYPE);
        this.initialBalance = initialBalance;
    }

    public long getInitialBalance() {
        return initialBalance;
    }
}
