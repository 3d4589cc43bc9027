package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.domain.event.BaseDomainEvent;

public final class MoneyWithdrawn extends BaseDomainEvent {

    private final long amount;
    private final long newBalance;

    public MoneyWithdrawn(String accountId, long amount, long newBalance) {
        super(accountId, Account.AGGREGATE_TYPE);
        this.amount = amount;
        this.newBalance = newBalance;
    }

    public long getAmount() {
        return amount;
    }

    public long getNewBalance() {
        return newBalance;
    }
}
