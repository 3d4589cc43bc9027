package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.command.Command;

public record DepositMoney(AccountId id, long amount) implements Command<Long> {
}
