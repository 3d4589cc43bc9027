package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.command.Command;

public record OpenAccount(AccountId id, long initial) implements Command<Void> {
}
