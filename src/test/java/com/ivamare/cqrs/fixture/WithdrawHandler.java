package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.command.CommandHandler;
import com.ivamare.cqrs.command.CommandResult;

public class WithdrawHandler implements CommandHandler<WithdrawMoney, Long> {

    private final Account account;

    public WithdrawHandler(Account account) {
        this.account = account;
    }

    @Override
    public CommandResult<Long> handle(WithdrawMoney command) {
        return CommandResult.of(account.withdraw(command.amount()), account.pullEvents());
    }
}
