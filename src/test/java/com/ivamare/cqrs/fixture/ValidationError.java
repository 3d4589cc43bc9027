package com.ivamare.cqrs.fixture;

import com.ivamare.cqrs.command.CommandError;

public record ValidationError(String message) implements CommandError {
}
