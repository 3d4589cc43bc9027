package com.ivamare.cqrs.command;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success value or business error of a command.
 *
 * @param <R> success value type
 */
public final class Outcome<R> {

    private final R value;
    private final CommandError error;

    private Outcome(R value, CommandError error) {
        this.value = value;
        this.error = error;
    }

    public static <R> Outcome<R> success(R value) {
        return new Outcome<>(value, null);
    }

    public static <R> Outcome<R> failure(CommandError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the success value (may be null for {@code Void} commands)
     * @throws IllegalStateException if this outcome is a failure
     */
    public R value() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error.message());
        }
        return value;
    }

    /**
     * @return the business error
     * @throws IllegalStateException if this outcome is a success
     */
    public CommandError error() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    public <T> Outcome<T> map(Function<? super R, ? extends T> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <T> T fold(Function<? super R, ? extends T> onSuccess, Function<? super CommandError, ? extends T> onFailure) {
        return error == null ? onSuccess.apply(value) : onFailure.apply(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Outcome<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
