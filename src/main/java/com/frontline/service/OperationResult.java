package com.frontline.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.Function;

/**
 * Outcome of a core operation: either a value or an {@link ErrorKind} with context.
 * Business rule violations are returned, never thrown.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OperationResult<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;
    /** Milliseconds until the cooldown elapses, for {@link ErrorKind#COOLDOWN}. */
    private final Long remainingMs;
    /** Amount the debit needed, for {@link ErrorKind#INSUFFICIENT_RESOURCES}. */
    private final Integer requiredAmount;
    private final Integer availableAmount;

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(value, null, null, null, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(null, kind, message, null, null, null);
    }

    public static <T> OperationResult<T> cooldown(String message, long remainingMs) {
        return new OperationResult<>(null, ErrorKind.COOLDOWN, message, remainingMs, null, null);
    }

    public static <T> OperationResult<T> insufficient(int required, int available) {
        return new OperationResult<>(null, ErrorKind.INSUFFICIENT_RESOURCES,
                "Not enough resources. Required: " + required, null, required, available);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * The value of a successful result.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + errorKind + " " + message);
        }
        return value;
    }

    /**
     * Re-type a failure so it can be propagated from a caller with a different value type.
     */
    public <R> OperationResult<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new OperationResult<>(null, errorKind, message, remainingMs, requiredAmount, availableAmount);
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? ok(mapper.apply(value)) : propagate();
    }

    @Override
    public String toString() {
        return isSuccess() ? "OperationResult[ok " + value + "]" : "OperationResult[" + errorKind + ": " + message + "]";
    }
}
