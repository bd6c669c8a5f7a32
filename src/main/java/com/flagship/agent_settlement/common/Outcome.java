package com.flagship.agent_settlement.common;

import java.util.Optional;

/**
 * Typed result of a settlement operation.
 *
 * Domain failures travel as values rather than exceptions so that a caller
 * polling for verification, or racing another executor, can tell a benign
 * race loss from a fatal rejection without catching anything. Unexpected
 * infrastructure faults still propagate as exceptions.
 *
 * @param <T> value carried on success, and optionally on failure (for
 *            example the compliance result of a rejected proposal)
 */
public final class Outcome<T> {

    private final OutcomeCode code;
    private final T value;
    private final String message;

    private Outcome(OutcomeCode code, T value, String message) {
        this.code = code;
        this.value = value;
        this.message = message;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(OutcomeCode.OK, value, null);
    }

    public static <T> Outcome<T> failure(OutcomeCode code, String message) {
        return failure(code, null, message);
    }

    public static <T> Outcome<T> failure(OutcomeCode code, T detail, String message) {
        if (code == OutcomeCode.OK) {
            throw new IllegalArgumentException("Failure outcome cannot use code OK");
        }
        return new Outcome<>(code, detail, message);
    }

    /**
     * Re-types a failure so it can be returned from an operation with a
     * different success type. The detail value is dropped.
     */
    public <U> Outcome<U> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return new Outcome<>(code, null, message);
    }

    public boolean isOk() {
        return code == OutcomeCode.OK;
    }

    public OutcomeCode getCode() {
        return code;
    }

    public T getValue() {
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isOk() ? "Outcome[OK, " + value + "]" : "Outcome[" + code + ", " + message + "]";
    }
}
