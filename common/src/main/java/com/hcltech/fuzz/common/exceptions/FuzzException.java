package com.hcltech.fuzz.common.exceptions;

/**
 * Root of every error raised by the fuzz libraries. Carries the {@link ErrorKind} and the value
 * that caused it, so callers can branch on the kind without parsing messages.
 */
public abstract class FuzzException extends RuntimeException {
    private final ErrorKind kind;
    private final transient Object offendingValue;

    protected FuzzException(ErrorKind kind, String message, Object offendingValue) {
        super(message);
        this.kind = kind;
        this.offendingValue = offendingValue;
    }

    public ErrorKind kind() { return kind; }

    /** May be null, e.g. when the problem is a missing value. */
    public Object offendingValue() { return offendingValue; }
}
