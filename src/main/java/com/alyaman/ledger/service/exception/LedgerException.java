package com.alyaman.ledger.service.exception;

/**
 * Base type for ledger rule violations. A failed posting never leaves partial state: the
 * surrounding transaction rolls back, so callers may correct their input and try again.
 */
public class LedgerException extends IllegalStateException {

    public enum ErrorKind {
        ALREADY_POSTED,
        UNBALANCED,
        NOT_POSTED,
        ALREADY_REVERSED,
        MISSING_ACCOUNT,
        INVALID_AMOUNT,
        NOTHING_TO_POST
    }

    private final ErrorKind kind;

    public LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
