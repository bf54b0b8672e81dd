package com.alyaman.ledger.service.exception;

/**
 * Thrown when a required account cannot be resolved for a posting
 */
public class MissingAccountException extends LedgerException {

    public MissingAccountException(String message) {
        super(ErrorKind.MISSING_ACCOUNT, message);
    }
}
