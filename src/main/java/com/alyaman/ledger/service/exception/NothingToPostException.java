package com.alyaman.ledger.service.exception;

/**
 * Thrown when a workflow computes nothing to post, such as a salary of zero for the period
 */
public class NothingToPostException extends LedgerException {

    public NothingToPostException(String message) {
        super(ErrorKind.NOTHING_TO_POST, message);
    }
}
