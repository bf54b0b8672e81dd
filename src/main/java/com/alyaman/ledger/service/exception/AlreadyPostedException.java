package com.alyaman.ledger.service.exception;

/**
 * Thrown when posting a journal entry that is already posted
 */
public class AlreadyPostedException extends LedgerException {

    private final String reference;

    public AlreadyPostedException(String reference) {
        super(ErrorKind.ALREADY_POSTED, String.format("Journal entry %s is already posted", reference));
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
