package com.alyaman.ledger.service.exception;

/**
 * Thrown when an operation needs a posted document or entry that was never posted
 */
public class NotPostedException extends LedgerException {

    private final String reference;

    public NotPostedException(String reference) {
        this(reference,
            String.format("Journal entry %s is not posted and cannot be reversed", reference));
    }

    public NotPostedException(String reference, String message) {
        super(ErrorKind.NOT_POSTED, message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
