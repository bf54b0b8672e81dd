package com.alyaman.ledger.service.exception;

/**
 * Thrown when reversing a journal entry that already has a reversal
 */
public class AlreadyReversedException extends LedgerException {

    private final String reference;
    private final String reversingReference;

    public AlreadyReversedException(String reference, String reversingReference) {
        super(ErrorKind.ALREADY_REVERSED,
            String.format("Journal entry %s was already reversed by %s", reference, reversingReference));
        this.reference = reference;
        this.reversingReference = reversingReference;
    }

    public String getReference() {
        return reference;
    }

    public String getReversingReference() {
        return reversingReference;
    }
}
