package com.alyaman.ledger.service.exception;

import java.math.BigDecimal;

/**
 * Thrown when journal entry debits don't equal credits
 */
public class UnbalancedEntryException extends LedgerException {

    private final String reference;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public UnbalancedEntryException(String reference, BigDecimal totalDebits, BigDecimal totalCredits) {
        super(ErrorKind.UNBALANCED,
            String.format("Journal entry %s not balanced: debits=%s, credits=%s, difference=%s",
                reference, totalDebits, totalCredits, totalDebits.subtract(totalCredits)));
        this.reference = reference;
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }

    public String getReference() {
        return reference;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getDifference() {
        return totalDebits.subtract(totalCredits);
    }
}
