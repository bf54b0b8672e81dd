package com.alyaman.ledger.service.exception;

import java.math.BigDecimal;

/**
 * Thrown when a transaction amount is missing, below one cent, or has fractions of a cent
 */
public class InvalidAmountException extends LedgerException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount) {
        super(ErrorKind.INVALID_AMOUNT,
            String.format("Transaction amount must be at least 0.01 in whole cents, got %s", amount));
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
