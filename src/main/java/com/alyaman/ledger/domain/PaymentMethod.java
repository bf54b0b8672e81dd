package com.alyaman.ledger.domain;

/** How money moved for a receipt, expense or enrollment. */
public enum PaymentMethod {
  CASH,
  BANK,
  CARD,
  TRANSFER
}
