package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One leg of a journal entry against exactly one account. The amount is always positive; the
 * direction is carried by the debit flag. Transactions are never modified after creation.
 */
@Entity
@Table(
    name = "ledger_transaction",
    indexes = {
      @Index(name = "idx_ledger_tx_entry", columnList = "journal_entry_id"),
      @Index(name = "idx_ledger_tx_account", columnList = "account_id"),
      @Index(name = "idx_ledger_tx_cost_center", columnList = "cost_center_id")
    })
public class Transaction {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "journal_entry_id", nullable = false, updatable = false)
  private JournalEntry journalEntry;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false, updatable = false)
  private Account account;

  @NotNull
  @DecimalMin("0.01")
  @Column(nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Column(name = "is_debit", nullable = false, updatable = false)
  private boolean debit;

  @Size(max = 500)
  @Column(length = 500, updatable = false)
  private String description;

  // Nulled by the database when the cost center is deleted
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "cost_center_id")
  private CostCenter costCenter;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Transaction() {}

  public Transaction(
      Account account,
      BigDecimal amount,
      boolean debit,
      String description,
      CostCenter costCenter) {
    this.account = account;
    this.amount = amount;
    this.debit = debit;
    this.description = description;
    this.costCenter = costCenter;
  }

  void setJournalEntry(JournalEntry journalEntry) {
    this.journalEntry = journalEntry;
  }

  // Getters only - transactions are immutable after creation
  public Long getId() {
    return id;
  }

  public JournalEntry getJournalEntry() {
    return journalEntry;
  }

  public Account getAccount() {
    return account;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public boolean isDebit() {
    return debit;
  }

  public boolean isCredit() {
    return !debit;
  }

  public BigDecimal getDebitAmount() {
    return debit ? amount : BigDecimal.ZERO;
  }

  public BigDecimal getCreditAmount() {
    return debit ? BigDecimal.ZERO : amount;
  }

  public String getDescription() {
    return description;
  }

  public CostCenter getCostCenter() {
    return costCenter;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return account.getCode() + " - " + amount + " (" + (debit ? "Dr" : "Cr") + ")";
  }
}
