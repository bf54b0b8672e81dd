package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * An operating expense paid in cash or through the bank, numbered EX-000001 onwards. Posting debits
 * the chosen expense account and credits the payment account.
 */
@Entity
@Table(
    name = "expense_entry",
    uniqueConstraints = {@UniqueConstraint(name = "uk_expense_reference", columnNames = "reference")},
    indexes = {@Index(name = "idx_expense_date", columnList = "expense_date")})
public class ExpenseEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 50)
  @Column(nullable = false, length = 50, updatable = false)
  private String reference;

  @NotNull
  @Column(name = "expense_date", nullable = false)
  private LocalDate date;

  @NotBlank
  @Size(max = 500)
  @Column(nullable = false, length = 500)
  private String description;

  @NotNull
  @DecimalMin("0.01")
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "payment_method", nullable = false, length = 20)
  private PaymentMethod paymentMethod = PaymentMethod.CASH;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "cost_center_id")
  private CostCenter costCenter;

  @Size(max = 1000)
  @Column(length = 1000)
  private String notes;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "journal_entry_id")
  private JournalEntry journalEntry;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "created_by_id")
  private User createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public ExpenseEntry() {}

  public ExpenseEntry(
      String reference,
      LocalDate date,
      String description,
      BigDecimal amount,
      Account account,
      PaymentMethod paymentMethod) {
    this.reference = reference;
    this.date = date;
    this.description = description;
    this.amount = amount;
    this.account = account;
    this.paymentMethod = paymentMethod;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getReference() {
    return reference;
  }

  public LocalDate getDate() {
    return date;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public PaymentMethod getPaymentMethod() {
    return paymentMethod;
  }

  public Account getAccount() {
    return account;
  }

  public CostCenter getCostCenter() {
    return costCenter;
  }

  public void setCostCenter(CostCenter costCenter) {
    this.costCenter = costCenter;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public JournalEntry getJournalEntry() {
    return journalEntry;
  }

  public void setJournalEntry(JournalEntry journalEntry) {
    this.journalEntry = journalEntry;
  }

  public User getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(User createdBy) {
    this.createdBy = createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
