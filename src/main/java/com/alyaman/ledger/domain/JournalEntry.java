package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * An atomic accounting event made of at least two debit/credit transactions. Entries follow a
 * DRAFT → POSTED workflow. Once posted an entry and its transactions are immutable; corrections
 * are made with a reversing entry, never by editing.
 */
@Entity
@Table(
    name = "journal_entry",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_journal_entry_reference", columnNames = "reference")
    },
    indexes = {@Index(name = "idx_journal_entry_date", columnList = "entry_date")})
public class JournalEntry {

  public enum EntryType {
    MANUAL,
    ENROLLMENT,
    PAYMENT,
    COMPLETION,
    EXPENSE,
    SALARY,
    ADVANCE,
    ADJUSTMENT
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 50)
  @Column(nullable = false, length = 50, updatable = false)
  private String reference;

  @NotNull
  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @NotBlank
  @Size(max = 1000)
  @Column(nullable = false, length = 1000)
  private String description;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "entry_type", nullable = false, length = 20)
  private EntryType entryType = EntryType.MANUAL;

  @NotNull
  @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal totalAmount = BigDecimal.ZERO;

  @Column(name = "is_posted", nullable = false)
  private boolean posted = false;

  @Column(name = "posted_at")
  private Instant postedAt;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "posted_by_id")
  private User postedBy;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "created_by_id")
  private User createdBy;

  @OneToMany(mappedBy = "journalEntry", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("id ASC")
  private List<Transaction> transactions = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  public JournalEntry() {}

  public JournalEntry(
      String reference, LocalDate entryDate, String description, EntryType entryType) {
    this.reference = reference;
    this.entryDate = entryDate;
    this.description = description;
    this.entryType = entryType;
  }

  // Line management
  public void addTransaction(Transaction transaction) {
    if (posted) {
      throw new IllegalStateException("Cannot add transactions to a posted entry: " + reference);
    }
    transaction.setJournalEntry(this);
    transactions.add(transaction);
  }

  public BigDecimal getTotalDebits() {
    return transactions.stream()
        .filter(Transaction::isDebit)
        .map(Transaction::getAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal getTotalCredits() {
    return transactions.stream()
        .filter(Transaction::isCredit)
        .map(Transaction::getAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /** True when debits and credits differ by less than the tolerance. */
  public boolean isBalanced(BigDecimal tolerance) {
    return getTotalDebits().subtract(getTotalCredits()).abs().compareTo(tolerance) < 0;
  }

  public void markPosted(User actor, Instant when) {
    this.posted = true;
    this.postedAt = when;
    this.postedBy = actor;
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

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public String getDescription() {
    return description;
  }

  public EntryType getEntryType() {
    return entryType;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public void setTotalAmount(BigDecimal totalAmount) {
    this.totalAmount = totalAmount;
  }

  public boolean isPosted() {
    return posted;
  }

  public Instant getPostedAt() {
    return postedAt;
  }

  public User getPostedBy() {
    return postedBy;
  }

  public User getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(User createdBy) {
    this.createdBy = createdBy;
  }

  public List<Transaction> getTransactions() {
    return Collections.unmodifiableList(transactions);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return reference + " - " + entryDate;
  }
}
