package com.alyaman.ledger.domain;

import java.time.Instant;
import java.time.YearMonth;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Records that a salary accrual or payment was posted for a payee and month. The unique key stops
 * the same month being posted twice.
 */
@Entity
@Table(
    name = "salary_posting",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_salary_posting_period",
          columnNames = {"payee_type", "payee_id", "period_year", "period_month", "purpose"})
    })
public class SalaryPosting {

  public enum PayeeType {
    TEACHER,
    EMPLOYEE
  }

  public enum Purpose {
    ACCRUAL,
    PAYMENT
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "payee_type", nullable = false, length = 10)
  private PayeeType payeeType;

  @NotNull
  @Column(name = "payee_id", nullable = false)
  private Long payeeId;

  @Column(name = "period_year", nullable = false)
  private int periodYear;

  @Column(name = "period_month", nullable = false)
  private int periodMonth;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private Purpose purpose;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "journal_entry_id", nullable = false)
  private JournalEntry journalEntry;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public SalaryPosting() {}

  public SalaryPosting(
      PayeeType payeeType,
      Long payeeId,
      YearMonth period,
      Purpose purpose,
      JournalEntry journalEntry) {
    this.payeeType = payeeType;
    this.payeeId = payeeId;
    this.periodYear = period.getYear();
    this.periodMonth = period.getMonthValue();
    this.purpose = purpose;
    this.journalEntry = journalEntry;
  }

  public Long getId() {
    return id;
  }

  public PayeeType getPayeeType() {
    return payeeType;
  }

  public Long getPayeeId() {
    return payeeId;
  }

  public YearMonth getPeriod() {
    return YearMonth.of(periodYear, periodMonth);
  }

  public Purpose getPurpose() {
    return purpose;
  }

  public JournalEntry getJournalEntry() {
    return journalEntry;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
