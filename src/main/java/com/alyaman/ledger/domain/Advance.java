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
 * Cash advanced to a teacher or an employee against future salary, numbered ADV-000001 onwards.
 * Exactly one of teacher and employee is set.
 */
@Entity
@Table(
    name = "advance",
    uniqueConstraints = {@UniqueConstraint(name = "uk_advance_reference", columnNames = "reference")},
    indexes = {
      @Index(name = "idx_advance_teacher", columnList = "teacher_id"),
      @Index(name = "idx_advance_employee", columnList = "employee_id")
    })
public class Advance {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 50)
  @Column(nullable = false, length = 50, updatable = false)
  private String reference;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "teacher_id")
  private Teacher teacher;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "employee_id")
  private Employee employee;

  @NotNull
  @Column(name = "advance_date", nullable = false)
  private LocalDate date;

  @NotNull
  @DecimalMin("0.01")
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Size(max = 500)
  @Column(length = 500)
  private String purpose;

  @Column(name = "repayment_date")
  private LocalDate repaymentDate;

  @Column(name = "is_repaid", nullable = false)
  private boolean repaid = false;

  @NotNull
  @Column(name = "repaid_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal repaidAmount = BigDecimal.ZERO;

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
  public Advance() {}

  public static Advance forTeacher(
      String reference, Teacher teacher, LocalDate date, BigDecimal amount, String purpose) {
    Advance advance = new Advance(reference, date, amount, purpose);
    advance.teacher = teacher;
    return advance;
  }

  public static Advance forEmployee(
      String reference, Employee employee, LocalDate date, BigDecimal amount, String purpose) {
    Advance advance = new Advance(reference, date, amount, purpose);
    advance.employee = employee;
    return advance;
  }

  private Advance(String reference, LocalDate date, BigDecimal amount, String purpose) {
    this.reference = reference;
    this.date = date;
    this.amount = amount;
    this.purpose = purpose;
  }

  public boolean isTeacherAdvance() {
    return teacher != null;
  }

  /** True once the cash payout has been booked to the advance account. */
  public boolean isPosted() {
    return journalEntry != null;
  }

  public String getPayeeName() {
    return teacher != null ? teacher.getFullName() : employee.getFullName();
  }

  public BigDecimal getOutstandingAmount() {
    BigDecimal outstanding = amount.subtract(repaidAmount);
    return outstanding.signum() > 0 ? outstanding : BigDecimal.ZERO;
  }

  /** Records a repayment; the advance is settled once nothing is outstanding. */
  public void recordRepayment(BigDecimal repayment, LocalDate when) {
    this.repaidAmount = repaidAmount.add(repayment);
    this.repaymentDate = when;
    this.repaid = getOutstandingAmount().signum() == 0;
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

  public Teacher getTeacher() {
    return teacher;
  }

  public Employee getEmployee() {
    return employee;
  }

  public LocalDate getDate() {
    return date;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getPurpose() {
    return purpose;
  }

  public LocalDate getRepaymentDate() {
    return repaymentDate;
  }

  public boolean isRepaid() {
    return repaid;
  }

  public BigDecimal getRepaidAmount() {
    return repaidAmount;
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
