package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** A payment received from a student, numbered SR-000001 onwards. */
@Entity
@Table(
    name = "student_receipt",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_student_receipt_number", columnNames = "receipt_number")
    },
    indexes = {
      @Index(name = "idx_receipt_enrollment", columnList = "enrollment_id"),
      @Index(name = "idx_receipt_date", columnList = "receipt_date")
    })
public class StudentReceipt {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 50)
  @Column(name = "receipt_number", nullable = false, length = 50, updatable = false)
  private String receiptNumber;

  @NotNull
  @Column(name = "receipt_date", nullable = false)
  private LocalDate date;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "student_id")
  private Student student;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "course_id")
  private Course course;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "enrollment_id")
  private StudentEnrollment enrollment;

  // Gross amount before discounts, optional
  @Column(precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @DecimalMin("0.00")
  @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal paidAmount;

  @NotNull
  @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
  private BigDecimal discountPercent = BigDecimal.ZERO;

  @NotNull
  @Column(name = "discount_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal discountAmount = BigDecimal.ZERO;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "payment_method", nullable = false, length = 20)
  private PaymentMethod paymentMethod = PaymentMethod.CASH;

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
  public StudentReceipt() {}

  public StudentReceipt(
      String receiptNumber, LocalDate date, Student student, BigDecimal paidAmount) {
    this.receiptNumber = receiptNumber;
    this.date = date;
    this.student = student;
    this.paidAmount = paidAmount;
  }

  /** Links the receipt to an enrollment so it counts towards the amount paid. */
  public void applyTo(StudentEnrollment enrollment) {
    this.enrollment = enrollment;
    this.course = enrollment.getCourse();
    enrollment.addPayment(this);
  }

  public BigDecimal getNetAmount() {
    BigDecimal base = amount != null ? amount : paidAmount != null ? paidAmount : BigDecimal.ZERO;
    BigDecimal percentOff = base.multiply(discountPercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    BigDecimal net = base.subtract(percentOff).subtract(discountAmount);
    return net.signum() > 0 ? net : BigDecimal.ZERO;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getReceiptNumber() {
    return receiptNumber;
  }

  public LocalDate getDate() {
    return date;
  }

  public Student getStudent() {
    return student;
  }

  public Course getCourse() {
    return course;
  }

  public void setCourse(Course course) {
    this.course = course;
  }

  public StudentEnrollment getEnrollment() {
    return enrollment;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public BigDecimal getPaidAmount() {
    return paidAmount;
  }

  public BigDecimal getDiscountPercent() {
    return discountPercent;
  }

  public void setDiscountPercent(BigDecimal discountPercent) {
    this.discountPercent = discountPercent;
  }

  public BigDecimal getDiscountAmount() {
    return discountAmount;
  }

  public void setDiscountAmount(BigDecimal discountAmount) {
    this.discountAmount = discountAmount;
  }

  public PaymentMethod getPaymentMethod() {
    return paymentMethod;
  }

  public void setPaymentMethod(PaymentMethod paymentMethod) {
    this.paymentMethod = paymentMethod;
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
