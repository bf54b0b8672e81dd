package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A student's enrollment in a course. The enrollment owns the accrual entry that books the net
 * amount as a receivable against the course's deferred revenue.
 */
@Entity
@Table(
    name = "student_enrollment",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_enrollment_student_course",
          columnNames = {"student_id", "course_id"})
    },
    indexes = {@Index(name = "idx_enrollment_date", columnList = "enrollment_date")})
public class StudentEnrollment {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "student_id", nullable = false)
  private Student student;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "course_id", nullable = false)
  private Course course;

  @NotNull
  @Column(name = "enrollment_date", nullable = false)
  private LocalDate enrollmentDate;

  @NotNull
  @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal totalAmount;

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

  @Column(name = "is_completed", nullable = false)
  private boolean completed = false;

  @Column(name = "completion_date")
  private LocalDate completionDate;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "enrollment_entry_id")
  private JournalEntry enrollmentJournalEntry;

  @OneToMany(mappedBy = "enrollment")
  private List<StudentReceipt> payments = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public StudentEnrollment() {}

  public StudentEnrollment(
      Student student, Course course, LocalDate enrollmentDate, BigDecimal totalAmount) {
    this.student = student;
    this.course = course;
    this.enrollmentDate = enrollmentDate;
    this.totalAmount = totalAmount;
  }

  /** Gross amount less the percentage discount, less the fixed discount, never below zero. */
  public BigDecimal getNetAmount() {
    BigDecimal percentOff =
        totalAmount.multiply(discountPercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    BigDecimal net = totalAmount.subtract(percentOff).subtract(discountAmount);
    return net.signum() > 0 ? net : BigDecimal.ZERO;
  }

  public BigDecimal getAmountPaid() {
    return payments.stream()
        .map(StudentReceipt::getPaidAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal getBalanceDue() {
    BigDecimal due = getNetAmount().subtract(getAmountPaid());
    return due.signum() > 0 ? due : BigDecimal.ZERO;
  }

  void addPayment(StudentReceipt receipt) {
    payments.add(receipt);
  }

  public void markCompleted(LocalDate when) {
    this.completed = true;
    this.completionDate = when;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Student getStudent() {
    return student;
  }

  public Course getCourse() {
    return course;
  }

  public LocalDate getEnrollmentDate() {
    return enrollmentDate;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public void setTotalAmount(BigDecimal totalAmount) {
    this.totalAmount = totalAmount;
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

  public boolean isCompleted() {
    return completed;
  }

  public LocalDate getCompletionDate() {
    return completionDate;
  }

  public JournalEntry getEnrollmentJournalEntry() {
    return enrollmentJournalEntry;
  }

  public void setEnrollmentJournalEntry(JournalEntry enrollmentJournalEntry) {
    this.enrollmentJournalEntry = enrollmentJournalEntry;
  }

  public List<StudentReceipt> getPayments() {
    return payments;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
