package com.alyaman.ledger.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StudentEnrollmentTest {

  private Student student;
  private StudentEnrollment enrollment;

  @BeforeEach
  void setUp() {
    student = new Student("S-001", "Yousef Amin");
    Course course = new Course("Math Prep", new BigDecimal("2000.00"), null);
    enrollment = new StudentEnrollment(student, course, LocalDate.of(2024, 9, 1), new BigDecimal("2000.00"));
  }

  @Test
  void getNetAmount_appliesPercentageThenFixedDiscount() {
    enrollment.setDiscountPercent(new BigDecimal("10"));
    enrollment.setDiscountAmount(new BigDecimal("150.00"));

    assertEquals(0, new BigDecimal("1650.00").compareTo(enrollment.getNetAmount()));
  }

  @Test
  void getNetAmount_roundsPercentageToCents() {
    enrollment.setTotalAmount(new BigDecimal("999.99"));
    enrollment.setDiscountPercent(new BigDecimal("12.5"));

    // 999.99 * 12.5% = 124.99875 -> 125.00
    assertEquals(0, new BigDecimal("874.99").compareTo(enrollment.getNetAmount()));
  }

  @Test
  void getNetAmount_neverNegative() {
    enrollment.setDiscountAmount(new BigDecimal("5000.00"));

    assertEquals(0, BigDecimal.ZERO.compareTo(enrollment.getNetAmount()));
  }

  @Test
  void getBalanceDue_subtractsAppliedReceipts() {
    enrollment.setDiscountPercent(new BigDecimal("10"));
    new StudentReceipt("SR-000001", LocalDate.of(2024, 9, 2), student, new BigDecimal("1000.00"))
        .applyTo(enrollment);
    new StudentReceipt("SR-000002", LocalDate.of(2024, 9, 9), student, new BigDecimal("800.00"))
        .applyTo(enrollment);

    assertEquals(0, new BigDecimal("1800.00").compareTo(enrollment.getAmountPaid()));
    assertEquals(0, BigDecimal.ZERO.compareTo(enrollment.getBalanceDue()));
  }

  @Test
  void getBalanceDue_whenOverpaid_isZero() {
    new StudentReceipt("SR-000003", LocalDate.of(2024, 9, 2), student, new BigDecimal("2500.00"))
        .applyTo(enrollment);

    assertEquals(0, BigDecimal.ZERO.compareTo(enrollment.getBalanceDue()));
  }
}
