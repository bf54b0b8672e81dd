package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A teacher paid per session, a fixed monthly amount, or both. Salary expense, dues and advance
 * accounts are created for each teacher when they are registered.
 */
@Entity
@Table(name = "teacher")
public class Teacher {

  public enum SalaryType {
    HOURLY, // sessions x hourly rate
    MONTHLY, // fixed monthly salary
    MIXED // monthly salary plus sessions x hourly rate
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(min = 3, max = 100)
  @Column(name = "full_name", nullable = false, length = 100)
  private String fullName;

  @Size(max = 20)
  @Column(length = 20)
  private String phone;

  @Column(name = "hire_date")
  private LocalDate hireDate;

  @NotNull
  @Column(name = "hourly_rate", nullable = false, precision = 19, scale = 2)
  private BigDecimal hourlyRate = BigDecimal.ZERO;

  @NotNull
  @Column(name = "monthly_salary", nullable = false, precision = 19, scale = 2)
  private BigDecimal monthlySalary = BigDecimal.ZERO;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "salary_type", nullable = false, length = 10)
  private SalaryType salaryType = SalaryType.HOURLY;

  @Size(max = 500)
  @Column(length = 500)
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public Teacher() {}

  public Teacher(String fullName, SalaryType salaryType) {
    this.fullName = fullName;
    this.salaryType = salaryType;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getFullName() {
    return fullName;
  }

  public void setFullName(String fullName) {
    this.fullName = fullName;
  }

  public String getPhone() {
    return phone;
  }

  public void setPhone(String phone) {
    this.phone = phone;
  }

  public LocalDate getHireDate() {
    return hireDate;
  }

  public void setHireDate(LocalDate hireDate) {
    this.hireDate = hireDate;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public void setHourlyRate(BigDecimal hourlyRate) {
    this.hourlyRate = hourlyRate;
  }

  public BigDecimal getMonthlySalary() {
    return monthlySalary;
  }

  public void setMonthlySalary(BigDecimal monthlySalary) {
    this.monthlySalary = monthlySalary;
  }

  public SalaryType getSalaryType() {
    return salaryType;
  }

  public void setSalaryType(SalaryType salaryType) {
    this.salaryType = salaryType;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
