package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Administrative staff on a fixed monthly salary. */
@Entity
@Table(name = "employee")
public class Employee {

  public enum Position {
    ADMIN,
    ACCOUNTANT,
    HR,
    STAFF
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 200)
  @Column(name = "full_name", nullable = false, length = 200)
  private String fullName;

  @Size(max = 20)
  @Column(length = 20)
  private String phone;

  @Column(name = "hire_date")
  private LocalDate hireDate;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal salary = BigDecimal.ZERO;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private Position position = Position.STAFF;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public Employee() {}

  public Employee(String fullName, BigDecimal salary) {
    this.fullName = fullName;
    this.salary = salary;
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

  public BigDecimal getSalary() {
    return salary;
  }

  public void setSalary(BigDecimal salary) {
    this.salary = salary;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
