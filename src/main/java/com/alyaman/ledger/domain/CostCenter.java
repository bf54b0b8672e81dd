package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A departmental reporting dimension. Transactions may be tagged with a cost center and every
 * course belongs to one. The tag on transactions is nulled on delete so history survives.
 */
@Entity
@Table(
    name = "cost_center",
    uniqueConstraints = {@UniqueConstraint(name = "uk_cost_center_code", columnNames = "code")})
public class CostCenter {

  public enum CostCenterType {
    ACADEMIC,
    ADMINISTRATIVE,
    OPERATIONAL,
    SUPPORT
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20)
  private String code;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @Size(max = 100)
  @Column(name = "localized_name", length = 100)
  private String localizedName;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "cost_center_type", nullable = false, length = 20)
  private CostCenterType type = CostCenterType.ACADEMIC;

  @Column(nullable = false)
  private boolean active = true;

  @Size(max = 200)
  @Column(name = "manager_name", length = 200)
  private String managerName;

  @Size(max = 20)
  @Column(name = "manager_phone", length = 20)
  private String managerPhone;

  @NotNull
  @Column(name = "annual_budget", nullable = false, precision = 19, scale = 2)
  private BigDecimal annualBudget = BigDecimal.ZERO;

  @NotNull
  @Column(name = "monthly_budget", nullable = false, precision = 19, scale = 2)
  private BigDecimal monthlyBudget = BigDecimal.ZERO;

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

  public CostCenter() {}

  public CostCenter(String code, String name, CostCenterType type) {
    this.code = code;
    this.name = name;
    this.type = type;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getLocalizedName() {
    return localizedName;
  }

  public void setLocalizedName(String localizedName) {
    this.localizedName = localizedName;
  }

  public String getDisplayName() {
    return localizedName != null && !localizedName.isBlank() ? localizedName : name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public CostCenterType getType() {
    return type;
  }

  public void setType(CostCenterType type) {
    this.type = type;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public String getManagerName() {
    return managerName;
  }

  public void setManagerName(String managerName) {
    this.managerName = managerName;
  }

  public String getManagerPhone() {
    return managerPhone;
  }

  public void setManagerPhone(String managerPhone) {
    this.managerPhone = managerPhone;
  }

  public BigDecimal getAnnualBudget() {
    return annualBudget;
  }

  public void setAnnualBudget(BigDecimal annualBudget) {
    this.annualBudget = annualBudget;
  }

  public BigDecimal getMonthlyBudget() {
    return monthlyBudget;
  }

  public void setMonthlyBudget(BigDecimal monthlyBudget) {
    this.monthlyBudget = monthlyBudget;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
