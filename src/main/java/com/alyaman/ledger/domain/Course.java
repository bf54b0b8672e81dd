package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** A course offered by the institute. Each course owns a deferred revenue and a revenue account. */
@Entity
@Table(
    name = "course",
    indexes = {@Index(name = "idx_course_cost_center", columnList = "cost_center_id")})
public class Course {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 200)
  @Column(nullable = false, length = 200)
  private String name;

  @Size(max = 200)
  @Column(name = "localized_name", length = 200)
  private String localizedName;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal price = BigDecimal.ZERO;

  @Column(name = "duration_hours")
  private Integer durationHours;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "cost_center_id")
  private CostCenter costCenter;

  @Column(nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public Course() {}

  public Course(String name, BigDecimal price, CostCenter costCenter) {
    this.name = name;
    this.price = price;
    this.costCenter = costCenter;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
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

  public BigDecimal getPrice() {
    return price;
  }

  public void setPrice(BigDecimal price) {
    this.price = price;
  }

  public Integer getDurationHours() {
    return durationHours;
  }

  public void setDurationHours(Integer durationHours) {
    this.durationHours = durationHours;
  }

  public CostCenter getCostCenter() {
    return costCenter;
  }

  public void setCostCenter(CostCenter costCenter) {
    this.costCenter = costCenter;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
