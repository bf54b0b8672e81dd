package com.alyaman.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A node in the chart of accounts. The code is the natural key that links domain entities
 * (students, courses, teachers) to their ledger accounts.
 *
 * <p>The {@code balance} column is a cache of the account's own net balance. It is written only by
 * the balance recompute that runs when a journal entry is posted; the transaction log stays the
 * source of truth.
 */
@Entity
@Table(
    name = "account",
    uniqueConstraints = {@UniqueConstraint(name = "uk_account_code", columnNames = "code")},
    indexes = {@Index(name = "idx_account_parent", columnList = "parent_id")})
public class Account {

  public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    EXPENSE;

    /** Debit-normal accounts grow with debits: assets and expenses. */
    public boolean isDebitNormal() {
      return this == ASSET || this == EXPENSE;
    }
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20)
  private String code;

  @NotBlank
  @Size(max = 200)
  @Column(nullable = false, length = 200)
  private String name;

  @Size(max = 200)
  @Column(name = "localized_name", length = 200)
  private String localizedName;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "account_type", nullable = false, updatable = false, length = 20)
  private AccountType type;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_id")
  private Account parent;

  @OneToMany(mappedBy = "parent")
  @OrderBy("code ASC")
  private List<Account> children = new ArrayList<>();

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Column(nullable = false)
  private boolean active = true;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal balance = BigDecimal.ZERO;

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
  public Account() {}

  public Account(String code, String name, AccountType type) {
    this.code = code;
    this.name = name;
    this.type = type;
  }

  // Getters and Setters
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

  /** Localized name when present, otherwise the base name. */
  public String getDisplayName() {
    return localizedName != null && !localizedName.isBlank() ? localizedName : name;
  }

  public AccountType getType() {
    return type;
  }

  public Account getParent() {
    return parent;
  }

  public void setParent(Account parent) {
    this.parent = parent;
  }

  public List<Account> getChildren() {
    return children;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  /** Called only by the balance recompute in AccountService. */
  public void updateCachedBalance(BigDecimal balance) {
    this.balance = balance;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return code + " - " + getDisplayName();
  }
}
