package com.alyaman.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Links a posted journal entry to the entry that reverses it. An original entry has at most one
 * reversal.
 */
@Entity
@Table(
    name = "reversal_link",
    indexes = {
      @Index(name = "idx_reversal_link_reversing", columnList = "reversing_entry_id")
    },
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_reversal_link_original", columnNames = "original_entry_id")
    })
public class ReversalLink {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "original_entry_id", nullable = false)
  private JournalEntry originalEntry;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "reversing_entry_id", nullable = false)
  private JournalEntry reversingEntry;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "created_by_id")
  private User createdBy;

  @Column(length = 500)
  private String reason;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public ReversalLink() {}

  public ReversalLink(
      JournalEntry originalEntry, JournalEntry reversingEntry, User createdBy, String reason) {
    this.originalEntry = originalEntry;
    this.reversingEntry = reversingEntry;
    this.createdBy = createdBy;
    this.reason = reason;
  }

  public Long getId() {
    return id;
  }

  public JournalEntry getOriginalEntry() {
    return originalEntry;
  }

  public JournalEntry getReversingEntry() {
    return reversingEntry;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public User getCreatedBy() {
    return createdBy;
  }

  public String getReason() {
    return reason;
  }
}
