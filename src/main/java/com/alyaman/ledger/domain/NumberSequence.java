package com.alyaman.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** A monotonic counter per document type, used to number journal entries and documents. */
@Entity
@Table(
    name = "number_sequence",
    uniqueConstraints = {@UniqueConstraint(name = "uk_number_sequence_key", columnNames = "seq_key")})
public class NumberSequence {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 64)
  @Column(name = "seq_key", nullable = false, length = 64, updatable = false)
  private String key;

  @Column(name = "last_value", nullable = false)
  private long lastValue = 0L;

  public NumberSequence() {}

  public NumberSequence(String key) {
    this.key = key;
  }

  /** Increments the counter and returns the new value. Caller must hold the row lock. */
  public long increment() {
    lastValue += 1;
    return lastValue;
  }

  public Long getId() {
    return id;
  }

  public String getKey() {
    return key;
  }

  public long getLastValue() {
    return lastValue;
  }
}
