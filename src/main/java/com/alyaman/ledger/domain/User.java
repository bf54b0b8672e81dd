package com.alyaman.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** The actor recorded on journal entries, documents and audit events. */
@Entity
@Table(
    name = "app_user",
    uniqueConstraints = {@UniqueConstraint(name = "uk_app_user_username", columnNames = "username")})
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 150)
  @Column(nullable = false, length = 150)
  private String username;

  @Size(max = 200)
  @Column(name = "display_name", length = 200)
  private String displayName;

  @Column(nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public User() {}

  public User(String username, String displayName) {
    this.username = username;
    this.displayName = displayName;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getUsername() {
    return username;
  }

  public String getDisplayName() {
    return displayName != null && !displayName.isBlank() ? displayName : username;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
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
