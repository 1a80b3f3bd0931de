package com.tasktracker.infrastructure.user;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uk_users_username", columnNames = "username"))
public class UserEntity {

  public static final String ROLE_USER = "USER";
  public static final String ROLE_ADMIN = "ADMIN";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "username", nullable = false, length = 150)
  private String username;

  @Column(name = "email", nullable = false, length = 254)
  private String email;

  @Column(name = "password_hash", nullable = false, length = 100)
  private String passwordHash;

  @Column(name = "first_name", nullable = false, length = 150)
  private String firstName;

  @Column(name = "last_name", nullable = false, length = 150)
  private String lastName;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(UUID id, String username, String email, String passwordHash, String role, Instant createdAt) {
    this.id = id;
    this.username = username;
    this.email = email;
    this.passwordHash = passwordHash;
    this.firstName = "";
    this.lastName = "";
    this.role = role;
    this.enabled = true;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getUsername() { return username; }
  public String getEmail() { return email; }
  public String getPasswordHash() { return passwordHash; }
  public String getFirstName() { return firstName; }
  public String getLastName() { return lastName; }
  public String getRole() { return role; }
  public boolean isEnabled() { return enabled; }
  public Instant getCreatedAt() { return createdAt; }

  public void setEmail(String email) { this.email = email; }
  public void setFirstName(String firstName) { this.firstName = firstName == null ? "" : firstName; }
  public void setLastName(String lastName) { this.lastName = lastName == null ? "" : lastName; }
  public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
