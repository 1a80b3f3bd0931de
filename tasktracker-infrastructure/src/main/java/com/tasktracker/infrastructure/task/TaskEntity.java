package com.tasktracker.infrastructure.task;

import com.tasktracker.domain.task.TaskStatus;
import com.tasktracker.infrastructure.user.UserEntity;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

@Entity
@Table(name = "tasks", indexes = {
  @Index(name = "ix_tasks_owner_created", columnList = "owner_id, created_at")
})
public class TaskEntity {

  public static final int TITLE_MAX_LENGTH = 200;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  // owner is fixed at construction; no setter
  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "owner_id", nullable = false, updatable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private UserEntity owner;

  @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
  private String title;

  @Column(name = "description", nullable = false, columnDefinition = "text")
  private String description;

  @Convert(converter = TaskStatusConverter.class)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskEntity() {}

  public TaskEntity(UserEntity owner, String title, String description, TaskStatus status) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.title = Objects.requireNonNull(title, "title");
    this.description = description == null ? "" : description;
    this.status = status == null ? TaskStatus.defaultStatus() : status;
  }

  public Long getId() { return id; }
  public UserEntity getOwner() { return owner; }
  public String getTitle() { return title; }
  public String getDescription() { return description; }
  public TaskStatus getStatus() { return status; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setTitle(String title) { this.title = Objects.requireNonNull(title, "title"); }
  public void setDescription(String description) { this.description = description == null ? "" : description; }
  public void setStatus(TaskStatus status) { this.status = Objects.requireNonNull(status, "status"); }

  /**
   * Marks the row as modified. updated_at always moves forward, even when two
   * writes land within the same clock tick.
   */
  public void touch() {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
    if (updatedAt != null && !now.isAfter(updatedAt)) {
      now = updatedAt.plus(1, ChronoUnit.MICROS);
    }
    updatedAt = now;
  }

  @PrePersist
  void prePersist() {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
    if (createdAt == null) createdAt = now;
    if (updatedAt == null) updatedAt = now;
  }
}
