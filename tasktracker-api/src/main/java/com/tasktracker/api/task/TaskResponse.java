package com.tasktracker.api.task;

import com.tasktracker.infrastructure.task.TaskEntity;

import java.time.Instant;
import java.util.UUID;

public record TaskResponse(
    Long id,
    UUID owner,
    String title,
    String description,
    String status,
    Instant createdAt,
    Instant updatedAt
) {

  static TaskResponse of(TaskEntity t) {
    return new TaskResponse(
        t.getId(),
        t.getOwner().getId(),
        t.getTitle(),
        t.getDescription(),
        t.getStatus().wireValue(),
        t.getCreatedAt(),
        t.getUpdatedAt()
    );
  }
}
