package com.tasktracker.infrastructure.task;

import com.tasktracker.domain.task.TaskStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TaskStatus} as its wire value (todo / in_progress / done).
 */
@Converter
public class TaskStatusConverter implements AttributeConverter<TaskStatus, String> {

  @Override
  public String convertToDatabaseColumn(TaskStatus status) {
    return status == null ? null : status.wireValue();
  }

  @Override
  public TaskStatus convertToEntityAttribute(String value) {
    if (value == null) return null;
    return TaskStatus.fromWire(value)
        .orElseThrow(() -> new IllegalStateException("Unknown task status in database: " + value));
  }
}
