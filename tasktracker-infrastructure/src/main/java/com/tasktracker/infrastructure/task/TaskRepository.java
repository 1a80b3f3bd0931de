package com.tasktracker.infrastructure.task;

import com.tasktracker.domain.task.TaskStatus;
import org.springframework.data.repository.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task storage. Every read and delete takes the owner id as a required argument,
 * so there is no way to reach a task without naming whose it is.
 * Only owner-scoped queries are declared; the unscoped findAll / findById /
 * deleteById of JpaRepository are not exposed.
 */
public interface TaskRepository extends Repository<TaskEntity, Long> {

  TaskEntity save(TaskEntity task);

  Optional<TaskEntity> findByIdAndOwnerId(Long id, UUID ownerId);

  List<TaskEntity> findByOwnerIdOrderByCreatedAtDescIdDesc(UUID ownerId);

  List<TaskEntity> findByOwnerIdAndStatusOrderByCreatedAtDescIdDesc(UUID ownerId, TaskStatus status);

  long countByOwnerId(UUID ownerId);

  @Transactional
  long deleteByIdAndOwnerId(Long id, UUID ownerId);
}
