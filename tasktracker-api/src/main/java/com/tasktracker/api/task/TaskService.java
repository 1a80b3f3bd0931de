package com.tasktracker.api.task;

import com.tasktracker.domain.task.TaskNotFoundException;
import com.tasktracker.domain.task.TaskStatus;
import com.tasktracker.infrastructure.task.TaskEntity;
import com.tasktracker.infrastructure.task.TaskRepository;
import com.tasktracker.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Task operations on behalf of one owner.
 *
 * Every method takes the caller's id and passes it into the storage query, so a
 * task owned by someone else is simply not found (404), never forbidden.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository tasks;
  private final UserRepository users;

  public TaskService(TaskRepository tasks, UserRepository users) {
    this.tasks = tasks;
    this.users = users;
  }

  /** Newest first; tasks created in the same instant are ordered by id, highest first. */
  @Transactional(readOnly = true)
  public List<TaskResponse> list(UUID ownerId, TaskStatus status) {
    List<TaskEntity> rows = status == null
        ? tasks.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId)
        : tasks.findByOwnerIdAndStatusOrderByCreatedAtDescIdDesc(ownerId, status);
    return rows.stream().map(TaskResponse::of).toList();
  }

  @Transactional
  public TaskResponse create(UUID ownerId, TaskRequests.Write req) {
    var task = new TaskEntity(
        users.getReferenceById(ownerId),
        req.title().trim(),
        req.description(),
        parseStatus(req.status(), TaskStatus.defaultStatus())
    );
    TaskEntity saved = tasks.save(task);
    log.debug("[TASK] created id={} owner={}", saved.getId(), ownerId);
    return TaskResponse.of(saved);
  }

  @Transactional(readOnly = true)
  public TaskResponse get(UUID ownerId, Long taskId) {
    return TaskResponse.of(load(ownerId, taskId));
  }

  @Transactional
  public TaskResponse replace(UUID ownerId, Long taskId, TaskRequests.Write req) {
    TaskEntity task = load(ownerId, taskId);
    task.setTitle(req.title().trim());
    if (req.description() != null) task.setDescription(req.description());
    if (req.status() != null) task.setStatus(parseStatus(req.status(), task.getStatus()));
    task.touch();
    return TaskResponse.of(tasks.save(task));
  }

  @Transactional
  public TaskResponse patch(UUID ownerId, Long taskId, TaskRequests.Patch req) {
    TaskEntity task = load(ownerId, taskId);
    if (req.title() != null) task.setTitle(req.title().trim());
    if (req.description() != null) task.setDescription(req.description());
    if (req.status() != null) task.setStatus(parseStatus(req.status(), task.getStatus()));
    task.touch();
    return TaskResponse.of(tasks.save(task));
  }

  @Transactional
  public void delete(UUID ownerId, Long taskId) {
    long removed = tasks.deleteByIdAndOwnerId(taskId, ownerId);
    if (removed == 0) {
      throw new TaskNotFoundException();
    }
    log.debug("[TASK] deleted id={} owner={}", taskId, ownerId);
  }

  private TaskEntity load(UUID ownerId, Long taskId) {
    return tasks.findByIdAndOwnerId(taskId, ownerId).orElseThrow(TaskNotFoundException::new);
  }

  // request records already restrict status to the wire values
  private static TaskStatus parseStatus(String value, TaskStatus fallback) {
    if (value == null) return fallback;
    return TaskStatus.fromWire(value).orElse(fallback);
  }
}
