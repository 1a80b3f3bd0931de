package com.tasktracker.api.task;

import com.tasktracker.api.security.CallerResolver;
import com.tasktracker.domain.ValidationException;
import com.tasktracker.domain.task.TaskNotFoundException;
import com.tasktracker.domain.task.TaskStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Task CRUD for the authenticated caller. The owner always comes from the
 * access token, never from the request.
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

  private final TaskService tasks;
  private final CallerResolver callers;

  public TaskController(TaskService tasks, CallerResolver callers) {
    this.tasks = tasks;
    this.callers = callers;
  }

  @GetMapping(value = {"", "/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public List<TaskResponse> list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(value = "status", required = false) String status
  ) {
    var caller = callers.require(jwt);
    TaskStatus filter = null;
    if (status != null && !status.isBlank()) {
      filter = TaskStatus.fromWire(status.trim()).orElseThrow(() -> ValidationException.of("status",
          "Select a valid choice. " + status.trim() + " is not one of the available choices."));
    }
    return tasks.list(caller.userId(), filter);
  }

  @PostMapping(value = {"", "/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TaskResponse> create(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody TaskRequests.Write req) {
    var caller = callers.require(jwt);
    return ResponseEntity.status(HttpStatus.CREATED).body(tasks.create(caller.userId(), req));
  }

  @GetMapping(value = {"/{id}", "/{id}/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public TaskResponse get(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") String id) {
    var caller = callers.require(jwt);
    return tasks.get(caller.userId(), parseId(id));
  }

  @PutMapping(value = {"/{id}", "/{id}/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public TaskResponse replace(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable("id") String id,
      @Valid @RequestBody TaskRequests.Write req
  ) {
    var caller = callers.require(jwt);
    return tasks.replace(caller.userId(), parseId(id), req);
  }

  @PatchMapping(value = {"/{id}", "/{id}/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public TaskResponse patch(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable("id") String id,
      @Valid @RequestBody TaskRequests.Patch req
  ) {
    var caller = callers.require(jwt);
    return tasks.patch(caller.userId(), parseId(id), req);
  }

  @DeleteMapping({"/{id}", "/{id}/"})
  public ResponseEntity<Void> delete(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") String id) {
    var caller = callers.require(jwt);
    tasks.delete(caller.userId(), parseId(id));
    return ResponseEntity.noContent().build();
  }

  // a malformed id cannot name one of the caller's tasks
  private static Long parseId(String id) {
    try {
      return Long.valueOf(id);
    } catch (NumberFormatException e) {
      throw new TaskNotFoundException();
    }
  }
}
