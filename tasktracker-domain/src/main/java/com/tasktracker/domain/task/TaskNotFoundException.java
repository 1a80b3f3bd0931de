package com.tasktracker.domain.task;

import com.tasktracker.domain.DomainException;

/**
 * Raised when a task id does not resolve within the caller's own tasks.
 *
 * A task owned by someone else produces exactly the same exception as a task
 * that never existed.
 */
public final class TaskNotFoundException extends DomainException {

    public TaskNotFoundException() {
        super("Not found.");
    }
}
