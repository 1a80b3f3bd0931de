package com.tasktracker.domain.task;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle state of a task. Any state may be moved to any other by an explicit update.
 */
public enum TaskStatus {
    TODO("todo", "To Do"),
    IN_PROGRESS("in_progress", "In Progress"),
    DONE("done", "Completed");

    private final String wireValue;
    private final String label;

    TaskStatus(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    /** Value stored in the database and exchanged over the API. */
    public String wireValue() {
        return wireValue;
    }

    public String label() {
        return label;
    }

    public static Optional<TaskStatus> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(value))
                .findFirst();
    }

    public static TaskStatus defaultStatus() {
        return TODO;
    }
}
