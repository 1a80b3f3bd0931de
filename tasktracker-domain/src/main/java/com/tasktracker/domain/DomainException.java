package com.tasktracker.domain;

/**
 * Base type for rule violations raised by the task tracker core.
 *
 * The API layer maps each subtype to a stable HTTP status and error reason.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
