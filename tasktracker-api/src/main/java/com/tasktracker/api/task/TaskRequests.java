package com.tasktracker.api.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Client-writable task fields. Only title, description and status can be sent;
 * owner, id and timestamps have no place here and are ignored if present in the body.
 */
public final class TaskRequests {

  static final String BLANK = "This field may not be blank.";
  static final String TITLE_TOO_LONG = "Ensure this field has no more than 200 characters.";
  static final String STATUS_VALUES = "todo|in_progress|done";
  static final String INVALID_CHOICE = "\"${validatedValue}\" is not a valid choice.";

  private TaskRequests() {}

  /** POST and PUT body. Title is required; omitted description/status keep their current (or default) value. */
  public record Write(
      @NotBlank(message = BLANK)
      @Size(max = 200, message = TITLE_TOO_LONG)
      String title,

      String description,

      @Pattern(regexp = STATUS_VALUES, message = INVALID_CHOICE)
      String status
  ) {}

  /** PATCH body. Every field is optional. */
  public record Patch(
      @Pattern(regexp = "(?s).*\\S.*", message = BLANK)
      @Size(max = 200, message = TITLE_TOO_LONG)
      String title,

      String description,

      @Pattern(regexp = STATUS_VALUES, message = INVALID_CHOICE)
      String status
  ) {}
}
