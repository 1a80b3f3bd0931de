package com.tasktracker.api.common;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error envelope shared by the exception handler and the security entry points:
 * {status: "error", reason, message, fields?, ts}.
 */
public final class ErrorBodies {

  private ErrorBodies() {}

  public static Map<String, Object> error(String reason, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", reason);
    body.put("message", message);
    body.put("ts", Instant.now().toString());
    return body;
  }

  public static Map<String, Object> validation(Map<String, List<String>> fields) {
    Map<String, Object> body = error("validation_error", "invalid_request");
    body.put("fields", fields);
    return body;
  }
}
