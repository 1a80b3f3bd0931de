package com.tasktracker.api.common;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.tasktracker.domain.AuthenticationFailedException;
import com.tasktracker.domain.ValidationException;
import com.tasktracker.domain.task.TaskNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the error taxonomy onto HTTP:
 *  - validation problems  -> 400 with field messages
 *  - bad credentials/token -> 401
 *  - missing or foreign task -> 404
 *  - anything unexpected -> 500 without internal detail
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final PropertyNamingStrategies.SnakeCaseStrategy WIRE_NAMES =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> validation(ValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorBodies.validation(ex.fieldErrors()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, List<String>> fields = new LinkedHashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.computeIfAbsent(WIRE_NAMES.translate(fe.getField()), k -> new ArrayList<>())
          .add(fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorBodies.validation(fields));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorBodies.error("bad_request", "Malformed request body."));
  }

  @ExceptionHandler(AuthenticationFailedException.class)
  public ResponseEntity<Map<String, Object>> unauthorized(AuthenticationFailedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
        .body(ErrorBodies.error(ex.reason(), ex.getMessage()));
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(TaskNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBodies.error("not_found", ex.getMessage()));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> forbidden(AccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ErrorBodies.error("permission_denied", "You do not have permission to perform this action."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> unexpected(Exception ex, HttpServletRequest req) {
    // framework errors (unknown route, wrong method, bad media type) keep their own status
    if (ex instanceof ErrorResponse er) {
      HttpStatus status = HttpStatus.valueOf(er.getStatusCode().value());
      return ResponseEntity.status(status)
          .body(ErrorBodies.error(status.name().toLowerCase(Locale.ROOT), status.getReasonPhrase()));
    }
    log.error("Unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorBodies.error("server_error", "internal_error"));
  }
}
