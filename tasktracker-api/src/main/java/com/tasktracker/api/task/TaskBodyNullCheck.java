package com.tasktracker.api.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasktracker.domain.ValidationException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejects an explicit JSON null for a writable task field.
 *
 * The request records cannot tell an omitted field from a null one, and only
 * omission means "keep the current value".
 */
@ControllerAdvice(assignableTypes = TaskController.class)
public class TaskBodyNullCheck extends RequestBodyAdviceAdapter {

  static final String NULL_NOT_ALLOWED = "This field may not be null.";
  static final List<String> WRITABLE_FIELDS = List.of("title", "description", "status");

  private final ObjectMapper om;

  public TaskBodyNullCheck(ObjectMapper om) {
    this.om = om;
  }

  @Override
  public boolean supports(MethodParameter parameter, Type targetType,
                          Class<? extends HttpMessageConverter<?>> converterType) {
    return targetType == TaskRequests.Write.class || targetType == TaskRequests.Patch.class;
  }

  @Override
  public HttpInputMessage beforeBodyRead(HttpInputMessage input, MethodParameter parameter, Type targetType,
                                         Class<? extends HttpMessageConverter<?>> converterType) throws IOException {
    byte[] body = input.getBody().readAllBytes();

    JsonNode tree;
    try {
      tree = om.readTree(body);
    } catch (JsonProcessingException malformed) {
      // the message converter reports malformed JSON as a bad request
      return replay(input.getHeaders(), body);
    }

    if (tree != null && tree.isObject()) {
      Map<String, List<String>> errors = new LinkedHashMap<>();
      for (String field : WRITABLE_FIELDS) {
        if (tree.has(field) && tree.get(field).isNull()) {
          errors.put(field, List.of(NULL_NOT_ALLOWED));
        }
      }
      if (!errors.isEmpty()) {
        throw new ValidationException(errors);
      }
    }
    return replay(input.getHeaders(), body);
  }

  private static HttpInputMessage replay(HttpHeaders headers, byte[] body) {
    return new HttpInputMessage() {
      @Override
      public InputStream getBody() {
        return new ByteArrayInputStream(body);
      }

      @Override
      public HttpHeaders getHeaders() {
        return headers;
      }
    };
  }
}
