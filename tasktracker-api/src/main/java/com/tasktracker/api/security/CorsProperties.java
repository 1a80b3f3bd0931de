package com.tasktracker.api.security;

import java.util.Arrays;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Browser origins allowed to call the API.
 *
 * Comma-separated, "*" allows any origin.
 */
@ConfigurationProperties(prefix = "tasktracker.cors")
public record CorsProperties(@DefaultValue("*") String allowedOrigins) {

  public List<String> allowedOriginList() {
    if (allowedOrigins == null || allowedOrigins.isBlank()) {
      return List.of();
    }
    return Arrays.stream(allowedOrigins.split(","))
        .map(String::trim)
        .filter(s -> !s.isBlank())
        .toList();
  }
}
