package com.tasktracker.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasktracker.api.common.ErrorBodies;
import com.tasktracker.domain.AuthenticationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Renders 401 / 403 from the security filter chain in the same JSON envelope the
 * controllers use. These responses are written before any controller or storage
 * code runs.
 */
@Component
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  private static final Logger log = LoggerFactory.getLogger(JsonSecurityErrorHandler.class);

  private final ObjectMapper om;

  public JsonSecurityErrorHandler(ObjectMapper om) {
    this.om = om;
  }

  @Override
  public void commence(HttpServletRequest req, HttpServletResponse res, AuthenticationException ex)
      throws IOException {
    if (ex instanceof InvalidBearerTokenException) {
      log.debug("[AUTH] rejected bearer token on {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getMessage());
      res.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
      write(res, HttpServletResponse.SC_UNAUTHORIZED,
          ErrorBodies.error("token_not_valid", AuthenticationFailedException.INVALID_TOKEN));
      return;
    }
    res.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    write(res, HttpServletResponse.SC_UNAUTHORIZED,
        ErrorBodies.error("not_authenticated", "Authentication credentials were not provided."));
  }

  @Override
  public void handle(HttpServletRequest req, HttpServletResponse res, AccessDeniedException ex)
      throws IOException {
    write(res, HttpServletResponse.SC_FORBIDDEN,
        ErrorBodies.error("permission_denied", "You do not have permission to perform this action."));
  }

  private void write(HttpServletResponse res, int status, Map<String, Object> body) throws IOException {
    res.setStatus(status);
    res.setContentType(MediaType.APPLICATION_JSON_VALUE);
    om.writeValue(res.getWriter(), body);
  }
}
