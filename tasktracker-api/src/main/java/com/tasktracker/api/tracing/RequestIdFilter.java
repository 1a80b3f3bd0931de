package com.tasktracker.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds a stable correlation id for every HTTP request.
 *
 * - Reads request id from X-Request-Id (if provided), otherwise generates a UUID
 * - Stores it in MDC for the duration of the request
 * - Echoes it back in response header X-Request-Id
 * - Logs one line per request with status and duration
 *
 * Runs ahead of the security filters so rejected requests are correlated too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String reqId = firstNonBlank(request.getHeader(HDR_REQUEST_ID), request.getHeader("X-Correlation-Id"));
    if (reqId == null) reqId = UUID.randomUUID().toString();

    MDC.put(MDC_REQUEST_ID, reqId);
    response.setHeader(HDR_REQUEST_ID, reqId);

    long t0 = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } finally {
      log.info("[HTTP] {} {} -> {} ({}ms)",
          request.getMethod(), request.getRequestURI(), response.getStatus(), System.currentTimeMillis() - t0);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) return a.trim();
    if (b != null && !b.isBlank()) return b.trim();
    return null;
  }
}
