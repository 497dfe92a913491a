package com.eyegaze.heatmapapi.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    boolean failed = true;
    try {
      filterChain.doFilter(request, response);
      failed = false;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      int status = failed ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : response.getStatus();
      String line = "HTTP {} {} from {} -> {} ({} ms)";
      Object[] args = {request.getMethod(), requestUriWithQuery(request), clientIp(request),
          status, duration};
      if (status >= 500) {
        log.warn(line, args);
      } else if (isHealthCheck(request)) {
        log.debug(line, args);
      } else {
        log.info(line, args);
      }
    }
  }

  static boolean isHealthCheck(HttpServletRequest request) {
    String uri = request.getRequestURI();
    return uri.startsWith("/actuator/health") || uri.equals("/v1/ping");
  }

  static String requestUriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
