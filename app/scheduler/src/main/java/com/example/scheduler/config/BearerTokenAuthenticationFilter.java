package com.example.scheduler.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String API_CLIENT_PRINCIPAL = "scheduler-api-client";
  private static final String API_CLIENT_ROLE = "ROLE_API_CLIENT";

  private final SchedulerApiProperties properties;

  public BearerTokenAuthenticationFilter(SchedulerApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(properties.headerName());
    if (header == null || header.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }
    if (!header.startsWith(BEARER_PREFIX)) {
      logger.debug("invalid authorization format on path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    final String token = header.substring(BEARER_PREFIX.length()).trim();
    if (isValidToken(token)) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              API_CLIENT_PRINCIPAL, "N/A", List.of(new SimpleGrantedAuthority(API_CLIENT_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.warn("bearer token rejected on path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  // 設定トークンが空の場合は常に拒否する
  private boolean isValidToken(String actualToken) {
    if (properties.token().isBlank() || actualToken.isEmpty()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
