package com.example.auth.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates service-to-service calls carrying the shared internal token: the OAuth gateway
 * validating a provider login, and operator requests under {@code /admin/}.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";
  private static final String OAUTH_GATEWAY_PRINCIPAL = "oauth-gateway-internal";

  private final AuthInternalApiProperties properties;

  public InternalApiAuthenticationFilter(AuthInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isOAuthValidateRequest(request) && !isAdminRequest(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (shouldRejectAdminRequestForMissingUserId(request)) {
      logger.warn(
          "internal admin request rejected: missing required header {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for protected path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isOAuthValidateRequest(HttpServletRequest request) {
    return "POST".equals(request.getMethod())
        && "/auth/oauth:validate".equals(request.getRequestURI());
  }

  private boolean isAdminRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/admin/");
  }

  private boolean shouldRejectAdminRequestForMissingUserId(HttpServletRequest request) {
    if (!isAdminRequest(request)) {
      return false;
    }
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      return false;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    return forwardedUserId == null || forwardedUserId.isBlank();
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      return null;
    }

    if (isOAuthValidateRequest(request)) {
      return new UsernamePasswordAuthenticationToken(
          OAUTH_GATEWAY_PRINCIPAL, "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE)));
    }

    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    return new UsernamePasswordAuthenticationToken(
        forwardedUserId,
        "N/A",
        buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
  }

  private boolean isValidInternalToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));

    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }

    for (String role : forwardedRoles.split(",")) {
      final String normalized = role == null ? "" : role.trim();
      if ("ADMIN".equals(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
      }
    }
    return authorities;
  }
}
