package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.internal-api")
public record AuthInternalApiProperties(
    String headerName, String token, String userIdHeaderName, String userRolesHeaderName) {

  public AuthInternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userRolesHeaderName =
        userRolesHeaderName == null || userRolesHeaderName.isBlank()
            ? "X-User-Roles"
            : userRolesHeaderName;
  }

  @Override
  public String toString() {
    return "AuthInternalApiProperties[headerName="
        + headerName
        + ", token=***, userIdHeaderName="
        + userIdHeaderName
        + ", userRolesHeaderName="
        + userRolesHeaderName
        + "]";
  }
}
