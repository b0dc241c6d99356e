package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.secrets")
public record AuthSecretProperties(String accessTokenSalt, String jwtSecretKey) {

  public AuthSecretProperties {
    accessTokenSalt = accessTokenSalt == null ? "" : accessTokenSalt;
    jwtSecretKey = jwtSecretKey == null ? "" : jwtSecretKey;
  }

  @Override
  public String toString() {
    return "AuthSecretProperties[accessTokenSalt=***, jwtSecretKey=***]";
  }
}
