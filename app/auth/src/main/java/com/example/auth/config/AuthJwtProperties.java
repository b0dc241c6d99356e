package com.example.auth.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.jwt")
public record AuthJwtProperties(Duration expiresIn, String issuer) {

  public AuthJwtProperties {
    expiresIn = expiresIn == null ? Duration.ofDays(180) : expiresIn;
    issuer = issuer == null ? "" : issuer;
  }
}
