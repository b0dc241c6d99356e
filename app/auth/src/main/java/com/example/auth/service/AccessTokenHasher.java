package com.example.auth.service;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * Derives the stored form of an anonymous access token: HMAC-SHA512 keyed with the salt, as
 * lowercase hex. The raw token is never stored.
 */
@Component
public class AccessTokenHasher {

  public String deriveAccessToken(String rawToken, String salt) {
    if (rawToken == null || rawToken.isEmpty()) {
      throw new IllegalArgumentException("access token is required");
    }
    if (salt == null || salt.isEmpty()) {
      throw new IllegalStateException("access token salt is empty");
    }
    return Hashing.hmacSha512(salt.getBytes(StandardCharsets.UTF_8))
        .hashString(rawToken, StandardCharsets.UTF_8)
        .toString();
  }
}
