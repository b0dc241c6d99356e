package com.example.auth.service;

import com.example.auth.config.AuthSecretProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConfiguredSecretStore implements SecretStore {

  private final AuthSecretProperties properties;

  @Override
  public String get(SecretName name) {
    final String value =
        switch (name) {
          case ACCESS_TOKEN_SALT -> properties.accessTokenSalt();
          case JWT_SECRET_KEY -> properties.jwtSecretKey();
        };
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("secret " + name + " is not configured");
    }
    return value;
  }
}
