package com.example.auth.service;

import com.example.auth.config.AuthSignupProperties;
import com.example.auth.repository.PropertyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Reads the operator controlled signup switch from the property store. */
@Service
@RequiredArgsConstructor
public class PropertySignupPolicy implements SignupPolicy {

  public static final String PROPERTY_IS_USER_SIGNUP_ENABLED = "IS_USER_SIGNUP_ENABLED";

  private static final Logger logger = LoggerFactory.getLogger(PropertySignupPolicy.class);

  private final PropertyRepository propertyRepository;
  private final AuthSignupProperties signupProperties;
  private final ObjectMapper objectMapper;

  @Override
  public boolean isSignupEnabled() {
    final Optional<String> stored = propertyRepository.findValue(PROPERTY_IS_USER_SIGNUP_ENABLED);
    if (stored.isEmpty()) {
      logger.debug(
          "property {} is not set, using default={}",
          PROPERTY_IS_USER_SIGNUP_ENABLED,
          signupProperties.defaultEnabled());
      return signupProperties.defaultEnabled();
    }
    return decode(stored.get());
  }

  private boolean decode(String json) {
    try {
      final Boolean value = objectMapper.readValue(json, Boolean.class);
      if (value == null) {
        return signupProperties.defaultEnabled();
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "property " + PROPERTY_IS_USER_SIGNUP_ENABLED + " is not a boolean", ex);
    }
  }
}
