package com.example.auth.service;

import com.example.auth.model.AuditLogRecord;
import com.example.auth.repository.AuditLogRepository;
import com.example.auth.repository.PropertyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AdminSignupService {

  static final String ACTION_UPDATE_SIGNUP_POLICY = "UPDATE_SIGNUP_POLICY";

  private static final Logger logger = LoggerFactory.getLogger(AdminSignupService.class);

  private final PropertyRepository propertyRepository;
  private final AuditLogRepository auditLogRepository;
  private final SignupPolicy signupPolicy;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  public boolean isSignupEnabled() {
    return signupPolicy.isSignupEnabled();
  }

  @Transactional
  public boolean updateSignupEnabled(String actorUserId, boolean enabled) {
    if (actorUserId == null || actorUserId.isBlank()) {
      throw new IllegalArgumentException("actor_user_id is required");
    }

    final Instant now = Instant.now(clock);
    propertyRepository.upsert(
        PropertySignupPolicy.PROPERTY_IS_USER_SIGNUP_ENABLED, toJson(enabled), now);

    final AuditLogRecord audit =
        new AuditLogRecord(
            UUID.randomUUID().toString(),
            actorUserId,
            ACTION_UPDATE_SIGNUP_POLICY,
            PropertySignupPolicy.PROPERTY_IS_USER_SIGNUP_ENABLED,
            toJson(Map.of("enabled", enabled)),
            now);
    auditLogRepository.insert(audit);
    logger.info("signup policy updated enabled={} actorUserId={}", enabled, actorUserId);
    return enabled;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize signup property", e);
    }
  }
}
