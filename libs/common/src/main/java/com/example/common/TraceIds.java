package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final int MAX_INBOUND_LENGTH = 128;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the inbound id when it is usable, otherwise a freshly generated one. */
  public static String resolve(String inbound) {
    if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
      return newTraceId();
    }
    return inbound.trim();
  }
}
