package com.example.auth.service;

import java.util.Locale;

public enum LoginMethod {
  ANONYMOUS,
  INTERNET_IDENTITY,
  OAUTH;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
